/**
 * Types shared between the test environment and its collaborators.
 *
 * <p>Server fleet implementations, extra subsystems and worker processes only
 * see the types in this package: the effective configuration, the option bag,
 * server handles and the producer-side log handle.</p>
 *
 * @see me.internalizable.testenv.api.EffectiveConfig
 * @see me.internalizable.testenv.api.ServerLogger
 */
package me.internalizable.testenv.api;
