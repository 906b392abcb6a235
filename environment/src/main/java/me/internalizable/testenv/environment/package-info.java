/**
 * Lifecycle of a protocol test server environment.
 *
 * <p>{@link me.internalizable.testenv.environment.TestEnvironment} acquires
 * logging, configuration, shared resources, extra subsystems and the server
 * fleet on entry and releases them in reverse order on exit. Only one
 * environment may be active per process.</p>
 *
 * @see me.internalizable.testenv.environment.TestEnvironment
 * @see me.internalizable.testenv.environment.ActiveScope
 */
package me.internalizable.testenv.environment;
