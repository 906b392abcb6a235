package me.internalizable.testenv.api;

import javax.annotation.Nonnull;

/**
 * Pluggable subsystem started alongside the server fleet.
 *
 * <p>Extras are started in the order they were registered, after the shared
 * resources and before the fleet, and released in reverse.</p>
 */
@FunctionalInterface
public interface EnvironmentExtra {

    /**
     * Start the subsystem.
     *
     * @param options the caller's option bag
     * @param config the effective configuration of this scope
     * @return scope releasing the subsystem
     * @throws Exception if the subsystem cannot start
     */
    @Nonnull
    ExtraScope start(@Nonnull EnvironmentOptions options, @Nonnull EffectiveConfig config) throws Exception;
}
