package me.internalizable.testenv.environment.fleet;

import me.internalizable.testenv.api.EffectiveConfig;
import me.internalizable.testenv.environment.FleetStartException;
import me.internalizable.testenv.environment.route.RouteTable;

import javax.annotation.Nonnull;

/**
 * Starts the protocol servers of a scope.
 *
 * <p>Startup is fail-fast: a launcher that cannot spawn every server stops
 * the ones it did spawn and throws. Whether the servers come up is checked
 * separately by the readiness poller.</p>
 */
@FunctionalInterface
public interface FleetLauncher {

    /**
     * Start one server per configured port.
     *
     * @param config effective configuration
     * @param routes routes to serve
     * @param context scope services
     * @return the started fleet
     * @throws FleetStartException if any server cannot be spawned
     */
    @Nonnull
    ServerFleet start(@Nonnull EffectiveConfig config, @Nonnull RouteTable routes, @Nonnull FleetContext context);
}
