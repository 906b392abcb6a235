package me.internalizable.testenv.environment.fleet;

import me.internalizable.testenv.api.ServerHandle;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One server of the fleet.
 *
 * @param scheme protocol scheme
 * @param port listening port
 * @param handle handle to the running server
 */
public record FleetEntry(@Nonnull String scheme, int port, @Nonnull ServerHandle handle) {

    public FleetEntry {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(handle, "handle");
    }
}
