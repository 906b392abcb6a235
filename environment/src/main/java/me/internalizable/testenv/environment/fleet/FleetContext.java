package me.internalizable.testenv.environment.fleet;

import me.internalizable.testenv.api.ServerLogger;
import me.internalizable.testenv.environment.shared.SharedCache;
import me.internalizable.testenv.environment.shared.StashServer;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Scope services available to a fleet launcher.
 *
 * @param logger log handle for the servers
 * @param workDirectory scratch directory owned by the config scope
 * @param stash stash of this scope
 * @param cache shared cache of this scope
 */
public record FleetContext(
        @Nonnull ServerLogger logger,
        @Nonnull Path workDirectory,
        @Nonnull StashServer stash,
        @Nonnull SharedCache cache) {

    public FleetContext {
        Objects.requireNonNull(logger, "logger");
        Objects.requireNonNull(workDirectory, "workDirectory");
        Objects.requireNonNull(stash, "stash");
        Objects.requireNonNull(cache, "cache");
    }
}
