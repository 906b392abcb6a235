package me.internalizable.testenv.environment.route;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A URL prefix served from a directory.
 *
 * @param urlBase URL prefix
 * @param path directory, or null for the configured document root
 */
public record MountPoint(@Nonnull String urlBase, @Nullable Path path) {

    public MountPoint {
        Objects.requireNonNull(urlBase, "urlBase");
    }
}
