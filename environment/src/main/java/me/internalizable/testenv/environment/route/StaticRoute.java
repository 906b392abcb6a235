package me.internalizable.testenv.environment.route;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * A file served at a fixed route, optionally filled in with format arguments.
 *
 * @param route URL path
 * @param file file on disk
 * @param formatArgs template arguments, or null to serve the file as is
 * @param contentType response content type
 * @param headers extra response headers
 */
public record StaticRoute(
        @Nonnull String route,
        @Nonnull Path file,
        @Nullable Map<String, Object> formatArgs,
        @Nonnull String contentType,
        @Nonnull Map<String, String> headers) {

    public StaticRoute {
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(contentType, "contentType");
        formatArgs = formatArgs == null ? null : Map.copyOf(formatArgs);
        headers = Map.copyOf(headers);
    }
}
