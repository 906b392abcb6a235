package me.internalizable.testenv.environment.route;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collects routes for a {@link RouteTable}.
 *
 * <p>Starts with a default mount of the document root at {@code "/"}.</p>
 */
public class RoutesBuilder {

    private final List<StaticRoute> staticRoutes = new ArrayList<>();
    private final List<DocumentRoute> documentRoutes = new ArrayList<>();
    private final Map<String, MountPoint> mountPoints = new LinkedHashMap<>();

    public RoutesBuilder() {
        mountPoints.put("/", new MountPoint("/", null));
    }

    public RoutesBuilder addStatic(
            @Nonnull Path file,
            @Nullable Map<String, Object> formatArgs,
            @Nonnull String contentType,
            @Nonnull String route,
            @Nonnull Map<String, String> headers) {
        staticRoutes.add(new StaticRoute(route, file, formatArgs, contentType, headers));
        return this;
    }

    public RoutesBuilder addDocument(
            @Nonnull String method,
            @Nonnull String route,
            @Nonnull byte[] body,
            @Nonnull String contentType) {
        documentRoutes.add(new DocumentRoute(method, route, body, contentType));
        return this;
    }

    public RoutesBuilder addMountPoint(@Nonnull String urlBase, @Nonnull Path path) {
        Objects.requireNonNull(path, "path");
        mountPoints.put(urlBase, new MountPoint(urlBase, path));
        return this;
    }

    /**
     * Remove a mount point, including the default root mount.
     *
     * @param urlBase URL prefix
     * @return this builder
     */
    public RoutesBuilder removeMountPoint(@Nonnull String urlBase) {
        mountPoints.remove(urlBase);
        return this;
    }

    @Nonnull
    public RouteTable build() {
        return new RouteTable(staticRoutes, documentRoutes, new ArrayList<>(mountPoints.values()));
    }
}
