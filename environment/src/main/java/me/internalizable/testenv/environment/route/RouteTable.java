package me.internalizable.testenv.environment.route;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes and mount points handed to the server fleet.
 */
public final class RouteTable {

    private final List<StaticRoute> staticRoutes;
    private final List<DocumentRoute> documentRoutes;
    private final List<MountPoint> mountPoints;

    RouteTable(List<StaticRoute> staticRoutes, List<DocumentRoute> documentRoutes, List<MountPoint> mountPoints) {
        this.staticRoutes = List.copyOf(staticRoutes);
        this.documentRoutes = List.copyOf(documentRoutes);
        this.mountPoints = List.copyOf(mountPoints);
    }

    @Nonnull
    public List<StaticRoute> getStaticRoutes() {
        return staticRoutes;
    }

    @Nonnull
    public List<DocumentRoute> getDocumentRoutes() {
        return documentRoutes;
    }

    @Nonnull
    public List<MountPoint> getMountPoints() {
        return mountPoints;
    }

    /**
     * Render the table as plain data for serialization. Document bodies are
     * included as text.
     *
     * @return a new map
     */
    @Nonnull
    public Map<String, Object> toMap() {
        List<Map<String, Object>> statics = new ArrayList<>();
        for (StaticRoute route : staticRoutes) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("route", route.route());
            entry.put("file", route.file().toString());
            entry.put("format_args", route.formatArgs());
            entry.put("content_type", route.contentType());
            entry.put("headers", route.headers());
            statics.add(entry);
        }

        List<Map<String, Object>> documents = new ArrayList<>();
        for (DocumentRoute route : documentRoutes) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("method", route.getMethod());
            entry.put("route", route.getRoute());
            entry.put("content_type", route.getContentType());
            entry.put("body", route.getBodyText());
            documents.add(entry);
        }

        List<Map<String, Object>> mounts = new ArrayList<>();
        for (MountPoint mount : mountPoints) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("url_base", mount.urlBase());
            entry.put("path", mount.path() != null ? mount.path().toString() : null);
            mounts.add(entry);
        }

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("static", statics);
        map.put("documents", documents);
        map.put("mount_points", mounts);
        return map;
    }
}
