package me.internalizable.testenv.environment.route;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * An in-memory document served verbatim.
 */
public final class DocumentRoute {

    private final String method;
    private final String route;
    private final byte[] body;
    private final String contentType;

    public DocumentRoute(@Nonnull String method, @Nonnull String route, @Nonnull byte[] body, @Nonnull String contentType) {
        this.method = Objects.requireNonNull(method, "method");
        this.route = Objects.requireNonNull(route, "route");
        this.body = Arrays.copyOf(Objects.requireNonNull(body, "body"), body.length);
        this.contentType = Objects.requireNonNull(contentType, "contentType");
    }

    @Nonnull
    public String getMethod() {
        return method;
    }

    @Nonnull
    public String getRoute() {
        return route;
    }

    @Nonnull
    public byte[] getBody() {
        return Arrays.copyOf(body, body.length);
    }

    @Nonnull
    public String getBodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Nonnull
    public String getContentType() {
        return contentType;
    }

    @Override
    public String toString() {
        return "DocumentRoute{" + method + " " + route + ", " + body.length + " bytes}";
    }
}
