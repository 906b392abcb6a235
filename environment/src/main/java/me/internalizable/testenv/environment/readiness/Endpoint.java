package me.internalizable.testenv.environment.readiness;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A port qualified by either a scheme (dead servers) or a host (unreachable ports).
 *
 * @param name scheme or host
 * @param port port
 */
public record Endpoint(@Nonnull String name, int port) {

    public Endpoint {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
        return name + ":" + port;
    }
}
