package me.internalizable.testenv.environment.readiness;

import javax.annotation.Nonnull;

/**
 * Checks whether a port accepts connections.
 */
@FunctionalInterface
public interface PortProber {

    /**
     * Try to connect. Any connection made is closed before returning.
     *
     * @param host host to connect to
     * @param port port to connect to
     * @return true if the connection succeeded
     */
    boolean canConnect(@Nonnull String host, int port);
}
