package me.internalizable.testenv.environment.readiness;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;

/**
 * Probes a port with a TCP connect bounded by a short timeout.
 */
public class SocketPortProber implements PortProber {

    private final int timeoutMillis;

    public SocketPortProber(@Nonnull Duration timeout) {
        this.timeoutMillis = (int) Objects.requireNonNull(timeout, "timeout").toMillis();
    }

    @Override
    public boolean canConnect(@Nonnull String host, int port) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), timeoutMillis);
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
