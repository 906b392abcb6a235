package me.internalizable.testenv.environment.readiness;

import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SocketPortProberTest {

    private final SocketPortProber prober = new SocketPortProber(Duration.ofMillis(100));

    @Test
    void connectsToListeningPort() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            assertTrue(prober.canConnect("127.0.0.1", server.getLocalPort()));
        }
    }

    @Test
    void rejectsClosedPort() throws Exception {
        int port;
        try (ServerSocket server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            port = server.getLocalPort();
        }
        assertFalse(prober.canConnect("127.0.0.1", port));
    }
}
