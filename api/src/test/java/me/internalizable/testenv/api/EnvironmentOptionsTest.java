package me.internalizable.testenv.api;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentOptionsTest {

    @Test
    void defaultsLeaveEverythingUnset() {
        EnvironmentOptions options = EnvironmentOptions.defaults();

        assertTrue(options.isTestServerPort());
        assertFalse(options.isSupportsDebugger());
        assertFalse(options.isEncryptAfterConnect());
        assertNull(options.getBindAddress());
        assertNull(options.getBrowserHost());
        assertFalse(options.contains(EnvironmentOptions.BROWSER_HOST));
    }

    @Test
    void parsesFreeFormValues() {
        EnvironmentOptions options = EnvironmentOptions.fromMap(Map.of(
                "test_server_port", "false",
                "bind_address", "true",
                "supports_debugger", Boolean.TRUE,
                "browser_host", "web-platform.test",
                "custom_flag", 3));

        assertFalse(options.isTestServerPort());
        assertEquals(Boolean.TRUE, options.getBindAddress());
        assertTrue(options.isSupportsDebugger());
        assertEquals("web-platform.test", options.getBrowserHost());
        assertEquals(3, options.get("custom_flag"));
    }

    @Test
    void builderClearsOptionsSetToNull() {
        EnvironmentOptions options = EnvironmentOptions.builder()
                .browserHost("a.test")
                .browserHost(null)
                .serverHost("127.0.0.1")
                .build();

        assertFalse(options.contains(EnvironmentOptions.BROWSER_HOST));
        assertEquals("127.0.0.1", options.getServerHost());
    }

    @Test
    void isImmutable() {
        EnvironmentOptions options = EnvironmentOptions.builder().option("x", 1).build();

        assertThrows(UnsupportedOperationException.class, () -> options.asMap().put("y", 2));
    }
}
