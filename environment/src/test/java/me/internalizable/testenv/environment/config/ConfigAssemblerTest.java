package me.internalizable.testenv.environment.config;

import me.internalizable.testenv.api.EffectiveConfig;
import me.internalizable.testenv.api.EnvironmentOptions;
import me.internalizable.testenv.environment.ConfigurationException;
import me.internalizable.testenv.environment.logging.LogQueue;
import me.internalizable.testenv.environment.logging.LoggerProxy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConfigAssemblerTest {

    @TempDir
    Path testsRoot;

    private final LoggerProxy logger = new LoggerProxy("server", new LogQueue());

    private EffectiveConfig assemble(EnvironmentOptions options, boolean enableQuic) {
        return new ConfigAssembler(TestPaths.root(testsRoot), options, Map.of("type", "none"), enableQuic)
                .assemble(logger);
    }

    private void writeOverride(String json) throws IOException {
        Files.write(testsRoot.resolve(ConfigAssembler.OVERRIDE_FILE), json.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("Ports")
    class Ports {

        @Test
        @DisplayName("has every baseline scheme without an override")
        void baselineSchemes() {
            EffectiveConfig config = assemble(EnvironmentOptions.defaults(), false);

            assertEquals(EffectiveConfig.BASELINE_SCHEMES, config.getPorts().keySet());
            assertEquals(List.of(8000, 8001), config.getPorts("http"));
            assertEquals(List.of(8443, 8444), config.getPorts("https"));
            assertEquals(List.of(8888), config.getPorts("ws"));
            assertEquals(List.of(8889), config.getPorts("wss"));
            assertEquals(List.of(9000), config.getPorts("h2"));
        }

        @Test
        @DisplayName("includes the QUIC transport only when enabled")
        void quicToggle() {
            assertFalse(assemble(EnvironmentOptions.defaults(), false).getPorts().containsKey("quic-transport"));
            assertEquals(List.of(10000), assemble(EnvironmentOptions.defaults(), true).getPorts("quic-transport"));
        }

        @Test
        @DisplayName("lets the override replace one scheme and keep the rest")
        void overrideReplacesScheme() throws IOException {
            writeOverride("{\"ports\": {\"http\": [9999]}}");

            EffectiveConfig config = assemble(EnvironmentOptions.defaults(), false);

            assertEquals(List.of(9999), config.getPorts("http"));
            assertEquals(List.of(8443, 8444), config.getPorts("https"));
        }

        @Test
        void acceptsSinglePortNumber() throws IOException {
            writeOverride("{\"ports\": {\"h2\": 9001}}");

            assertEquals(List.of(9001), assemble(EnvironmentOptions.defaults(), false).getPorts("h2"));
        }

        @Test
        void rejectsNonNumericPort() throws IOException {
            writeOverride("{\"ports\": {\"ws\": [\"eighty\"]}}");

            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> assemble(EnvironmentOptions.defaults(), false));
            assertTrue(e.getMessage().contains("eighty"));
        }

        @Test
        @DisplayName("rejects a port too large to fit in an int")
        void rejectsHugePort() throws IOException {
            writeOverride("{\"ports\": {\"http\": [4294975296]}}");

            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> assemble(EnvironmentOptions.defaults(), false));
            assertTrue(e.getMessage().contains("4294975296"), e.getMessage());
        }

        @Test
        void rejectsFractionalPort() throws IOException {
            writeOverride("{\"ports\": {\"wss\": [8889.5]}}");

            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> assemble(EnvironmentOptions.defaults(), false));
            assertTrue(e.getMessage().contains("8889.5"), e.getMessage());
        }

        @Test
        void rejectsPortOutsideTcpRange() throws IOException {
            writeOverride("{\"ports\": {\"h2\": 70000}}");

            assertThrows(ConfigurationException.class, () -> assemble(EnvironmentOptions.defaults(), false));

            writeOverride("{\"ports\": {\"h2\": [-1]}}");

            assertThrows(ConfigurationException.class, () -> assemble(EnvironmentOptions.defaults(), false));
        }

        @Test
        void acceptsTcpRangeBounds() throws IOException {
            writeOverride("{\"ports\": {\"http\": [0, 65535]}}");

            assertEquals(List.of(0, 65535), assemble(EnvironmentOptions.defaults(), false).getPorts("http"));
        }
    }

    @Nested
    @DisplayName("Override document")
    class Override {

        @Test
        @DisplayName("fails with the file path when malformed")
        void malformedOverride() throws IOException {
            writeOverride("{\"ports\": ");
            Path overridePath = testsRoot.resolve(ConfigAssembler.OVERRIDE_FILE);

            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> assemble(EnvironmentOptions.defaults(), false));

            assertEquals(overridePath, e.getPath());
            assertTrue(e.getMessage().contains(overridePath.toString()));
            assertNotNull(e.getCause());
        }

        @Test
        void rejectsNonObjectDocument() throws IOException {
            writeOverride("[1, 2]");

            assertThrows(ConfigurationException.class, () -> assemble(EnvironmentOptions.defaults(), false));
        }

        @Test
        @DisplayName("keeps unknown keys and never enables subdomain checks")
        void additionalKeys() throws IOException {
            writeOverride("{\"check_subdomains\": true, \"alternate_hosts\": {\"alt\": \"not-web-platform.test\"}}");

            EffectiveConfig config = assemble(EnvironmentOptions.defaults(), false);

            assertFalse(config.isCheckSubdomains());
            assertEquals(Map.of("alt", "not-web-platform.test"), config.get("alternate_hosts"));
            assertNull(config.get("check_subdomains"));
        }

        @Test
        void mergesNestedObjects() {
            Map<String, Object> base = new LinkedHashMap<>();
            base.put("ports", new LinkedHashMap<>(Map.of("http", List.of(8000), "ws", List.of(8888))));
            base.put("browser_host", "localhost");

            ConfigAssembler.deepMerge(base, Map.of(
                    "ports", Map.of("ws", List.of(1234)),
                    "browser_host", "web-platform.test"));

            assertEquals(Map.of("http", List.of(8000), "ws", List.of(1234)), base.get("ports"));
            assertEquals("web-platform.test", base.get("browser_host"));
        }
    }

    @Nested
    @DisplayName("Options")
    class Options {

        @Test
        @DisplayName("apply after the override")
        void optionsWin() throws IOException {
            writeOverride("{\"browser_host\": \"override.test\", \"server_host\": \"10.0.0.1\", \"bind_address\": true}");
            EnvironmentOptions options = EnvironmentOptions.builder()
                    .browserHost("web-platform.test")
                    .bindAddress(false)
                    .encryptAfterConnect(true)
                    .build();

            EffectiveConfig config = assemble(options, false);

            assertEquals("web-platform.test", config.getBrowserHost());
            assertEquals("10.0.0.1", config.getServerHost());
            assertFalse(config.isBindAddress());
            assertTrue(config.isEncryptAfterConnect());
            assertEquals("none", config.getTlsSettings().get("type"));
        }

        @Test
        @DisplayName("fall back to defaults when nothing is set")
        void defaults() {
            EffectiveConfig config = assemble(EnvironmentOptions.defaults(), false);

            assertEquals("localhost", config.getBrowserHost());
            assertEquals("localhost", config.getServerHost());
            assertTrue(config.isBindAddress());
            assertFalse(config.isEncryptAfterConnect());
            assertEquals(testsRoot, config.getDocRoot());
        }

        @Test
        void noRootMeansNoOverrideAndNoDocRoot() {
            EffectiveConfig config = new ConfigAssembler(
                    TestPaths.of(Map.of("/extra/", testsRoot)), EnvironmentOptions.defaults(), Map.of(), false)
                    .assemble(logger);

            assertNull(config.getDocRoot());
            assertEquals(Set.of("http", "https", "ws", "wss", "h2"), config.getPorts().keySet());
        }
    }
}
