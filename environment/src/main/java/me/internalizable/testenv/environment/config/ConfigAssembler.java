package me.internalizable.testenv.environment.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.internalizable.testenv.api.EffectiveConfig;
import me.internalizable.testenv.api.EnvironmentOptions;
import me.internalizable.testenv.api.ServerLogger;
import me.internalizable.testenv.environment.ConfigurationException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the effective configuration of an environment scope.
 *
 * <p>Merge order: the default port table (plus the QUIC transport port when
 * enabled), then the {@code config.json} override found in the root test
 * path, then the caller's TLS settings and options.</p>
 */
public class ConfigAssembler {

    public static final String OVERRIDE_FILE = "config.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final BigInteger MAX_PORT = BigInteger.valueOf(65535);

    private final TestPaths testPaths;
    private final EnvironmentOptions options;
    private final Map<String, Object> tlsOptions;
    private final boolean enableQuic;

    /**
     * Create an assembler.
     *
     * @param testPaths test paths; the root entry locates the override document
     * @param options caller options
     * @param tlsOptions TLS settings to hand to the servers
     * @param enableQuic whether to configure the QUIC transport
     */
    public ConfigAssembler(
            @Nonnull TestPaths testPaths,
            @Nonnull EnvironmentOptions options,
            @Nonnull Map<String, Object> tlsOptions,
            boolean enableQuic) {
        this.testPaths = Objects.requireNonNull(testPaths, "testPaths");
        this.options = Objects.requireNonNull(options, "options");
        this.tlsOptions = new LinkedHashMap<>(Objects.requireNonNull(tlsOptions, "tlsOptions"));
        this.enableQuic = enableQuic;
    }

    /**
     * The port table used before any override applies.
     *
     * @param enableQuic whether to include the QUIC transport
     * @return a new mutable port table
     */
    @Nonnull
    public static Map<String, Object> defaultPorts(boolean enableQuic) {
        Map<String, Object> ports = new LinkedHashMap<>();
        ports.put("http", new ArrayList<>(List.of(8000, 8001)));
        ports.put("https", new ArrayList<>(List.of(8443, 8444)));
        ports.put("ws", new ArrayList<>(List.of(8888)));
        ports.put("wss", new ArrayList<>(List.of(8889)));
        ports.put("h2", new ArrayList<>(List.of(9000)));
        if (enableQuic) {
            ports.put(EffectiveConfig.QUIC_SCHEME, new ArrayList<>(List.of(10000)));
        }
        return ports;
    }

    /**
     * Assemble the configuration.
     *
     * @param logger logger for diagnostics
     * @return the effective configuration
     * @throws ConfigurationException if the override document is unreadable or malformed
     */
    @Nonnull
    public EffectiveConfig assemble(@Nonnull ServerLogger logger) {
        Objects.requireNonNull(logger, "logger");

        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put(EffectiveConfig.PORTS, defaultPorts(enableQuic));

        Path root = testPaths.getRoot();
        Path overridePath = root != null ? root.resolve(OVERRIDE_FILE) : null;
        if (overridePath != null && Files.exists(overridePath)) {
            Map<String, Object> override = readOverride(overridePath);
            deepMerge(tree, override);
            logger.debug("Applied config override", overridePath.toString());
        }

        EffectiveConfig.Builder builder = EffectiveConfig.builder();
        Path source = overridePath != null ? overridePath : Path.of(OVERRIDE_FILE);
        applyPorts(builder, tree.remove(EffectiveConfig.PORTS), source);

        builder.checkSubdomains(false);
        tree.remove(EffectiveConfig.CHECK_SUBDOMAINS);

        Map<String, Object> tls = new LinkedHashMap<>(tlsOptions);
        tls.put(EffectiveConfig.ENCRYPT_AFTER_CONNECT, options.isEncryptAfterConnect());
        builder.tlsSettings(tls);
        tree.remove(EffectiveConfig.SSL);

        Object browserHost = tree.remove(EffectiveConfig.BROWSER_HOST);
        if (options.getBrowserHost() != null) {
            builder.browserHost(options.getBrowserHost());
        } else if (browserHost != null) {
            builder.browserHost(browserHost.toString());
        }

        Object bindAddress = tree.remove(EffectiveConfig.BIND_ADDRESS);
        if (options.getBindAddress() != null) {
            builder.bindAddress(options.getBindAddress());
        } else if (bindAddress != null) {
            builder.bindAddress(Boolean.parseBoolean(bindAddress.toString()));
        }

        Object serverHost = tree.remove(EffectiveConfig.SERVER_HOST);
        if (options.getServerHost() != null) {
            builder.serverHost(options.getServerHost());
        } else if (serverHost != null) {
            builder.serverHost(serverHost.toString());
        }

        tree.remove(EffectiveConfig.DOC_ROOT);
        builder.docRoot(root);

        tree.forEach(builder::additional);

        EffectiveConfig config = builder.build();
        logger.info("Server ports", config.getPorts().toString());
        return config;
    }

    private static Map<String, Object> readOverride(Path path) {
        try {
            Map<String, Object> override = MAPPER.readValue(Files.readAllBytes(path), MAP_TYPE);
            if (override == null) {
                throw new ConfigurationException(path, "Config override is not a JSON object", null);
            }
            return override;
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(path, "Malformed config override", e);
        } catch (IOException e) {
            throw new ConfigurationException(path, "Unable to read config override", e);
        }
    }

    /**
     * Merge {@code override} into {@code base}. Nested objects merge key by key;
     * any other value replaces the base value.
     *
     * @param base tree to update in place
     * @param override values taking precedence
     */
    @SuppressWarnings("unchecked")
    static void deepMerge(@Nonnull Map<String, Object> base, @Nonnull Map<String, Object> override) {
        for (Map.Entry<String, Object> entry : override.entrySet()) {
            Object current = base.get(entry.getKey());
            Object value = entry.getValue();
            if (current instanceof Map && value instanceof Map) {
                Map<String, Object> merged = new LinkedHashMap<>((Map<String, Object>) current);
                deepMerge(merged, (Map<String, Object>) value);
                base.put(entry.getKey(), merged);
            } else {
                base.put(entry.getKey(), value);
            }
        }
    }

    private static void applyPorts(EffectiveConfig.Builder builder, @Nullable Object ports, Path source) {
        if (!(ports instanceof Map)) {
            throw new ConfigurationException(source, "'ports' must be an object", null);
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) ports).entrySet()) {
            String scheme = String.valueOf(entry.getKey());
            builder.ports(scheme, toPortList(scheme, entry.getValue(), source));
        }
        for (String scheme : EffectiveConfig.BASELINE_SCHEMES) {
            if (!((Map<?, ?>) ports).containsKey(scheme)) {
                throw new ConfigurationException(source, "Missing ports for scheme '" + scheme + "'", null);
            }
        }
    }

    private static List<Integer> toPortList(String scheme, @Nullable Object value, Path source) {
        List<Integer> result = new ArrayList<>();
        if (value instanceof Number) {
            result.add(toPort(scheme, value, source));
            return result;
        }
        if (!(value instanceof List)) {
            throw new ConfigurationException(source, "Ports for scheme '" + scheme + "' must be a list", null);
        }
        for (Object port : (List<?>) value) {
            result.add(toPort(scheme, port, source));
        }
        return result;
    }

    private static int toPort(String scheme, @Nullable Object port, Path source) {
        boolean integral = port instanceof Integer || port instanceof Long
                || port instanceof Short || port instanceof Byte || port instanceof BigInteger;
        if (!integral) {
            throw new ConfigurationException(source, "Invalid port '" + port + "' for scheme '" + scheme + "'", null);
        }
        BigInteger number = port instanceof BigInteger
                ? (BigInteger) port
                : BigInteger.valueOf(((Number) port).longValue());
        if (number.signum() < 0 || number.compareTo(MAX_PORT) > 0) {
            throw new ConfigurationException(source,
                    "Port " + number + " for scheme '" + scheme + "' is out of range", null);
        }
        return number.intValue();
    }
}
