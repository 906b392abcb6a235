package me.internalizable.testenv.api;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration shared by every server of one environment scope.
 *
 * <p>Assembled once when the scope is entered and immutable afterwards.
 * {@link #getPorts()} always has entries for the baseline schemes
 * ({@link #BASELINE_SCHEMES}); the QUIC transport entry is only present when
 * it was enabled.</p>
 */
public final class EffectiveConfig {

    public static final String PORTS = "ports";
    public static final String SSL = "ssl";
    public static final String CHECK_SUBDOMAINS = "check_subdomains";
    public static final String SERVER_HOST = "server_host";
    public static final String BIND_ADDRESS = "bind_address";
    public static final String BROWSER_HOST = "browser_host";
    public static final String DOC_ROOT = "doc_root";

    public static final String ENCRYPT_AFTER_CONNECT = "encrypt_after_connect";

    public static final Set<String> BASELINE_SCHEMES = Set.of("http", "https", "ws", "wss", "h2");
    public static final String QUIC_SCHEME = "quic-transport";

    private final Map<String, List<Integer>> ports;
    private final Map<String, Object> tlsSettings;
    private final boolean checkSubdomains;
    private final String serverHost;
    private final boolean bindAddress;
    private final String browserHost;
    private final Path docRoot;
    private final Map<String, Object> additional;

    private EffectiveConfig(Builder builder) {
        Map<String, List<Integer>> portCopy = new LinkedHashMap<>();
        builder.ports.forEach((scheme, list) ->
                portCopy.put(scheme, Collections.unmodifiableList(new ArrayList<>(list))));
        this.ports = Collections.unmodifiableMap(portCopy);
        this.tlsSettings = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tlsSettings));
        this.checkSubdomains = builder.checkSubdomains;
        this.serverHost = builder.serverHost;
        this.bindAddress = builder.bindAddress;
        this.browserHost = builder.browserHost;
        this.docRoot = builder.docRoot;
        this.additional = Collections.unmodifiableMap(new LinkedHashMap<>(builder.additional));
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the port table.
     *
     * @return ports per scheme, in scheme order
     */
    @Nonnull
    public Map<String, List<Integer>> getPorts() {
        return ports;
    }

    /**
     * Get the ports of one scheme.
     *
     * @param scheme the scheme
     * @return the ports, empty if the scheme is not configured
     */
    @Nonnull
    public List<Integer> getPorts(@Nonnull String scheme) {
        return ports.getOrDefault(scheme, List.of());
    }

    @Nonnull
    public Map<String, Object> getTlsSettings() {
        return tlsSettings;
    }

    public boolean isEncryptAfterConnect() {
        Object value = tlsSettings.get(ENCRYPT_AFTER_CONNECT);
        return value instanceof Boolean && (Boolean) value;
    }

    public boolean isCheckSubdomains() {
        return checkSubdomains;
    }

    /**
     * Host the servers are reached on. Falls back to the browser host.
     *
     * @return server host
     */
    @Nonnull
    public String getServerHost() {
        return serverHost != null ? serverHost : browserHost;
    }

    public boolean isBindAddress() {
        return bindAddress;
    }

    @Nonnull
    public String getBrowserHost() {
        return browserHost;
    }

    /**
     * Document root of the root test path.
     *
     * @return the document root, or null if no root test path was supplied
     */
    @Nullable
    public Path getDocRoot() {
        return docRoot;
    }

    /**
     * Get a key from the override document that has no dedicated field.
     *
     * @param key top-level key
     * @return the value, or null
     */
    @Nullable
    public Object get(@Nonnull String key) {
        return additional.get(key);
    }

    @Nonnull
    public Map<String, Object> getAdditional() {
        return additional;
    }

    /**
     * Render the configuration as a plain map keyed like the override document.
     *
     * @return a new mutable map
     */
    @Nonnull
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(additional);
        map.put(PORTS, ports);
        map.put(SSL, tlsSettings);
        map.put(CHECK_SUBDOMAINS, checkSubdomains);
        map.put(SERVER_HOST, getServerHost());
        map.put(BIND_ADDRESS, bindAddress);
        map.put(BROWSER_HOST, browserHost);
        map.put(DOC_ROOT, docRoot != null ? docRoot.toString() : null);
        return map;
    }

    @Override
    public String toString() {
        return "EffectiveConfig{" +
                "ports=" + ports +
                ", serverHost='" + getServerHost() + '\'' +
                ", bindAddress=" + bindAddress +
                ", docRoot=" + docRoot +
                '}';
    }

    /**
     * Builder for {@link EffectiveConfig}.
     */
    public static final class Builder {

        private final Map<String, List<Integer>> ports = new LinkedHashMap<>();
        private final Map<String, Object> tlsSettings = new LinkedHashMap<>();
        private final Map<String, Object> additional = new LinkedHashMap<>();
        private boolean checkSubdomains;
        private String serverHost;
        private boolean bindAddress = true;
        private String browserHost = "localhost";
        private Path docRoot;

        private Builder() {
        }

        public Builder ports(@Nonnull String scheme, @Nonnull List<Integer> schemePorts) {
            Objects.requireNonNull(scheme, "scheme");
            Objects.requireNonNull(schemePorts, "schemePorts");
            ports.put(scheme, schemePorts);
            return this;
        }

        public Builder tlsSettings(@Nonnull Map<String, ?> settings) {
            Objects.requireNonNull(settings, "settings");
            tlsSettings.clear();
            tlsSettings.putAll(settings);
            return this;
        }

        public Builder checkSubdomains(boolean checkSubdomains) {
            this.checkSubdomains = checkSubdomains;
            return this;
        }

        public Builder serverHost(@Nullable String serverHost) {
            this.serverHost = serverHost;
            return this;
        }

        public Builder bindAddress(boolean bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder browserHost(@Nonnull String browserHost) {
            this.browserHost = Objects.requireNonNull(browserHost, "browserHost");
            return this;
        }

        public Builder docRoot(@Nullable Path docRoot) {
            this.docRoot = docRoot;
            return this;
        }

        public Builder additional(@Nonnull String key, @Nullable Object value) {
            Objects.requireNonNull(key, "key");
            additional.put(key, value);
            return this;
        }

        public EffectiveConfig build() {
            for (String scheme : BASELINE_SCHEMES) {
                if (!ports.containsKey(scheme)) {
                    throw new IllegalStateException("Missing ports for scheme: " + scheme);
                }
            }
            return new EffectiveConfig(this);
        }
    }
}
