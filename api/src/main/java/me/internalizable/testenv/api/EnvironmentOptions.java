package me.internalizable.testenv.api;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Option bag passed by the caller when building a test environment.
 *
 * <p>Recognized keys are exposed through typed getters. Every entry, including
 * unrecognized ones, stays available through {@link #get(String)} so extra
 * subsystems can read their own options.</p>
 */
public final class EnvironmentOptions {

    public static final String TEST_SERVER_PORT = "test_server_port";
    public static final String BROWSER_HOST = "browser_host";
    public static final String BIND_ADDRESS = "bind_address";
    public static final String SERVER_HOST = "server_host";
    public static final String ENCRYPT_AFTER_CONNECT = "encrypt_after_connect";
    public static final String SUPPORTS_DEBUGGER = "supports_debugger";
    public static final String TESTHARNESSREPORT = "testharnessreport";

    private final Map<String, Object> values;

    private EnvironmentOptions(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Create options from a free-form map.
     *
     * @param values option values keyed by option name
     * @return the options
     */
    @Nonnull
    public static EnvironmentOptions fromMap(@Nonnull Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        return new EnvironmentOptions(new LinkedHashMap<>(values));
    }

    /**
     * Options with every key unset.
     *
     * @return empty options
     */
    @Nonnull
    public static EnvironmentOptions defaults() {
        return new EnvironmentOptions(Map.of());
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Whether readiness checks should also try to connect to each port.
     *
     * @return true unless explicitly disabled
     */
    public boolean isTestServerPort() {
        return flag(TEST_SERVER_PORT, true);
    }

    @Nullable
    public String getBrowserHost() {
        return text(BROWSER_HOST);
    }

    @Nullable
    public Boolean getBindAddress() {
        Object value = values.get(BIND_ADDRESS);
        return value == null ? null : toBoolean(value);
    }

    @Nullable
    public String getServerHost() {
        return text(SERVER_HOST);
    }

    public boolean isEncryptAfterConnect() {
        return flag(ENCRYPT_AFTER_CONNECT, false);
    }

    public boolean isSupportsDebugger() {
        return flag(SUPPORTS_DEBUGGER, false);
    }

    @Nullable
    public String getTestharnessreport() {
        return text(TESTHARNESSREPORT);
    }

    /**
     * Check whether an option was supplied.
     *
     * @param key option name
     * @return true if present
     */
    public boolean contains(@Nonnull String key) {
        return values.containsKey(key);
    }

    /**
     * Get a raw option value.
     *
     * @param key option name
     * @return the value, or null if absent
     */
    @Nullable
    public Object get(@Nonnull String key) {
        return values.get(key);
    }

    @Nonnull
    public Map<String, Object> asMap() {
        return values;
    }

    private boolean flag(String key, boolean fallback) {
        Object value = values.get(key);
        return value == null ? fallback : toBoolean(value);
    }

    @Nullable
    private String text(String key) {
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    @Override
    public String toString() {
        return "EnvironmentOptions" + values;
    }

    /**
     * Builder for {@link EnvironmentOptions}.
     */
    public static final class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder testServerPort(boolean testServerPort) {
            values.put(TEST_SERVER_PORT, testServerPort);
            return this;
        }

        public Builder browserHost(@Nullable String browserHost) {
            return putOrRemove(BROWSER_HOST, browserHost);
        }

        public Builder bindAddress(@Nullable Boolean bindAddress) {
            return putOrRemove(BIND_ADDRESS, bindAddress);
        }

        public Builder serverHost(@Nullable String serverHost) {
            return putOrRemove(SERVER_HOST, serverHost);
        }

        public Builder encryptAfterConnect(boolean encryptAfterConnect) {
            values.put(ENCRYPT_AFTER_CONNECT, encryptAfterConnect);
            return this;
        }

        public Builder supportsDebugger(boolean supportsDebugger) {
            values.put(SUPPORTS_DEBUGGER, supportsDebugger);
            return this;
        }

        public Builder testharnessreport(@Nullable String fileName) {
            return putOrRemove(TESTHARNESSREPORT, fileName);
        }

        /**
         * Set an arbitrary option.
         *
         * @param key option name
         * @param value option value
         * @return this builder
         */
        public Builder option(@Nonnull String key, @Nonnull Object value) {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            values.put(key, value);
            return this;
        }

        public Builder options(@Nonnull Map<String, ?> options) {
            Objects.requireNonNull(options, "options");
            values.putAll(options);
            return this;
        }

        public EnvironmentOptions build() {
            return new EnvironmentOptions(values);
        }

        private Builder putOrRemove(String key, @Nullable Object value) {
            if (value == null) {
                values.remove(key);
            } else {
                values.put(key, value);
            }
            return this;
        }
    }
}
