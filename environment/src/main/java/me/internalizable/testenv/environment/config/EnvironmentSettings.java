package me.internalizable.testenv.environment.config;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Tag;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Operator settings of the test environment.
 *
 * <p>Loaded from {@code testenv.yml}. Covers how server workers are launched,
 * where harness resources live, TLS settings and the readiness and shutdown
 * timings.</p>
 */
public class EnvironmentSettings {

    private String component = "server";
    private List<String> workerCommand = new ArrayList<>(List.of(
            "testenv-worker", "--scheme", "{scheme}", "--port", "{port}", "--config", "{config}"));
    private Map<String, String> workerEnvironment = new HashMap<>();
    private String harnessResources = "harness";
    private Map<String, Object> ssl = new LinkedHashMap<>(Map.of("type", "none"));
    private List<String> unprobeableSchemes = new ArrayList<>(List.of("quic-transport"));
    private long pollIntervalMillis = 500;
    private int startupTimeoutSeconds = 30;
    private int connectTimeoutMillis = 100;
    private long logJoinTimeoutMillis = 1000;
    private int gracefulStopSeconds = 10;

    /**
     * Load settings from file, creating a default file if none exists.
     *
     * @param path path to the settings file
     * @return loaded settings
     * @throws IOException if the file cannot be read or written
     */
    @Nonnull
    public static EnvironmentSettings load(@Nonnull Path path) throws IOException {
        if (!Files.exists(path)) {
            EnvironmentSettings settings = new EnvironmentSettings();
            settings.save(path);
            return settings;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(EnvironmentSettings.class, options));
        try (InputStream is = Files.newInputStream(path)) {
            EnvironmentSettings settings = yaml.load(is);
            return settings != null ? settings : new EnvironmentSettings();
        } catch (YAMLException e) {
            throw new IOException("Invalid settings file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Save settings to file.
     *
     * @param path path to save to
     * @throws IOException if saving fails
     */
    public void save(@Nonnull Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Yaml yaml = new Yaml();
        try (Writer writer = Files.newBufferedWriter(path)) {
            writer.write(yaml.dumpAs(this, Tag.MAP, DumperOptions.FlowStyle.BLOCK));
        }
    }

    // Derived values

    @Nonnull
    public Duration pollInterval() {
        return Duration.ofMillis(pollIntervalMillis);
    }

    @Nonnull
    public Duration startupTimeout() {
        return Duration.ofSeconds(startupTimeoutSeconds);
    }

    @Nonnull
    public Duration connectTimeout() {
        return Duration.ofMillis(connectTimeoutMillis);
    }

    @Nonnull
    public Duration logJoinTimeout() {
        return Duration.ofMillis(logJoinTimeoutMillis);
    }

    @Nonnull
    public Duration gracefulStopTimeout() {
        return Duration.ofSeconds(gracefulStopSeconds);
    }

    @Nonnull
    public Set<String> unprobeableSchemeSet() {
        return new LinkedHashSet<>(unprobeableSchemes);
    }

    // Getters and Setters

    public String getComponent() {
        return component;
    }

    public void setComponent(String component) {
        this.component = component;
    }

    public List<String> getWorkerCommand() {
        return workerCommand;
    }

    public void setWorkerCommand(List<String> workerCommand) {
        this.workerCommand = workerCommand;
    }

    public Map<String, String> getWorkerEnvironment() {
        return workerEnvironment;
    }

    public void setWorkerEnvironment(Map<String, String> workerEnvironment) {
        this.workerEnvironment = workerEnvironment;
    }

    public String getHarnessResources() {
        return harnessResources;
    }

    public void setHarnessResources(String harnessResources) {
        this.harnessResources = harnessResources;
    }

    public Map<String, Object> getSsl() {
        return ssl;
    }

    public void setSsl(Map<String, Object> ssl) {
        this.ssl = ssl;
    }

    public List<String> getUnprobeableSchemes() {
        return unprobeableSchemes;
    }

    public void setUnprobeableSchemes(List<String> unprobeableSchemes) {
        this.unprobeableSchemes = unprobeableSchemes;
    }

    public long getPollIntervalMillis() {
        return pollIntervalMillis;
    }

    public void setPollIntervalMillis(long pollIntervalMillis) {
        this.pollIntervalMillis = pollIntervalMillis;
    }

    public int getStartupTimeoutSeconds() {
        return startupTimeoutSeconds;
    }

    public void setStartupTimeoutSeconds(int startupTimeoutSeconds) {
        this.startupTimeoutSeconds = startupTimeoutSeconds;
    }

    public int getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public void setConnectTimeoutMillis(int connectTimeoutMillis) {
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    public long getLogJoinTimeoutMillis() {
        return logJoinTimeoutMillis;
    }

    public void setLogJoinTimeoutMillis(long logJoinTimeoutMillis) {
        this.logJoinTimeoutMillis = logJoinTimeoutMillis;
    }

    public int getGracefulStopSeconds() {
        return gracefulStopSeconds;
    }

    public void setGracefulStopSeconds(int gracefulStopSeconds) {
        this.gracefulStopSeconds = gracefulStopSeconds;
    }
}
