package me.internalizable.testenv.environment.process;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import me.internalizable.testenv.api.EffectiveConfig;
import me.internalizable.testenv.api.ServerLogger;
import me.internalizable.testenv.environment.FleetStartException;
import me.internalizable.testenv.environment.config.EnvironmentSettings;
import me.internalizable.testenv.environment.fleet.FleetContext;
import me.internalizable.testenv.environment.fleet.FleetLauncher;
import me.internalizable.testenv.environment.fleet.ServerFleet;
import me.internalizable.testenv.environment.logging.WorkerOutputDecoder;
import me.internalizable.testenv.environment.route.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Starts each server of the fleet as a worker process.
 *
 * <p>One process is spawned per configured {@code (scheme, port)} from a
 * command template. The effective configuration and route table are written
 * as JSON to the scope's working directory and passed as {@code {config}}.
 * Worker output is decoded into the scope's server logger.</p>
 *
 * <p>Template placeholders: {@code {scheme}}, {@code {port}}, {@code {host}},
 * {@code {bindAddress}}, {@code {docRoot}}, {@code {config}}.</p>
 */
public class ProcessFleetLauncher implements FleetLauncher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessFleetLauncher.class);

    static final String CONFIG_FILE = "fleet-config.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final List<String> commandTemplate;
    private final Map<String, String> environment;
    private final Duration gracefulStopTimeout;

    /**
     * Create a launcher.
     *
     * @param commandTemplate worker command with placeholders
     * @param environment extra environment variables for every worker
     * @param gracefulStopTimeout how long a worker may take to stop before it is killed
     */
    public ProcessFleetLauncher(
            @Nonnull List<String> commandTemplate,
            @Nonnull Map<String, String> environment,
            @Nonnull Duration gracefulStopTimeout) {
        if (Objects.requireNonNull(commandTemplate, "commandTemplate").isEmpty()) {
            throw new IllegalArgumentException("Worker command must not be empty");
        }
        this.commandTemplate = List.copyOf(commandTemplate);
        this.environment = new HashMap<>(Objects.requireNonNull(environment, "environment"));
        this.gracefulStopTimeout = Objects.requireNonNull(gracefulStopTimeout, "gracefulStopTimeout");
    }

    @Nonnull
    public static ProcessFleetLauncher fromSettings(@Nonnull EnvironmentSettings settings) {
        return new ProcessFleetLauncher(
                settings.getWorkerCommand(),
                settings.getWorkerEnvironment(),
                settings.gracefulStopTimeout());
    }

    @Nonnull
    @Override
    public ServerFleet start(@Nonnull EffectiveConfig config, @Nonnull RouteTable routes, @Nonnull FleetContext context) {
        Path workDirectory = context.workDirectory();
        Path configFile = workDirectory.resolve(CONFIG_FILE);
        try {
            writeFleetConfig(configFile, config, routes);
        } catch (IOException e) {
            throw new FleetStartException("Unable to prepare worker configuration in " + workDirectory, e);
        }

        WorkerOutputDecoder decoder = new WorkerOutputDecoder(context.logger());
        ServerFleet.Builder fleet = ServerFleet.builder();
        List<ManagedProcess> started = new ArrayList<>();

        for (Map.Entry<String, List<Integer>> entry : config.getPorts().entrySet()) {
            String scheme = entry.getKey();
            for (int port : entry.getValue()) {
                try {
                    ManagedProcess process = spawn(scheme, port, config, configFile);
                    started.add(process);
                    fleet.add(scheme, port, process);
                    startLogCapture(process, decoder, context.logger());
                } catch (IOException e) {
                    LOGGER.error("Failed to spawn {} server on port {}: {}", scheme, port, e.getMessage());
                    started.forEach(ManagedProcess::terminate);
                    throw new FleetStartException("Failed to start " + scheme + " server on port " + port, e);
                }
            }
        }

        ServerFleet result = fleet.build();
        LOGGER.info("Started {} server workers: {}", result.size(), result);
        return result;
    }

    private void writeFleetConfig(Path configFile, EffectiveConfig config, RouteTable routes) throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("config", config.toMap());
        document.put("routes", routes.toMap());
        MAPPER.writeValue(configFile.toFile(), document);
    }

    private ManagedProcess spawn(String scheme, int port, EffectiveConfig config, Path configFile)
            throws IOException {
        Map<String, String> values = new HashMap<>();
        values.put("scheme", scheme);
        values.put("port", Integer.toString(port));
        values.put("host", config.getServerHost());
        values.put("bindAddress", Boolean.toString(config.isBindAddress()));
        values.put("docRoot", config.getDocRoot() != null ? config.getDocRoot().toString() : "");
        values.put("config", configFile.toString());

        List<String> command = expand(commandTemplate, values);
        LOGGER.debug("Spawning {} server on port {}: {}", scheme, port, String.join(" ", command));

        ProcessBuilder builder = new ProcessBuilder(command);
        if (config.getDocRoot() != null && Files.isDirectory(config.getDocRoot())) {
            builder.directory(config.getDocRoot().toFile());
        }
        builder.redirectErrorStream(true);

        Map<String, String> env = builder.environment();
        env.put("TESTENV_SCHEME", scheme);
        env.put("TESTENV_PORT", Integer.toString(port));
        env.put("TESTENV_CONFIG", configFile.toString());
        env.putAll(environment);

        Process process = builder.start();
        ManagedProcess managed = new ManagedProcess(scheme, port, process, gracefulStopTimeout);
        LOGGER.info("Server '{}' started with PID {}", managed.getServerId(), process.pid());
        return managed;
    }

    static List<String> expand(List<String> template, Map<String, String> values) {
        List<String> command = new ArrayList<>(template.size());
        for (String part : template) {
            String expanded = part;
            for (Map.Entry<String, String> value : values.entrySet()) {
                expanded = expanded.replace("{" + value.getKey() + "}", value.getValue());
            }
            command.add(expanded);
        }
        return command;
    }

    private void startLogCapture(ManagedProcess managed, WorkerOutputDecoder decoder, ServerLogger logger) {
        Thread logThread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(managed.getProcess().getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    decoder.accept(managed.getServerId(), line);
                }
            } catch (IOException e) {
                if (managed.isAlive()) {
                    LOGGER.error("Error capturing output of '{}': {}", managed.getServerId(), e.getMessage());
                }
            }
        }, "LogCapture-" + managed.getServerId());
        logThread.setDaemon(true);
        logThread.start();

        managed.getProcess().onExit().thenRun(() ->
                logger.info("Server", managed.getServerId(), "exited with code", managed.getExitCode()));
    }
}
