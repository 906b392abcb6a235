package me.internalizable.testenv.environment;

import me.internalizable.testenv.api.EffectiveConfig;
import me.internalizable.testenv.api.EnvironmentExtra;
import me.internalizable.testenv.api.EnvironmentOptions;
import me.internalizable.testenv.api.ExtraScope;
import me.internalizable.testenv.api.ServerLogger;
import me.internalizable.testenv.environment.config.ConfigAssembler;
import me.internalizable.testenv.environment.config.ConfigScope;
import me.internalizable.testenv.environment.config.EnvironmentSettings;
import me.internalizable.testenv.environment.config.TestPaths;
import me.internalizable.testenv.environment.fleet.FleetContext;
import me.internalizable.testenv.environment.fleet.FleetLauncher;
import me.internalizable.testenv.environment.fleet.ServerFleet;
import me.internalizable.testenv.environment.logging.LogSink;
import me.internalizable.testenv.environment.logging.ProxyLoggingContext;
import me.internalizable.testenv.environment.logging.Slf4jLogSink;
import me.internalizable.testenv.environment.process.ProcessFleetLauncher;
import me.internalizable.testenv.environment.readiness.PortProber;
import me.internalizable.testenv.environment.readiness.ReadinessPoller;
import me.internalizable.testenv.environment.readiness.ReadinessReport;
import me.internalizable.testenv.environment.readiness.SocketPortProber;
import me.internalizable.testenv.environment.route.HarnessParameters;
import me.internalizable.testenv.environment.route.HarnessRoutes;
import me.internalizable.testenv.environment.route.RouteTable;
import me.internalizable.testenv.environment.shared.SharedCache;
import me.internalizable.testenv.environment.shared.StashServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Owns the test environment: the server fleet and everything it depends on.
 *
 * <p>{@link #enter()} acquires, in order: the log proxy, the effective
 * configuration, the stash, the shared cache, the extra subsystems, the route
 * table and the server fleet. {@link #exit(Throwable)} releases them in exactly
 * the reverse order. Every release step runs even if an earlier one fails.
 * Only one environment may be entered per process at a time.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (TestEnvironment env = TestEnvironment.builder(TestPaths.root(testsRoot))
 *         .options(options)
 *         .settings(settings)
 *         .build()
 *         .enter()) {
 *     env.ensureStarted();
 *     // run tests
 * }
 * }</pre>
 *
 * <p>{@link #close()} tears down with no scope failure, so extra subsystems never
 * see an exception thrown by the try block. Callers that need the extras to
 * observe it must call {@link #exit(Throwable)} themselves:</p>
 * <pre>{@code
 * TestEnvironment env = builder.build().enter();
 * try {
 *     // run tests
 * } catch (Throwable t) {
 *     env.exit(t);
 *     throw t;
 * }
 * env.exit(null);
 * }</pre>
 */
public class TestEnvironment implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TestEnvironment.class);

    private final TestPaths testPaths;
    private final EnvironmentOptions options;
    private final Map<String, Object> tlsOptions;
    private final List<EnvironmentExtra> extras;
    private final FleetLauncher fleetLauncher;
    private final String component;
    private final LogSink logSink;
    private final Duration logJoinTimeout;
    private final Path harnessResources;
    private final HarnessParameters harnessParameters;
    private final boolean enableQuic;
    private final Path mojojsPath;
    private final StashServer stash;
    private final SharedCache cache;
    private final InterruptControl interruptControl;
    private final ReadinessPoller readinessPoller;

    private ReleaseStack releases;
    private ServerLogger serverLogger;
    private EffectiveConfig config;
    private List<ExtraScope> extraScopes;
    private RouteTable routes;
    private ServerFleet servers;

    private TestEnvironment(Builder builder) {
        this.testPaths = builder.testPaths;
        this.options = builder.options;
        this.tlsOptions = new LinkedHashMap<>(builder.tlsOptions);
        this.extras = List.copyOf(builder.extras);
        this.component = builder.settings.getComponent();
        this.fleetLauncher = builder.fleetLauncher != null
                ? builder.fleetLauncher
                : ProcessFleetLauncher.fromSettings(builder.settings);
        this.logSink = builder.logSink;
        this.logJoinTimeout = builder.settings.logJoinTimeout();
        this.harnessResources = Path.of(builder.settings.getHarnessResources()).toAbsolutePath();
        this.harnessParameters = builder.harnessParameters;
        this.enableQuic = builder.enableQuic;
        this.mojojsPath = builder.mojojsPath;
        this.stash = builder.stash;
        this.cache = builder.cache;
        this.interruptControl = builder.interruptControl;

        PortProber prober = builder.portProber != null
                ? builder.portProber
                : new SocketPortProber(builder.settings.connectTimeout());
        this.readinessPoller = new ReadinessPoller(
                prober,
                options.isTestServerPort(),
                builder.settings.unprobeableSchemeSet(),
                builder.settings.pollInterval(),
                builder.settings.startupTimeout());
    }

    @Nonnull
    public static Builder builder(@Nonnull TestPaths testPaths) {
        return new Builder(testPaths);
    }

    // ==================== Scope ====================

    /**
     * Start the environment.
     *
     * <p>If any step fails, whatever was already acquired is released before
     * the failure propagates.</p>
     *
     * @return this environment
     * @throws NestedScopeException if an environment is already active
     * @throws ConfigurationException if the configuration cannot be assembled
     * @throws FleetStartException if the server fleet cannot be spawned
     */
    @Nonnull
    public TestEnvironment enter() {
        ActiveScope.acquire(this);
        ReleaseStack stack = new ReleaseStack();
        releases = stack;
        LOGGER.info("Entering test environment for {}", testPaths);

        try {
            ProxyLoggingContext logging = new ProxyLoggingContext(component, logSink, logJoinTimeout);
            serverLogger = logging.start();
            stack.push("logging proxy", cause -> logging.stop());

            EffectiveConfig assembled = new ConfigAssembler(testPaths, options, tlsOptions, enableQuic)
                    .assemble(serverLogger);
            ConfigScope configScope = ConfigScope.open(assembled);
            config = assembled;
            stack.push("config", cause -> configScope.close());

            stash.start();
            stack.push("stash", cause -> stash.stop());

            cache.start();
            stack.push("shared cache", cause -> cache.stop());

            if (extraScopes != null) {
                throw new NestedScopeException("A TestEnvironment object cannot be nested");
            }
            extraScopes = new ArrayList<>();
            stack.push("extras record", cause -> extraScopes = null);

            for (int i = 0; i < extras.size(); i++) {
                ExtraScope scope = extras.get(i).start(options, assembled);
                extraScopes.add(scope);
                stack.push("extra #" + i, scope::close);
            }

            routes = new HarnessRoutes(harnessResources, testPaths, options, harnessParameters, mojojsPath).build();

            FleetContext context = new FleetContext(serverLogger, configScope.getWorkDirectory(), stash, cache);
            ServerFleet fleet = fleetLauncher.start(assembled, routes, context);
            servers = fleet;
            stack.push("server fleet", cause -> fleet.terminateAll());

            DebugInfo debugInfo = harnessParameters.debugInfo();
            if (options.isSupportsDebugger() && debugInfo != null && debugInfo.interactive()) {
                interruptControl.ignoreInterrupts();
                stack.push("interrupt handling", cause -> interruptControl.restoreInterrupts());
            }
        } catch (Exception e) {
            RuntimeException failure = e instanceof RuntimeException
                    ? (RuntimeException) e
                    : new TestEnvironmentException("Failed to start test environment: " + e.getMessage(), e);
            LOGGER.error("Failed to enter test environment: {}", failure.getMessage());
            try {
                teardown(failure);
            } catch (TeardownException teardownFailure) {
                failure.addSuppressed(teardownFailure);
            }
            throw failure;
        }

        LOGGER.info("Test environment started with {} servers", servers.size());
        return this;
    }

    /**
     * Tear the environment down.
     *
     * @param scopeFailure exception propagating out of the caller's scope, or null;
     *                     passed to extra subsystems and attached as a suppressed
     *                     exception to any teardown failure
     * @throws TeardownException if any release step failed
     */
    public void exit(@Nullable Throwable scopeFailure) {
        if (releases == null) {
            throw new IllegalStateException("Test environment not entered");
        }
        LOGGER.info("Shutting down test environment...");
        try {
            teardown(scopeFailure);
        } catch (TeardownException e) {
            if (scopeFailure != null && scopeFailure != e) {
                e.addSuppressed(scopeFailure);
            }
            throw e;
        }
        LOGGER.info("Test environment shut down");
    }

    @Override
    public void close() {
        exit(null);
    }

    private void teardown(@Nullable Throwable scopeFailure) {
        ReleaseStack stack = releases;
        releases = null;
        try {
            stack.releaseAll(scopeFailure);
        } finally {
            servers = null;
            routes = null;
            config = null;
            serverLogger = null;
            ActiveScope.release(this);
        }
    }

    // ==================== Readiness ====================

    /**
     * Take one health snapshot of the fleet.
     *
     * @return the report
     */
    @Nonnull
    public ReadinessReport testServers() {
        checkEntered();
        return readinessPoller.testServers(servers, config.getServerHost());
    }

    /**
     * Wait until every server is alive and reachable.
     *
     * @throws ServersFailedToStartException if a server died or the startup budget ran out
     */
    public void ensureStarted() {
        checkEntered();
        readinessPoller.ensureStarted(servers, config.getServerHost());
    }

    // ==================== Queries ====================

    public boolean isEntered() {
        return releases != null;
    }

    @Nonnull
    public EffectiveConfig getConfig() {
        checkEntered();
        return config;
    }

    @Nonnull
    public RouteTable getRoutes() {
        checkEntered();
        return routes;
    }

    /**
     * Get the log handle passed to the servers of this scope.
     *
     * @return the server logger
     */
    @Nonnull
    public ServerLogger getServerLogger() {
        checkEntered();
        return serverLogger;
    }

    @Nonnull
    public StashServer getStash() {
        return stash;
    }

    @Nonnull
    public SharedCache getCache() {
        return cache;
    }

    ServerFleet getServers() {
        checkEntered();
        return servers;
    }

    boolean hasExtraScopes() {
        return extraScopes != null;
    }

    private void checkEntered() {
        if (releases == null || servers == null) {
            throw new IllegalStateException("Test environment not entered");
        }
    }

    /**
     * Builder for {@link TestEnvironment}.
     */
    public static final class Builder {

        private final TestPaths testPaths;
        private EnvironmentOptions options = EnvironmentOptions.defaults();
        private Map<String, Object> tlsOptions;
        private final List<EnvironmentExtra> extras = new ArrayList<>();
        private EnvironmentSettings settings = new EnvironmentSettings();
        private FleetLauncher fleetLauncher;
        private LogSink logSink = new Slf4jLogSink();
        private HarnessParameters harnessParameters = HarnessParameters.defaults();
        private boolean enableQuic;
        private Path mojojsPath;
        private StashServer stash = new StashServer();
        private SharedCache cache = new SharedCache();
        private InterruptControl interruptControl = new SignalInterruptControl();
        private PortProber portProber;

        private Builder(@Nonnull TestPaths testPaths) {
            this.testPaths = Objects.requireNonNull(testPaths, "testPaths");
        }

        public Builder options(@Nonnull EnvironmentOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        /**
         * Set the TLS settings. Defaults to the settings file's {@code ssl} section.
         *
         * @param tlsOptions TLS settings
         * @return this builder
         */
        public Builder tlsOptions(@Nonnull Map<String, Object> tlsOptions) {
            this.tlsOptions = Objects.requireNonNull(tlsOptions, "tlsOptions");
            return this;
        }

        public Builder extra(@Nonnull EnvironmentExtra extra) {
            extras.add(Objects.requireNonNull(extra, "extra"));
            return this;
        }

        public Builder settings(@Nonnull EnvironmentSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
            return this;
        }

        public Builder fleetLauncher(@Nonnull FleetLauncher fleetLauncher) {
            this.fleetLauncher = Objects.requireNonNull(fleetLauncher, "fleetLauncher");
            return this;
        }

        public Builder logSink(@Nonnull LogSink logSink) {
            this.logSink = Objects.requireNonNull(logSink, "logSink");
            return this;
        }

        public Builder harnessParameters(@Nonnull HarnessParameters harnessParameters) {
            this.harnessParameters = Objects.requireNonNull(harnessParameters, "harnessParameters");
            return this;
        }

        public Builder enableQuic(boolean enableQuic) {
            this.enableQuic = enableQuic;
            return this;
        }

        public Builder mojojsPath(@Nullable Path mojojsPath) {
            this.mojojsPath = mojojsPath;
            return this;
        }

        public Builder stash(@Nonnull StashServer stash) {
            this.stash = Objects.requireNonNull(stash, "stash");
            return this;
        }

        public Builder cache(@Nonnull SharedCache cache) {
            this.cache = Objects.requireNonNull(cache, "cache");
            return this;
        }

        public Builder interruptControl(@Nonnull InterruptControl interruptControl) {
            this.interruptControl = Objects.requireNonNull(interruptControl, "interruptControl");
            return this;
        }

        public Builder portProber(@Nonnull PortProber portProber) {
            this.portProber = Objects.requireNonNull(portProber, "portProber");
            return this;
        }

        public TestEnvironment build() {
            if (tlsOptions == null) {
                tlsOptions = settings.getSsl() != null ? settings.getSsl() : Map.of();
            }
            return new TestEnvironment(this);
        }
    }
}
