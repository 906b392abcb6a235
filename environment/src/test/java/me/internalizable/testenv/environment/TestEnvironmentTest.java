package me.internalizable.testenv.environment;

import me.internalizable.testenv.api.EffectiveConfig;
import me.internalizable.testenv.api.EnvironmentExtra;
import me.internalizable.testenv.api.EnvironmentOptions;
import me.internalizable.testenv.environment.config.EnvironmentSettings;
import me.internalizable.testenv.environment.config.TestPaths;
import me.internalizable.testenv.environment.fleet.FleetContext;
import me.internalizable.testenv.environment.fleet.FleetLauncher;
import me.internalizable.testenv.environment.fleet.ServerFleet;
import me.internalizable.testenv.environment.logging.LogLevel;
import me.internalizable.testenv.environment.logging.RecordingLogSink;
import me.internalizable.testenv.environment.route.HarnessParameters;
import me.internalizable.testenv.environment.route.RouteTable;
import me.internalizable.testenv.environment.shared.SharedCache;
import me.internalizable.testenv.environment.shared.StashServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TestEnvironmentTest {

    @TempDir
    Path dir;

    private final List<String> events = new CopyOnWriteArrayList<>();
    private final RecordingLogSink sink = new RecordingLogSink();
    private final RecordingLauncher launcher = new RecordingLauncher();

    private Path testsRoot;
    private EnvironmentSettings settings;

    @BeforeEach
    void setUp() throws IOException {
        testsRoot = Files.createDirectories(dir.resolve("tests"));
        Files.createDirectories(testsRoot.resolve("resources"));
        Files.writeString(testsRoot.resolve("resources").resolve("testdriver.js"), "// driver\n");
        Path harness = Files.createDirectories(dir.resolve("harness"));
        Files.writeString(harness.resolve("testdriver-extra.js"), "// extra\n");

        settings = new EnvironmentSettings();
        settings.setHarnessResources(harness.toString());
        settings.setPollIntervalMillis(10);
        settings.setStartupTimeoutSeconds(1);
    }

    @AfterEach
    void checkNoScopeLeaked() {
        TestEnvironment leaked = ActiveScope.current();
        if (leaked != null && leaked.isEntered()) {
            leaked.close();
        }
        assertFalse(ActiveScope.isActive(), "test left an environment active");
    }

    private TestEnvironment.Builder builder() {
        return TestEnvironment.builder(TestPaths.root(testsRoot))
                .settings(settings)
                .fleetLauncher(launcher)
                .logSink(sink)
                .stash(new RecordingStash())
                .cache(new RecordingCache())
                .interruptControl(new RecordingInterruptControl())
                .portProber((host, port) -> true);
    }

    private EnvironmentExtra extra(String name) {
        return (options, config) -> {
            events.add(name + " start");
            return failure -> events.add(name + " stop");
        };
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("acquires resources in order and releases them in reverse")
        void acquireAndReleaseOrder() {
            TestEnvironment env = builder()
                    .extra(extra("extra1"))
                    .extra(extra("extra2"))
                    .build()
                    .enter();

            assertTrue(env.isEntered());
            assertTrue(env.hasExtraScopes());
            assertSame(env, ActiveScope.current());
            assertEquals(List.of("stash start", "cache start", "extra1 start", "extra2 start", "fleet start"), events);

            events.clear();
            env.close();

            assertEquals(List.of(
                    "terminate http-8000", "terminate http-8001", "terminate https-8443", "terminate https-8444",
                    "terminate ws-8888", "terminate wss-8889", "terminate h2-9000",
                    "extra2 stop", "extra1 stop", "cache stop", "stash stop"), events);
            assertFalse(env.isEntered());
            assertFalse(env.hasExtraScopes());
            assertFalse(ActiveScope.isActive());
            assertFalse(Files.exists(launcher.workDirectory.get()), "config scope directory should be removed");
        }

        @Test
        @DisplayName("passes the assembled configuration to extras and the fleet")
        void sharesConfiguration() {
            AtomicReference<EffectiveConfig> seenByExtra = new AtomicReference<>();
            EnvironmentOptions options = EnvironmentOptions.builder().browserHost("web-platform.test").build();

            try (TestEnvironment env = builder()
                    .options(options)
                    .extra((opts, config) -> {
                        seenByExtra.set(config);
                        return failure -> { };
                    })
                    .build()
                    .enter()) {

                assertSame(env.getConfig(), seenByExtra.get());
                assertSame(env.getConfig(), launcher.config.get());
                assertEquals("web-platform.test", env.getConfig().getBrowserHost());
                assertEquals(testsRoot, env.getConfig().getDocRoot());
                assertEquals("// driver\n// extra\n", env.getRoutes().getDocumentRoutes().get(0).getBodyText());
            }
        }

        @Test
        @DisplayName("hands the caller's failure to extras on exit")
        void scopeFailureReachesExtras() {
            AtomicReference<Throwable> seen = new AtomicReference<>();
            TestEnvironment env = builder()
                    .extra((options, config) -> seen::set)
                    .build()
                    .enter();

            RuntimeException testFailure = new RuntimeException("test failed");
            env.exit(testFailure);

            assertSame(testFailure, seen.get());
        }

        @Test
        @DisplayName("close() releases extras without the try block's failure")
        void closeHandsNoFailureToExtras() {
            AtomicReference<Throwable> seen = new AtomicReference<>(new AssertionError("extra not released"));
            TestEnvironment env = builder()
                    .extra((options, config) -> seen::set)
                    .build();

            assertThrows(IllegalStateException.class, () -> {
                try (TestEnvironment entered = env.enter()) {
                    throw new IllegalStateException("test failed");
                }
            });

            assertNull(seen.get());
            assertFalse(env.isEntered());
        }

        @Test
        void routesServerLogsThroughFilterChain() {
            TestEnvironment env = builder().build().enter();
            env.getServerLogger().error("worker crashed");
            env.getServerLogger().debug("noise");
            env.close();

            assertTrue(sink.records().stream().anyMatch(r ->
                    r.getMessage().equals("worker crashed") && r.getLevel() == LogLevel.WARNING));
            assertFalse(sink.messages().contains("noise"));
            assertTrue(sink.records().stream().allMatch(r -> "server".equals(r.getComponent())));
        }

        @Test
        void rejectsQueriesOutsideScope() {
            TestEnvironment env = builder().build();

            assertThrows(IllegalStateException.class, env::getConfig);
            assertThrows(IllegalStateException.class, env::ensureStarted);
            assertThrows(IllegalStateException.class, env::close);
        }
    }

    @Nested
    @DisplayName("Nesting")
    class Nesting {

        @Test
        @DisplayName("rejects a second environment while one is active")
        void rejectsSecondEnvironment() {
            TestEnvironment first = builder().build().enter();
            try {
                TestEnvironment second = builder().build();

                assertThrows(NestedScopeException.class, second::enter);
                assertThrows(NestedScopeException.class, first::enter);
                assertFalse(second.isEntered());
                assertSame(first, ActiveScope.current());
                assertTrue(first.isEntered());
            } finally {
                first.close();
            }

            TestEnvironment third = builder().build().enter();
            third.close();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("keeps releasing after an extra fails to close")
        void teardownContinuesPastFailures() {
            IllegalStateException broken = new IllegalStateException("extra broke");
            TestEnvironment env = builder()
                    .extra(extra("extra1"))
                    .extra((options, config) -> failure -> {
                        throw broken;
                    })
                    .build()
                    .enter();

            TeardownException e = assertThrows(TeardownException.class, env::close);

            assertSame(broken, e.getCause());
            assertTrue(events.contains("extra1 stop"));
            assertTrue(events.contains("cache stop"));
            assertTrue(events.contains("stash stop"));
            assertTrue(events.indexOf("terminate h2-9000") < events.indexOf("extra1 stop"));
            assertFalse(Files.exists(launcher.workDirectory.get()));
            assertFalse(ActiveScope.isActive());
        }

        @Test
        @DisplayName("teardown failure carries the caller's failure")
        void teardownFailureCarriesScopeFailure() {
            TestEnvironment env = builder()
                    .extra((options, config) -> failure -> {
                        throw new IllegalStateException("extra broke");
                    })
                    .build()
                    .enter();
            RuntimeException testFailure = new RuntimeException("test failed");

            Throwable propagated = assertThrows(Throwable.class, () -> {
                try {
                    throw testFailure;
                } catch (Throwable t) {
                    env.exit(t);
                    throw t;
                }
            });

            TeardownException e = assertInstanceOf(TeardownException.class, propagated);
            assertEquals("extra broke", e.getCause().getMessage());
            assertEquals(List.of(testFailure), List.of(e.getSuppressed()));
            assertEquals(0, testFailure.getSuppressed().length);
            assertTrue(e.getMessage().contains("extra #0"), e.getMessage());
        }

        @Test
        @DisplayName("releases everything acquired when the fleet fails to start")
        void fleetFailureUnwinds() {
            FleetStartException boom = new FleetStartException("no worker binary");
            TestEnvironment env = builder()
                    .extra(extra("extra1"))
                    .fleetLauncher((config, routes, context) -> {
                        launcher.workDirectory.set(context.workDirectory());
                        throw boom;
                    })
                    .build();

            FleetStartException e = assertThrows(FleetStartException.class, env::enter);

            assertSame(boom, e);
            assertEquals(List.of("stash start", "cache start", "extra1 start", "extra1 stop", "cache stop", "stash stop"),
                    events);
            assertFalse(env.isEntered());
            assertFalse(env.hasExtraScopes());
            assertFalse(Files.exists(launcher.workDirectory.get()));
            assertFalse(ActiveScope.isActive());
        }

        @Test
        void malformedOverrideUnwinds() throws IOException {
            Files.writeString(testsRoot.resolve("config.json"), "{oops");
            TestEnvironment env = builder().build();

            assertThrows(ConfigurationException.class, env::enter);

            assertTrue(events.isEmpty());
            assertFalse(ActiveScope.isActive());
        }
    }

    @Nested
    @DisplayName("Interrupts")
    class Interrupts {

        private final HarnessParameters interactive =
                new HarnessParameters(1.0, false, false, new DebugInfo(true));

        @Test
        @DisplayName("are ignored under an interactive debugger and restored first on exit")
        void ignoredAndRestoredFirst() {
            TestEnvironment env = builder()
                    .options(EnvironmentOptions.builder().supportsDebugger(true).build())
                    .harnessParameters(interactive)
                    .build()
                    .enter();

            assertEquals("ignore interrupts", events.get(events.size() - 1));

            events.clear();
            env.close();

            assertEquals("restore interrupts", events.get(0));
        }

        @Test
        void untouchedWithoutDebuggerSupport() {
            builder().harnessParameters(interactive).build().enter().close();

            assertFalse(events.contains("ignore interrupts"));
            assertFalse(events.contains("restore interrupts"));
        }

        @Test
        void untouchedForNonInteractiveDebugger() {
            builder()
                    .options(EnvironmentOptions.builder().supportsDebugger(true).build())
                    .harnessParameters(new HarnessParameters(1.0, false, false, new DebugInfo(false)))
                    .build()
                    .enter()
                    .close();

            assertFalse(events.contains("ignore interrupts"));
        }
    }

    @Nested
    @DisplayName("Readiness")
    class Readiness {

        @Test
        void ensureStartedReturnsWhenServersAreUp() {
            try (TestEnvironment env = builder().build().enter()) {
                assertDoesNotThrow(env::ensureStarted);
                assertTrue(env.testServers().isReady());
            }
        }

        @Test
        @DisplayName("names a dead server immediately")
        void deadServer() {
            launcher.dead.add("https-8443");
            try (TestEnvironment env = builder().build().enter()) {
                ServersFailedToStartException e = assertThrows(ServersFailedToStartException.class,
                        env::ensureStarted);
                assertEquals("Servers failed to start: https:8443", e.getMessage());
            }
        }

        @Test
        @DisplayName("probes the server host")
        void probesServerHost() {
            Set<String> hosts = new HashSet<>();
            EnvironmentOptions options = EnvironmentOptions.builder().serverHost("127.0.0.1").build();
            try (TestEnvironment env = builder()
                    .options(options)
                    .portProber((host, port) -> hosts.add(host) || true)
                    .build()
                    .enter()) {
                env.ensureStarted();
            }
            assertEquals(Set.of("127.0.0.1"), hosts);
        }

        @Test
        void skipsPortsWhenProbingDisabled() {
            EnvironmentOptions options = EnvironmentOptions.builder().testServerPort(false).build();
            try (TestEnvironment env = builder()
                    .options(options)
                    .portProber((host, port) -> false)
                    .build()
                    .enter()) {
                assertDoesNotThrow(env::ensureStarted);
            }
        }
    }

    private final class RecordingLauncher implements FleetLauncher {

        final Set<String> dead = new HashSet<>();
        final AtomicReference<Path> workDirectory = new AtomicReference<>();
        final AtomicReference<EffectiveConfig> config = new AtomicReference<>();

        @Override
        public ServerFleet start(EffectiveConfig effective, RouteTable routes, FleetContext context) {
            events.add("fleet start");
            workDirectory.set(context.workDirectory());
            config.set(effective);
            assertTrue(context.stash().isRunning());
            assertTrue(context.cache().isRunning());

            ServerFleet.Builder fleet = ServerFleet.builder();
            for (Map.Entry<String, List<Integer>> entry : effective.getPorts().entrySet()) {
                for (int port : entry.getValue()) {
                    String id = entry.getKey() + "-" + port;
                    fleet.add(entry.getKey(), port, new FakeServerHandle(id, !dead.contains(id), events));
                }
            }
            return fleet.build();
        }
    }

    private final class RecordingStash extends StashServer {
        @Override
        public void start() {
            events.add("stash start");
            super.start();
        }

        @Override
        public void stop() {
            events.add("stash stop");
            super.stop();
        }
    }

    private final class RecordingCache extends SharedCache {
        @Override
        public void start() {
            events.add("cache start");
            super.start();
        }

        @Override
        public void stop() {
            events.add("cache stop");
            super.stop();
        }
    }

    private final class RecordingInterruptControl implements InterruptControl {
        @Override
        public void ignoreInterrupts() {
            events.add("ignore interrupts");
        }

        @Override
        public void restoreInterrupts() {
            events.add("restore interrupts");
        }
    }
}
