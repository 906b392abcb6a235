package me.internalizable.testenv.environment.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import me.internalizable.testenv.api.EffectiveConfig;
import me.internalizable.testenv.api.EnvironmentOptions;
import me.internalizable.testenv.environment.DebugInfo;
import me.internalizable.testenv.environment.ServersFailedToStartException;
import me.internalizable.testenv.environment.TestEnvironment;
import me.internalizable.testenv.environment.config.ConfigAssembler;
import me.internalizable.testenv.environment.config.EnvironmentSettings;
import me.internalizable.testenv.environment.config.TestPaths;
import me.internalizable.testenv.environment.logging.ProxyLoggingContext;
import me.internalizable.testenv.environment.route.HarnessParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "testenv",
        mixinStandardHelpOptions = true,
        description = "Protocol test server environment",
        subcommands = {
                TestEnvCommand.ServeCommand.class,
                TestEnvCommand.ConfigCommand.class
        }
)
public final class TestEnvCommand implements Runnable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TestEnvCommand.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    static final class EnvironmentArgs {
        @Option(names = {"--tests-root"}, required = true, description = "Root tests directory, served at /")
        Path testsRoot;

        @Option(names = {"--settings"}, description = "Settings file", defaultValue = "testenv.yml")
        Path settings;

        @Option(names = {"--enable-quic"}, description = "Also start the QUIC transport server")
        boolean enableQuic;

        @Option(names = {"-o", "--option"}, description = "Environment option as key=value")
        Map<String, String> options = new LinkedHashMap<>();

        EnvironmentOptions environmentOptions() {
            return EnvironmentOptions.fromMap(options);
        }

        EnvironmentSettings loadSettings() throws Exception {
            return EnvironmentSettings.load(settings);
        }
    }

    @Command(name = "serve", description = "Start the server fleet and keep it running until interrupted")
    static final class ServeCommand implements Callable<Integer> {

        @Mixin
        EnvironmentArgs args;

        @Option(names = {"--mojojs-path"}, description = "Generated bindings directory, mounted at /gen/")
        Path mojojsPath;

        @Option(names = {"--debugger"}, description = "An interactive debugger is attached")
        boolean debugger;

        @Option(names = {"--timeout-multiplier"}, defaultValue = "1.0")
        double timeoutMultiplier;

        @Override
        public Integer call() throws Exception {
            EnvironmentSettings settings = args.loadSettings();
            HarnessParameters parameters = new HarnessParameters(
                    timeoutMultiplier, false, false, debugger ? new DebugInfo(true) : null);

            TestEnvironment environment = TestEnvironment.builder(TestPaths.root(args.testsRoot))
                    .options(args.environmentOptions())
                    .settings(settings)
                    .harnessParameters(parameters)
                    .enableQuic(args.enableQuic)
                    .mojojsPath(mojojsPath)
                    .build();

            CountDownLatch stopRequested = new CountDownLatch(1);
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                stopRequested.countDown();
                try {
                    stopped.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "testenv-shutdown-hook"));

            try (TestEnvironment env = environment.enter()) {
                env.ensureStarted();
                System.out.println(MAPPER.writeValueAsString(env.getConfig().getPorts()));
                stopRequested.await();
            } catch (ServersFailedToStartException e) {
                LOGGER.error(e.getMessage());
                return 1;
            } finally {
                stopped.countDown();
            }
            return 0;
        }
    }

    @Command(name = "config", description = "Print the effective configuration as JSON")
    static final class ConfigCommand implements Callable<Integer> {

        @Mixin
        EnvironmentArgs args;

        @Override
        public Integer call() throws Exception {
            EnvironmentSettings settings = args.loadSettings();
            ProxyLoggingContext logging = new ProxyLoggingContext(settings.getComponent());
            try {
                EffectiveConfig config = new ConfigAssembler(
                        TestPaths.root(args.testsRoot),
                        args.environmentOptions(),
                        settings.getSsl(),
                        args.enableQuic).assemble(logging.start());
                System.out.println(MAPPER.writeValueAsString(config.toMap()));
            } finally {
                logging.stop();
            }
            return 0;
        }
    }
}
