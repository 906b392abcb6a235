package me.internalizable.testenv.environment.route;

import me.internalizable.testenv.api.EnvironmentOptions;
import me.internalizable.testenv.environment.ConfigurationException;
import me.internalizable.testenv.environment.config.TestPaths;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the route table served by the fleet for test harness runs.
 */
public class HarnessRoutes {

    static final Map<String, String> CACHE_HEADERS = Map.of("Cache-Control", "max-age=3600");

    private final Path harnessResources;
    private final TestPaths testPaths;
    private final EnvironmentOptions options;
    private final HarnessParameters parameters;
    private final Path mojojsPath;

    /**
     * Create a route table builder.
     *
     * @param harnessResources directory holding the runner pages and scripts
     * @param testPaths test paths to mount
     * @param options caller options
     * @param parameters harness report parameters
     * @param mojojsPath generated bindings directory, or null
     */
    public HarnessRoutes(
            @Nonnull Path harnessResources,
            @Nonnull TestPaths testPaths,
            @Nonnull EnvironmentOptions options,
            @Nonnull HarnessParameters parameters,
            @Nullable Path mojojsPath) {
        this.harnessResources = Objects.requireNonNull(harnessResources, "harnessResources");
        this.testPaths = Objects.requireNonNull(testPaths, "testPaths");
        this.options = Objects.requireNonNull(options, "options");
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.mojojsPath = mojojsPath;
    }

    /**
     * Build the route table.
     *
     * @return the routes
     * @throws ConfigurationException if a harness resource cannot be read
     */
    @Nonnull
    public RouteTable build() {
        RoutesBuilder builder = new RoutesBuilder();

        addStatic(builder, "testharness_runner.html", null, "text/html", "/testharness_runner.html");
        addStatic(builder, "print_reftest_runner.html", null, "text/html", "/print_reftest_runner.html");
        addStatic(builder, "third_party/pdf_js/pdf.js", null, "text/javascript", "/_pdf_js/pdf.js");
        addStatic(builder, "third_party/pdf_js/pdf.worker.js", null, "text/javascript", "/_pdf_js/pdf.worker.js");

        String report = options.getTestharnessreport() != null
                ? options.getTestharnessreport()
                : "testharnessreport.js";
        addStatic(builder, report, reportArgs(), "text/javascript;charset=utf8", "/resources/testharnessreport.js");

        builder.addDocument("GET", "/resources/testdriver.js", testDriver(), "text/javascript");

        for (Map.Entry<String, Path> entry : testPaths.asMap().entrySet()) {
            if (TestPaths.ROOT.equals(entry.getKey())) {
                continue;
            }
            builder.addMountPoint(entry.getKey(), entry.getValue());
        }

        if (!testPaths.hasRoot()) {
            builder.removeMountPoint(TestPaths.ROOT);
        }

        if (mojojsPath != null) {
            builder.addMountPoint("/gen/", mojojsPath);
        }

        return builder.build();
    }

    private void addStatic(RoutesBuilder builder, String file, @Nullable Map<String, Object> formatArgs,
                           String contentType, String route) {
        Path path = harnessResources.resolve(file).normalize();
        builder.addStatic(path, formatArgs, contentType, route, CACHE_HEADERS);
    }

    private Map<String, Object> reportArgs() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("output", parameters.pauseAfterTest());
        args.put("timeout_multiplier", parameters.timeoutMultiplier());
        args.put("explicit_timeout", parameters.debugInfo() != null ? "true" : "false");
        args.put("debug", parameters.debugTest() ? "true" : "false");
        return args;
    }

    /**
     * The test driver is the shared driver from the document root followed by
     * the harness-specific extension.
     */
    private byte[] testDriver() {
        ByteArrayOutputStream data = new ByteArrayOutputStream();
        Path root = testPaths.getRoot();
        if (root != null) {
            append(data, root.resolve("resources").resolve("testdriver.js"));
        }
        append(data, harnessResources.resolve("testdriver-extra.js"));
        return data.toByteArray();
    }

    private static void append(ByteArrayOutputStream data, Path file) {
        try {
            data.write(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new ConfigurationException(file, "Unable to read harness resource", e);
        }
    }
}
