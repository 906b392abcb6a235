package me.internalizable.testenv.environment.config;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mapping from URL base to the directory holding the tests served under it.
 *
 * <p>The entry for {@code "/"} is the root test path: its directory is the
 * document root and holds the optional {@code config.json} override.</p>
 */
public final class TestPaths {

    public static final String ROOT = "/";

    private final Map<String, Path> paths;

    private TestPaths(Map<String, Path> paths) {
        this.paths = Collections.unmodifiableMap(new LinkedHashMap<>(paths));
    }

    /**
     * Create test paths from a URL base mapping.
     *
     * @param paths tests directory per URL base, in mount order
     * @return the test paths
     */
    @Nonnull
    public static TestPaths of(@Nonnull Map<String, Path> paths) {
        Objects.requireNonNull(paths, "paths");
        return new TestPaths(paths);
    }

    /**
     * Test paths with only a root entry.
     *
     * @param testsRoot the root tests directory
     * @return the test paths
     */
    @Nonnull
    public static TestPaths root(@Nonnull Path testsRoot) {
        Objects.requireNonNull(testsRoot, "testsRoot");
        return new TestPaths(Map.of(ROOT, testsRoot));
    }

    /**
     * Get the root tests directory.
     *
     * @return the directory mapped to {@code "/"}, or null if none
     */
    @Nullable
    public Path getRoot() {
        return paths.get(ROOT);
    }

    public boolean hasRoot() {
        return paths.containsKey(ROOT);
    }

    @Nonnull
    public Map<String, Path> asMap() {
        return paths;
    }

    @Override
    public String toString() {
        return "TestPaths" + paths;
    }
}
