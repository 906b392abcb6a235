package me.internalizable.testenv.environment.config;

import me.internalizable.testenv.api.EffectiveConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;

/**
 * Holds the effective configuration for the lifetime of one environment scope.
 *
 * <p>Owns a temporary working directory for state generated from the
 * configuration, such as the serialized copy handed to worker processes.
 * {@link #close()} deletes it.</p>
 */
public class ConfigScope implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigScope.class);

    private final EffectiveConfig config;
    private final Path workDirectory;

    private volatile boolean closed = false;

    private ConfigScope(EffectiveConfig config, Path workDirectory) {
        this.config = config;
        this.workDirectory = workDirectory;
    }

    /**
     * Open a scope for an assembled configuration.
     *
     * @param config the configuration
     * @return the scope
     * @throws IOException if the working directory cannot be created
     */
    @Nonnull
    public static ConfigScope open(@Nonnull EffectiveConfig config) throws IOException {
        Objects.requireNonNull(config, "config");
        Path workDirectory = Files.createTempDirectory("testenv-config-");
        LOGGER.debug("Opened config scope in {}", workDirectory);
        return new ConfigScope(config, workDirectory);
    }

    @Nonnull
    public EffectiveConfig getConfig() {
        return config;
    }

    @Nonnull
    public Path getWorkDirectory() {
        if (closed) {
            throw new IllegalStateException("Config scope already closed");
        }
        return workDirectory;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (Files.exists(workDirectory)) {
            deleteDirectory(workDirectory);
        }
        LOGGER.debug("Closed config scope {}", workDirectory);
    }

    private static void deleteDirectory(Path directory) throws IOException {
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
