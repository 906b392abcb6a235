package me.internalizable.testenv.environment;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A configuration document or harness resource could not be read or parsed.
 */
public class ConfigurationException extends TestEnvironmentException {

    private final Path path;

    public ConfigurationException(@Nonnull Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = Objects.requireNonNull(path, "path");
    }

    /**
     * Get the offending file.
     *
     * @return the path
     */
    @Nonnull
    public Path getPath() {
        return path;
    }
}
