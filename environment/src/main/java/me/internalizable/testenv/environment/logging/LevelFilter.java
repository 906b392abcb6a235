package me.internalizable.testenv.environment.logging;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Drops records below a minimum level, then hands the rest to an inner filter.
 */
public class LevelFilter implements LogFilter {

    private final LogFilter inner;
    private final LogLevel minimum;

    public LevelFilter(@Nonnull LogFilter inner, @Nonnull LogLevel minimum) {
        this.inner = Objects.requireNonNull(inner, "inner");
        this.minimum = Objects.requireNonNull(minimum, "minimum");
    }

    @Nullable
    @Override
    public LogRecord apply(@Nonnull LogRecord record) {
        if (!record.getLevel().isAtLeast(minimum)) {
            return null;
        }
        return inner.apply(record);
    }
}
