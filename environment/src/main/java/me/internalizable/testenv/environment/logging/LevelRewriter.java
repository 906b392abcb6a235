package me.internalizable.testenv.environment.logging;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Rewrites the level of selected records after an inner filter admitted them.
 */
public class LevelRewriter implements LogFilter {

    private final LogFilter inner;
    private final Set<LogLevel> from;
    private final LogLevel to;

    /**
     * Create a rewriter.
     *
     * @param inner filter applied first
     * @param from levels to rewrite
     * @param to replacement level
     */
    public LevelRewriter(@Nonnull LogFilter inner, @Nonnull Set<LogLevel> from, @Nonnull LogLevel to) {
        this.inner = Objects.requireNonNull(inner, "inner");
        this.from = from.isEmpty() ? EnumSet.noneOf(LogLevel.class) : EnumSet.copyOf(from);
        this.to = Objects.requireNonNull(to, "to");
    }

    @Nullable
    @Override
    public LogRecord apply(@Nonnull LogRecord record) {
        LogRecord admitted = inner.apply(record);
        if (admitted == null || !from.contains(admitted.getLevel())) {
            return admitted;
        }
        return admitted.withLevel(to);
    }
}
