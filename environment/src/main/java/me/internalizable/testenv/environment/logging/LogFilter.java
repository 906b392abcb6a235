package me.internalizable.testenv.environment.logging;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Element of a structured logger's filter chain.
 */
@FunctionalInterface
public interface LogFilter {

    /**
     * Pass through, rewrite or drop a record.
     *
     * @param record the incoming record
     * @return the record to emit, or null to drop it
     */
    @Nullable
    LogRecord apply(@Nonnull LogRecord record);

    /**
     * Filter that admits every record unchanged.
     *
     * @return identity filter
     */
    static LogFilter identity() {
        return record -> record;
    }
}
