package me.internalizable.testenv.environment.logging;

import javax.annotation.Nonnull;

/**
 * Destination for records that made it through a structured logger's filters.
 */
@FunctionalInterface
public interface LogSink {

    void emit(@Nonnull LogRecord record);
}
