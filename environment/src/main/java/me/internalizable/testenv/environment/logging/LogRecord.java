package me.internalizable.testenv.environment.logging;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A structured log record travelling from a producer to the structured logger.
 *
 * <p>{@link #END_OF_STREAM} is the sentinel telling the consumer that no
 * further records will be sent. It is compared by identity.</p>
 */
public final class LogRecord {

    /**
     * Sentinel marking the end of a log queue.
     */
    public static final LogRecord END_OF_STREAM =
            new LogRecord(LogLevel.DEBUG, null, "", "<end-of-stream>", Map.of(), 0L);

    private final LogLevel level;
    private final String component;
    private final String source;
    private final String message;
    private final Map<String, Object> fields;
    private final long timestamp;

    /**
     * Create a log record.
     *
     * @param level severity
     * @param component logging component, or null if not yet assigned
     * @param source identity of the emitter
     * @param message rendered message
     * @param fields structured fields
     * @param timestamp creation time in milliseconds since epoch
     */
    public LogRecord(
            @Nonnull LogLevel level,
            @Nullable String component,
            @Nonnull String source,
            @Nonnull String message,
            @Nonnull Map<String, Object> fields,
            long timestamp) {
        this.level = Objects.requireNonNull(level, "level");
        this.component = component;
        this.source = Objects.requireNonNull(source, "source");
        this.message = Objects.requireNonNull(message, "message");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.timestamp = timestamp;
    }

    @Nonnull
    public LogLevel getLevel() {
        return level;
    }

    @Nullable
    public String getComponent() {
        return component;
    }

    @Nonnull
    public String getSource() {
        return source;
    }

    @Nonnull
    public String getMessage() {
        return message;
    }

    @Nonnull
    public Map<String, Object> getFields() {
        return fields;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public boolean isEndOfStream() {
        return this == END_OF_STREAM;
    }

    @Nonnull
    public LogRecord withLevel(@Nonnull LogLevel newLevel) {
        return new LogRecord(newLevel, component, source, message, fields, timestamp);
    }

    @Nonnull
    public LogRecord withComponent(@Nonnull String newComponent) {
        return new LogRecord(level, newComponent, source, message, fields, timestamp);
    }

    @Override
    public String toString() {
        return "LogRecord{" +
                "level=" + level +
                ", component='" + component + '\'' +
                ", source='" + source + '\'' +
                ", message='" + message + '\'' +
                '}';
    }
}
