package me.internalizable.testenv.environment.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Forwards structured records to SLF4J.
 *
 * <p>Each component gets its own logger named {@code testenv.<component>}.
 * The record source and fields are attached as key/value pairs; critical
 * records are logged at ERROR with the {@code CRITICAL} marker.</p>
 */
public class Slf4jLogSink implements LogSink {

    static final String LOGGER_PREFIX = "testenv.";

    private static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

    private final Map<String, Logger> loggers = new ConcurrentHashMap<>();

    @Override
    public void emit(@Nonnull LogRecord record) {
        String component = record.getComponent() != null ? record.getComponent() : "default";
        Logger logger = loggers.computeIfAbsent(component, c -> LoggerFactory.getLogger(LOGGER_PREFIX + c));

        LoggingEventBuilder event = logger.atLevel(toSlf4j(record.getLevel()));
        if (record.getLevel() == LogLevel.CRITICAL) {
            event = event.addMarker(CRITICAL);
        }
        event = event.addKeyValue("source", record.getSource());
        for (Map.Entry<String, Object> field : record.getFields().entrySet()) {
            event = event.addKeyValue(field.getKey(), field.getValue());
        }
        event.log(record.getMessage());
    }

    static Level toSlf4j(LogLevel level) {
        return switch (level) {
            case CRITICAL, ERROR -> Level.ERROR;
            case WARNING -> Level.WARN;
            case INFO -> Level.INFO;
            case DEBUG -> Level.DEBUG;
        };
    }
}
