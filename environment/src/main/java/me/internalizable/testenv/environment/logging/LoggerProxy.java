package me.internalizable.testenv.environment.logging;

import me.internalizable.testenv.api.ServerLogger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * Producer-side log handle for server workers.
 *
 * <p>Every call turns its arguments into a {@link LogRecord} tagged with this
 * proxy's unique source identity and puts it on the shared queue. Nothing is
 * written from the calling thread.</p>
 */
public class LoggerProxy implements ServerLogger {

    private final String name;
    private final String source;
    private final LogQueue queue;

    public LoggerProxy(@Nonnull String name, @Nonnull LogQueue queue) {
        this.name = Objects.requireNonNull(name, "name");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.source = UUID.randomUUID().toString();
    }

    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * Identity stamped on every record this proxy emits.
     *
     * @return unique source identifier
     */
    @Nonnull
    public String getSource() {
        return source;
    }

    @Override
    public void critical(Object... args) {
        enqueue(LogLevel.CRITICAL, args);
    }

    @Override
    public void error(Object... args) {
        enqueue(LogLevel.ERROR, args);
    }

    @Override
    public void warning(Object... args) {
        enqueue(LogLevel.WARNING, args);
    }

    @Override
    public void info(Object... args) {
        enqueue(LogLevel.INFO, args);
    }

    @Override
    public void debug(Object... args) {
        enqueue(LogLevel.DEBUG, args);
    }

    /**
     * Enqueue a record with an explicit level and fields.
     *
     * @param level severity
     * @param message message text
     * @param fields structured fields
     */
    public void log(@Nonnull LogLevel level, @Nonnull String message, @Nonnull Map<String, Object> fields) {
        queue.put(new LogRecord(level, null, source, message, fields, System.currentTimeMillis()));
    }

    private void enqueue(LogLevel level, @Nullable Object[] args) {
        StringJoiner message = new StringJoiner(" ");
        Map<String, Object> fields = new LinkedHashMap<>();
        if (args != null) {
            for (Object arg : args) {
                if (arg instanceof Map) {
                    ((Map<?, ?>) arg).forEach((k, v) -> fields.put(String.valueOf(k), v));
                } else if (arg instanceof Throwable) {
                    fields.put("stack", stackTrace((Throwable) arg));
                    message.add(arg.toString());
                } else {
                    message.add(String.valueOf(arg));
                }
            }
        }
        log(level, message.toString(), fields);
    }

    private static String stackTrace(Throwable t) {
        StringWriter out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    @Override
    public String toString() {
        return "LoggerProxy{name='" + name + "', source=" + source + '}';
    }
}
