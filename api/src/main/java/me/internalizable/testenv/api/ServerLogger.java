package me.internalizable.testenv.api;

/**
 * Producer-side logger handed to server workers.
 *
 * <p>Implementations only enqueue records; they never perform I/O on the
 * caller's thread. Arguments are rendered into the record message, a trailing
 * {@link java.util.Map} contributes structured fields and a {@link Throwable}
 * contributes its stack trace.</p>
 */
public interface ServerLogger {

    void critical(Object... args);

    void error(Object... args);

    void warning(Object... args);

    void info(Object... args);

    void debug(Object... args);
}
