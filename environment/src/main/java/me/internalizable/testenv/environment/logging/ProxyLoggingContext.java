package me.internalizable.testenv.environment.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;

/**
 * Bridges server workers to the structured logger of one component.
 *
 * <p>The component's filter chain only admits {@code info} and above, and
 * downgrades {@code error} to {@code warning}: server errors are expected
 * during test runs and must not fail the harness.</p>
 *
 * <pre>{@code
 * ProxyLoggingContext context = new ProxyLoggingContext("server", sink, Duration.ofSeconds(1));
 * LoggerProxy logger = context.start();
 * logger.info("listening");
 * context.stop();
 * }</pre>
 */
public class ProxyLoggingContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProxyLoggingContext.class);

    private final StructuredLogger serverLogger;
    private final LogQueue queue;
    private final LogQueueThread thread;
    private final LoggerProxy proxy;
    private final Duration joinTimeout;

    /**
     * Create a logging context.
     *
     * @param component component the worker records are attributed to
     * @param sink destination of admitted records
     * @param joinTimeout how long {@link #stop()} waits for the consumer to drain
     */
    public ProxyLoggingContext(@Nonnull String component, @Nonnull LogSink sink, @Nonnull Duration joinTimeout) {
        Objects.requireNonNull(component, "component");
        this.joinTimeout = Objects.requireNonNull(joinTimeout, "joinTimeout");

        this.serverLogger = new StructuredLogger(component, sink);
        LogFilter filter = new LevelFilter(LogFilter.identity(), LogLevel.INFO);
        filter = new LevelRewriter(filter, EnumSet.of(LogLevel.ERROR), LogLevel.WARNING);
        serverLogger.setComponentFilter(filter);

        this.queue = new LogQueue();
        this.thread = new LogQueueThread(queue, serverLogger);
        this.proxy = new LoggerProxy(component, queue);
    }

    public ProxyLoggingContext(@Nonnull String component) {
        this(component, new Slf4jLogSink(), Duration.ofSeconds(1));
    }

    /**
     * Start the consumer thread.
     *
     * @return the handle to give to workers
     */
    @Nonnull
    public LoggerProxy start() {
        thread.start();
        LOGGER.debug("Started log proxy for component '{}'", serverLogger.getComponent());
        return proxy;
    }

    /**
     * Close the queue and wait a bounded time for the consumer to drain it.
     *
     * <p>The consumer is a daemon; if it does not finish in time it is left
     * behind and cannot keep the JVM alive.</p>
     */
    public void stop() {
        queue.close();
        try {
            thread.join(joinTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            LOGGER.debug("Log proxy for '{}' still draining {} records after {}ms",
                    serverLogger.getComponent(), queue.size(), joinTimeout.toMillis());
        }
    }

    @Nonnull
    public LoggerProxy getProxy() {
        return proxy;
    }

    @Nonnull
    public StructuredLogger getServerLogger() {
        return serverLogger;
    }

    boolean isConsumerAlive() {
        return thread.isAlive();
    }
}
