package me.internalizable.testenv.environment.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Daemon thread draining a {@link LogQueue} into a structured logger.
 *
 * <p>Records are forwarded unmodified; any rewriting happens in the logger's
 * filter chain. The thread ends when it takes the end-of-stream sentinel.</p>
 */
public class LogQueueThread extends Thread {

    private static final Logger LOGGER = LoggerFactory.getLogger(LogQueueThread.class);

    private final LogQueue queue;
    private final StructuredLogger logger;

    public LogQueueThread(@Nonnull LogQueue queue, @Nonnull StructuredLogger logger) {
        super("LogQueue-" + logger.getComponent());
        this.queue = Objects.requireNonNull(queue, "queue");
        this.logger = Objects.requireNonNull(logger, "logger");
        setDaemon(true);
    }

    @Override
    public void run() {
        while (true) {
            LogRecord record;
            try {
                record = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.debug("Log queue consumer for '{}' interrupted", logger.getComponent());
                return;
            }

            if (record.isEndOfStream()) {
                return;
            }

            try {
                logger.log(record);
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to forward record from '{}': {}", record.getSource(), e.getMessage(), e);
            }
        }
    }
}
