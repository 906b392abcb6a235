package me.internalizable.testenv.environment.logging;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded FIFO of log records shared by every producer and one consumer.
 *
 * <p>{@link #put(LogRecord)} never blocks; {@link #take()} blocks until a
 * record or the end-of-stream sentinel is available.</p>
 */
public class LogQueue {

    private final BlockingQueue<LogRecord> records = new LinkedBlockingQueue<>();

    public void put(@Nonnull LogRecord record) {
        records.offer(Objects.requireNonNull(record, "record"));
    }

    /**
     * Signal the consumer that no further records follow.
     */
    public void close() {
        records.offer(LogRecord.END_OF_STREAM);
    }

    @Nonnull
    public LogRecord take() throws InterruptedException {
        return records.take();
    }

    public int size() {
        return records.size();
    }
}
