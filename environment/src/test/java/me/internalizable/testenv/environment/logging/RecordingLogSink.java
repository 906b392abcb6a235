package me.internalizable.testenv.environment.logging;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sink keeping every emitted record in memory.
 */
public class RecordingLogSink implements LogSink {

    private final List<LogRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void emit(@Nonnull LogRecord record) {
        records.add(record);
    }

    public List<LogRecord> records() {
        return new ArrayList<>(records);
    }

    public List<String> messages() {
        List<String> messages = new ArrayList<>();
        records.forEach(r -> messages.add(r.getMessage()));
        return messages;
    }
}
