package me.internalizable.testenv.environment.logging;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Logger bound to one component, with a replaceable filter chain.
 *
 * <p>Records without a component are stamped with this logger's component
 * before the filter runs. Records the filter drops never reach the sink.</p>
 */
public class StructuredLogger {

    private final String component;
    private final LogSink sink;

    private volatile LogFilter componentFilter = LogFilter.identity();

    public StructuredLogger(@Nonnull String component, @Nonnull LogSink sink) {
        this.component = Objects.requireNonNull(component, "component");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Nonnull
    public String getComponent() {
        return component;
    }

    @Nonnull
    public LogFilter getComponentFilter() {
        return componentFilter;
    }

    public void setComponentFilter(@Nonnull LogFilter componentFilter) {
        this.componentFilter = Objects.requireNonNull(componentFilter, "componentFilter");
    }

    /**
     * Emit a record through the filter chain.
     *
     * @param record the record
     */
    public void log(@Nonnull LogRecord record) {
        Objects.requireNonNull(record, "record");
        LogRecord stamped = record.getComponent() == null ? record.withComponent(component) : record;
        LogRecord filtered = componentFilter.apply(stamped);
        if (filtered != null) {
            sink.emit(filtered);
        }
    }
}
