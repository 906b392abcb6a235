package me.internalizable.testenv.environment.logging;

import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Severity of a structured log record, most severe first.
 */
public enum LogLevel {
    CRITICAL(50),
    ERROR(40),
    WARNING(30),
    INFO(20),
    DEBUG(10);

    private final int severity;

    LogLevel(int severity) {
        this.severity = severity;
    }

    public int getSeverity() {
        return severity;
    }

    /**
     * Check if this level is at least as severe as another.
     *
     * @param other the threshold
     * @return true if this level passes the threshold
     */
    public boolean isAtLeast(LogLevel other) {
        return severity >= other.severity;
    }

    /**
     * Parse a level name as written by workers.
     *
     * @param name level name, case-insensitive; {@code warn} and {@code fatal} are accepted
     * @return the level, or null if unknown
     */
    @Nullable
    public static LogLevel fromName(@Nullable String name) {
        if (name == null) {
            return null;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "critical", "fatal" -> CRITICAL;
            case "error" -> ERROR;
            case "warning", "warn" -> WARNING;
            case "info" -> INFO;
            case "debug" -> DEBUG;
            default -> null;
        };
    }
}
