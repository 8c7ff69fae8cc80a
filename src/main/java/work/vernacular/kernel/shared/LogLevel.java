package work.vernacular.kernel.shared;

import java.util.Locale;

/**
 * Kernel log levels, lowest to highest severity.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return FATAL;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    public boolean includes(LogLevel other) {
        return other.ordinal() >= ordinal();
    }
}
