package work.lcod.liquid.api;

import java.util.Locale;

/**
 * Diagnostic thresholds for messages written to standard error.
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
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /**
     * Whether a message at {@code level} passes this threshold.
     */
    public boolean enables(LogLevel level) {
        return level.ordinal() >= ordinal();
    }
}
