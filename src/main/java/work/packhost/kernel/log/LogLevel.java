package work.packhost.kernel.log;

import java.util.Locale;

/**
 * Severity of a pack-scoped log line.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    /**
     * Parses a level name as written in workflow files. {@code warning} is accepted for WARN;
     * blank or unknown names fall back to INFO.
     */
    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        var normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(normalized)) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            return INFO;
        }
    }
}
