package work.contracts.renderer.api;

import java.util.Locale;

/**
 * Renderer log levels, mapped onto the SLF4J simple logger levels.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    public String simpleLoggerName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
