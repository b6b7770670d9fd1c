package work.lcod.config.api;

import java.util.Locale;

/**
 * Log levels understood by the command line and by {@link BuildConfiguration}.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";

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
     * Makes this the default level of the SLF4J simple binding. Only affects loggers created afterwards.
     */
    public void apply() {
        System.setProperty(SIMPLE_LOGGER_LEVEL, name().toLowerCase(Locale.ROOT));
    }
}
