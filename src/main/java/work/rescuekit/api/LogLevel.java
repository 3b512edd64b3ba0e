package work.rescuekit.api;

import ch.qos.logback.classic.Level;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console verbosity selectable from the command line.
 */
public enum LogLevel {
    TRACE(Level.TRACE),
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR),
    OFF(Level.OFF);

    private static final String APPLICATION_LOGGER = "work.rescuekit";

    private final Level level;

    LogLevel(Level level) {
        this.level = level;
    }

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
     * Sets the root and {@code work.rescuekit} Logback loggers to this level. No-op when another SLF4J
     * binding is active.
     */
    public void apply() {
        for (String name : new String[] {Logger.ROOT_LOGGER_NAME, APPLICATION_LOGGER}) {
            Logger logger = LoggerFactory.getLogger(name);
            if (logger instanceof ch.qos.logback.classic.Logger logback) {
                logback.setLevel(level);
            }
        }
    }
}
