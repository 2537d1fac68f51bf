package pl.marcinmilkowski.line_search.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.Locale;

/**
 * Runtime verbosity control on top of the Logback setup in logback.xml.
 */
public final class LoggingConfig {

    /** Marks conditions that terminate the process (SLF4J has no CRITICAL level). */
    public static final Marker FATAL = MarkerFactory.getMarker("FATAL");

    private LoggingConfig() {
    }

    /**
     * Set the root level from a command-line name. Accepts the Python-style
     * CRITICAL and NOTSET spellings alongside Logback's own names.
     *
     * @return the level actually applied
     * @throws IllegalArgumentException for an unknown level name
     */
    public static Level setRootLevel(String levelName) {
        Level level = parseLevel(levelName);
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        } else {
            LoggerFactory.getLogger(LoggingConfig.class)
                .warn("Logback is not the active SLF4J binding; ignoring log level {}", levelName);
        }
        return level;
    }

    static Level parseLevel(String levelName) {
        String name = levelName == null ? "" : levelName.strip().toUpperCase(Locale.ROOT);
        return switch (name) {
            case "CRITICAL", "FATAL", "ERROR" -> Level.ERROR;
            case "WARNING", "WARN" -> Level.WARN;
            case "INFO" -> Level.INFO;
            case "DEBUG" -> Level.DEBUG;
            case "TRACE", "NOTSET", "ALL" -> Level.TRACE;
            case "OFF" -> Level.OFF;
            default -> throw new IllegalArgumentException("Unknown log level: " + levelName);
        };
    }
}
