package util.logging;

/**
 * Logger facade used across the compiler. Formatted variants take {@code {}}
 * placeholders and are only formatted when the level is enabled.
 */
public interface Logger {
    String getName();

    boolean isEnabled(LogLevel level);

    /** Writes an already formatted message, if the level is enabled. */
    void log(LogLevel level, String message);

    default void log(LogLevel level, String format, Object... args) {
        if (isEnabled(level)) {
            log(level, SimpleLogger.formatMessage(format, args));
        }
    }

    default void trace(String format, Object... args) {
        log(LogLevel.TRACE, format, args);
    }

    default void debug(String format, Object... args) {
        log(LogLevel.DEBUG, format, args);
    }

    default void info(String format, Object... args) {
        log(LogLevel.INFO, format, args);
    }

    default void warn(String format, Object... args) {
        log(LogLevel.WARN, format, args);
    }

    default void error(String format, Object... args) {
        log(LogLevel.ERROR, format, args);
    }

    default boolean isDebugEnabled() {
        return isEnabled(LogLevel.DEBUG);
    }

    default boolean isTraceEnabled() {
        return isEnabled(LogLevel.TRACE);
    }
}
