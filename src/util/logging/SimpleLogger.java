package util.logging;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented logger. Each record is
 * {@code <source> <time> [LEVEL] <logger> - [method:line] message} and goes to
 * whatever appenders {@link LogManager} has switched on.
 */
public class SimpleLogger implements Logger {
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{}");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss,SSS");

    private final String name;
    private final LogLevel fixedLevel;

    /**
     * @param fixedLevel level of this logger, or null to follow {@link LogManager#getRootLevel()}
     */
    public SimpleLogger(String name, LogLevel fixedLevel) {
        this.name = name;
        this.fixedLevel = fixedLevel;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isEnabled(LogLevel level) {
        LogLevel threshold = fixedLevel != null ? fixedLevel : LogManager.getRootLevel();
        return !level.isLessSpecificThan(threshold);
    }

    @Override
    public void log(LogLevel level, String message) {
        if (!isEnabled(level)) {
            return;
        }
        StackTraceElement caller = findCaller();
        String where = caller == null ? "" : "[" + caller.getMethodName() + ":" + caller.getLineNumber() + "] ";
        String line = LogManager.getSourceTag() + " " + LocalDateTime.now().format(TIMESTAMP)
                + " [" + level + "] " + name + " - " + where + message;
        LogManager.writeLog(level, line);
    }

    private static boolean isLoggingFrame(String className) {
        return className.equals(SimpleLogger.class.getName()) || className.equals(Logger.class.getName())
                || className.equals(LogManager.class.getName());
    }

    /**
     * First stack frame outside the logging classes.
     */
    private static StackTraceElement findCaller() {
        boolean inLogging = false;
        for (StackTraceElement element : Thread.currentThread().getStackTrace()) {
            boolean logging = isLoggingFrame(element.getClassName());
            if (inLogging && !logging && !element.getClassName().startsWith("java.lang.reflect.")) {
                return element;
            }
            inLogging |= logging;
        }
        return null;
    }

    static String formatMessage(String format, Object... args) {
        if (args == null || args.length == 0) {
            return format;
        }
        StringBuilder result = new StringBuilder();
        int next = 0;
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(format);
        while (matcher.find()) {
            String replacement = "{}";
            if (next < args.length) {
                replacement = String.valueOf(args[next++]);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
