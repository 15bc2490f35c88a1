package util.logging;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates {@link Logger} instances and owns the appenders.
 *
 * Both appenders are off by default. {@code -Dlog.console=true} and
 * {@code -Dlog.file=true} switch them on, {@code -Dlog.level=debug} (or
 * {@code -Ddebug=true}) lowers the root level.
 */
public class LogManager {
    private static final String LOG_DIRECTORY = "logs";
    private static final Map<String, Logger> loggers = new ConcurrentHashMap<>();
    private static volatile LogLevel rootLevel = LogLevel.INFO;
    private static boolean initialized = false;

    private static boolean consoleEnabled = false;
    private static boolean fileEnabled = false;
    private static PrintWriter fileWriter;
    private static final Object FILE_LOCK = new Object();

    // captured lines, used by tests to assert on log output
    private static List<String> memory = null;

    private static volatile String sourceTag = "unknown";

    private LogManager() {
    }

    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName(), null);
    }

    /**
     * @param level fixed level for this logger; null follows the root level
     */
    public static Logger getLogger(Class<?> clazz, LogLevel level) {
        return getLogger(clazz.getName(), level);
    }

    public static synchronized Logger getLogger(String name, LogLevel level) {
        if (!initialized) {
            init();
        }
        return loggers.computeIfAbsent(name, n -> new SimpleLogger(n, level));
    }

    public static synchronized void init() {
        if (initialized) {
            return;
        }

        LogLevel fromProperty = LogLevel.parse(System.getProperty("log.level"), LogLevel.INFO);
        rootLevel = getFlag("debug") ? LogLevel.DEBUG : fromProperty;
        consoleEnabled = getFlag("log.console");
        fileEnabled = getFlag("log.file");

        if (fileEnabled) {
            openFile();
        }
        initialized = true;
    }

    private static boolean getFlag(String name) {
        String raw = System.getProperty(name);
        return raw != null && raw.equalsIgnoreCase("true");
    }

    private static void openFile() {
        File logDir = new File(LOG_DIRECTORY);
        if (!logDir.exists() && !logDir.mkdirs()) {
            System.err.println("cannot create log directory " + logDir.getAbsolutePath());
            fileEnabled = false;
            return;
        }
        try {
            File logFile = new File(logDir, "plan-compiler" + System.currentTimeMillis() + ".log");
            fileWriter = new PrintWriter(new FileWriter(logFile, true), true);
        } catch (IOException e) {
            System.err.println("cannot open log file: " + e.getMessage());
            fileEnabled = false;
        }
    }

    public static void setRootLevel(LogLevel level) {
        rootLevel = level;
    }

    public static LogLevel getRootLevel() {
        return rootLevel;
    }

    /**
     * Tag printed at the start of each line, normally the file being compiled.
     */
    public static void setSourceTag(String tag) {
        sourceTag = tag != null ? tag : "unknown";
    }

    static String getSourceTag() {
        return sourceTag;
    }

    static void writeLog(LogLevel level, String message) {
        if (consoleEnabled) {
            if (level.getValue() >= LogLevel.WARN.getValue()) {
                System.err.println(message);
            } else {
                System.out.println(message);
            }
        }

        synchronized (FILE_LOCK) {
            if (fileEnabled && fileWriter != null) {
                fileWriter.println(message);
            }
            if (memory != null) {
                memory.add(message);
            }
        }
    }

    public static void enableConsole() {
        consoleEnabled = true;
    }

    public static void disableConsole() {
        consoleEnabled = false;
    }

    public static synchronized void enableFile() {
        fileEnabled = true;
        if (fileWriter == null) {
            openFile();
        }
    }

    public static void disableFile() {
        synchronized (FILE_LOCK) {
            fileEnabled = false;
            if (fileWriter != null) {
                fileWriter.close();
                fileWriter = null;
            }
        }
    }

    /**
     * Start keeping every written line in memory until {@link #drainMemory()}.
     */
    public static void captureInMemory() {
        synchronized (FILE_LOCK) {
            memory = new ArrayList<>();
        }
    }

    public static List<String> drainMemory() {
        synchronized (FILE_LOCK) {
            List<String> lines = memory != null ? memory : List.of();
            memory = null;
            return lines;
        }
    }

    public static void shutdown() {
        disableFile();
    }
}
