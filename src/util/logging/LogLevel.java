package util.logging;

public enum LogLevel {
    TRACE(0),
    DEBUG(1),
    INFO(2),
    WARN(3),
    ERROR(4),
    OFF(5);

    private final int value;

    LogLevel(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * @return true if messages at this level are filtered out by a logger set to {@code threshold}
     */
    public boolean isLessSpecificThan(LogLevel threshold) {
        return value < threshold.value;
    }

    public static LogLevel parse(String raw, LogLevel fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return LogLevel.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
