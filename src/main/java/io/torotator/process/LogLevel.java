package io.torotator.process;

import org.apache.logging.log4j.Level;

import java.util.Locale;

public enum LogLevel {
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR);

    private final Level log4jLevel;

    LogLevel(Level log4jLevel) {
        this.log4jLevel = log4jLevel;
    }

    public Level log4jLevel() {
        return log4jLevel;
    }

    /**
     * Maps the level names used by the supervised programs. Anything unrecognized is {@link #INFO}.
     */
    public static LogLevel fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            return INFO;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "debug":
                return DEBUG;
            case "warn":
            case "warning":
                return WARN;
            case "err":
            case "error":
            case "fatal":
            case "alert":
            case "emerg":
            case "crit":
                return ERROR;
            default:
                return INFO;
        }
    }
}
