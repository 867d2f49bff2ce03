package org.devplatform.logs;

import java.util.Locale;

/**
 * Severity of a log entry, ordered from least to most severe.
 */
public enum LogLevel {
    TRACE("\u001B[90m"),
    DEBUG("\u001B[36m"),
    INFO("\u001B[32m"),
    WARN("\u001B[33m"),
    ERROR("\u001B[31m");

    private final String ansiColor;

    LogLevel(final String ansiColor) {
        this.ansiColor = ansiColor;
    }

    /**
     * Lenient lookup: case-insensitive, accepts {@code WARNING} for {@link #WARN}, and falls
     * back to {@link #INFO} for anything unrecognized.
     */
    public static LogLevel parse(final String value) {
        if (value == null) {
            return INFO;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "TRACE" -> TRACE;
            case "DEBUG" -> DEBUG;
            case "WARN", "WARNING" -> WARN;
            case "ERROR" -> ERROR;
            default -> INFO;
        };
    }

    public boolean isAtLeast(final LogLevel minimum) {
        return compareTo(minimum) >= 0;
    }

    String ansiColor() {
        return ansiColor;
    }
}
