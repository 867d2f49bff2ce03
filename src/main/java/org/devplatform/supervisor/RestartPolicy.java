package org.devplatform.supervisor;

import java.util.Locale;

/**
 * Whether an unhealthy or exited service is restarted automatically.
 */
public enum RestartPolicy {
    NEVER,
    ON_FAILURE,
    ALWAYS,
    UNLESS_STOPPED;

    /**
     * Accepts the manifest spellings {@code on-failure}, {@code onFailure}, {@code ON_FAILURE}.
     */
    public static RestartPolicy fromString(final String value) {
        final String normalized = value.trim()
            .replaceAll("([a-z])([A-Z])", "$1_$2")
            .replace('-', '_')
            .toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown restart policy '" + value + "'", e);
        }
    }

    /**
     * @return true if a failing health check drives a restart.
     */
    public boolean restartsWhenUnhealthy() {
        return this == ON_FAILURE || this == ALWAYS;
    }

    /**
     * @return true if a child that exited on its own with the given code is restarted.
     */
    public boolean restartsOnExit(final int exitCode) {
        return switch (this) {
            case ALWAYS, UNLESS_STOPPED -> true;
            case ON_FAILURE -> exitCode != 0;
            case NEVER -> false;
        };
    }
}
