package org.devplatform.logs;

/**
 * How the streamer renders entries.
 */
public enum LogFormat {
    /** Local time, colored level, service and message, with extra fields on a second line. */
    PRETTY,
    /** One JSON object per entry. */
    JSON,
    /** The original line, untouched. */
    RAW
}
