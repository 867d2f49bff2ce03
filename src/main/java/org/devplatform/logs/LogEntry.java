package org.devplatform.logs;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One parsed log line. Transient: it flows once from a watcher through the streamer's channel.
 *
 * @param timestamp When the line was logged (UTC), or when it was read if the line carried no time.
 * @param service   The service whose log file produced the line.
 * @param level     The severity.
 * @param message   The message text.
 * @param fields    Any JSON keys beyond timestamp, level and message, in their original order.
 * @param raw       The original line, trimmed.
 */
public record LogEntry(
    Instant timestamp,
    String service,
    LogLevel level,
    String message,
    Map<String, JsonNode> fields,
    String raw
) {

    public LogEntry {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(raw, "raw");
        fields = fields == null || fields.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
