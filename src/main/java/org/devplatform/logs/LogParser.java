package org.devplatform.logs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one raw log line into a {@link LogEntry}. JSON object lines are read field by field;
 * anything else is scanned for an embedded timestamp and level keyword. Parsing is lenient and
 * never fails: the worst case is an entry whose message is the raw line, stamped now, at INFO.
 */
public class LogParser {

    private static final Pattern LEVEL_PATTERN =
        Pattern.compile("(?i)\\b(TRACE|DEBUG|INFO|WARN|WARNING|ERROR)\\b");
    private static final Pattern TIMESTAMP_PATTERN =
        Pattern.compile("\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}");
    private static final DateTimeFormatter TEXT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final String[] TIMESTAMP_KEYS = {"timestamp", "time", "ts"};
    private static final String[] LEVEL_KEYS = {"level", "severity"};
    private static final String[] MESSAGE_KEYS = {"message", "msg"};

    private final ObjectMapper mapper;
    private final Clock clock;

    public LogParser() {
        this(Clock.systemUTC());
    }

    public LogParser(final Clock clock) {
        this.mapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.clock = clock;
    }

    /**
     * Parses one line.
     *
     * @param line    The raw line, with or without its line terminator.
     * @param service The service that produced the line.
     * @return The parsed entry, or empty for a blank line.
     */
    public Optional<LogEntry> parse(final String line, final String service) {
        if (line == null) {
            return Optional.empty();
        }
        final String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        if (trimmed.startsWith("{")) {
            final ObjectNode json = readObject(trimmed);
            if (json != null) {
                return Optional.of(parseJson(json, service, trimmed));
            }
        }
        return Optional.of(parseText(trimmed, service));
    }

    private ObjectNode readObject(final String text) {
        try {
            final JsonNode node = mapper.readTree(text);
            return node instanceof ObjectNode ? (ObjectNode) node : null;
        } catch (final JsonProcessingException e) {
            return null;
        }
    }

    private LogEntry parseJson(final ObjectNode json, final String service, final String raw) {
        final JsonNode timestampNode = removeFirst(json, TIMESTAMP_KEYS);
        final JsonNode levelNode = removeFirst(json, LEVEL_KEYS);
        final JsonNode messageNode = removeFirst(json, MESSAGE_KEYS);

        final Instant timestamp = timestampNode != null && timestampNode.isTextual()
            ? parseRfc3339(timestampNode.asText())
            : clock.instant();
        final LogLevel level = levelNode != null && levelNode.isTextual()
            ? LogLevel.parse(levelNode.asText())
            : LogLevel.INFO;
        final String message = messageNode != null && messageNode.isTextual()
            ? messageNode.asText()
            : raw;

        final Map<String, JsonNode> fields = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> remaining = json.fields();
        while (remaining.hasNext()) {
            final Map.Entry<String, JsonNode> field = remaining.next();
            fields.put(field.getKey(), field.getValue());
        }

        return new LogEntry(timestamp, service, level, message, fields, raw);
    }

    private LogEntry parseText(final String line, final String service) {
        final Matcher timestampMatch = TIMESTAMP_PATTERN.matcher(line);
        final Instant timestamp = timestampMatch.find()
            ? parseTextTimestamp(timestampMatch.group())
            : clock.instant();

        final Matcher levelMatch = LEVEL_PATTERN.matcher(line);
        final LogLevel level = levelMatch.find() ? LogLevel.parse(levelMatch.group(1)) : LogLevel.INFO;

        return new LogEntry(timestamp, service, level, line, Map.of(), line);
    }

    // Only the first present alias is consumed; later aliases stay behind as fields.
    private static JsonNode removeFirst(final ObjectNode json, final String[] keys) {
        for (final String key : keys) {
            if (json.has(key)) {
                return json.remove(key);
            }
        }
        return null;
    }

    private Instant parseRfc3339(final String value) {
        try {
            return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (final DateTimeParseException e) {
            return clock.instant();
        }
    }

    private Instant parseTextTimestamp(final String value) {
        try {
            return LocalDateTime.parse(value.replace('T', ' '), TEXT_TIMESTAMP).toInstant(ZoneOffset.UTC);
        } catch (final DateTimeParseException e) {
            return clock.instant();
        }
    }
}
