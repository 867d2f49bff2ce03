package org.devplatform.logs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.stream.Collectors;

/**
 * Renders entries in one of the {@link LogFormat}s.
 */
final class LogRenderer {

    private static final String RESET = "\u001B[0m";
    private static final String DIM = "\u001B[2m";
    private static final String CYAN = "\u001B[36m";
    private static final String GREY = "\u001B[90m";
    private static final DateTimeFormatter PRETTY_TIME =
        DateTimeFormatter.ofPattern("HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    private final ObjectMapper mapper = new ObjectMapper();

    String render(final LogEntry entry, final LogFormat format) {
        return switch (format) {
            case PRETTY -> pretty(entry);
            case JSON -> json(entry);
            case RAW -> entry.raw();
        };
    }

    private String pretty(final LogEntry entry) {
        final StringBuilder sb = new StringBuilder();
        sb.append(DIM).append(PRETTY_TIME.format(entry.timestamp())).append(RESET).append(' ')
            .append(entry.level().ansiColor()).append(String.format("%-5s", entry.level())).append(RESET).append(' ')
            .append(GREY).append(entry.service()).append(RESET).append(' ')
            .append(entry.message());

        if (!entry.fields().isEmpty()) {
            final String fields = entry.fields().entrySet().stream()
                .map(field -> CYAN + field.getKey() + RESET + DIM + "=" + field.getValue() + RESET)
                .collect(Collectors.joining(" "));
            sb.append(System.lineSeparator()).append("  ").append(fields);
        }
        return sb.toString();
    }

    String json(final LogEntry entry) {
        final ObjectNode node = mapper.createObjectNode();
        node.put("timestamp", entry.timestamp().toString());
        node.put("service", entry.service());
        node.put("level", entry.level().name());
        node.put("message", entry.message());
        final ObjectNode fields = node.putObject("fields");
        entry.fields().forEach(fields::set);
        node.put("raw", entry.raw());
        try {
            return mapper.writeValueAsString(node);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize log entry for " + entry.service(), e);
        }
    }
}
