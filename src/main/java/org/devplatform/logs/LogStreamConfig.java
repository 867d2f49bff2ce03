package org.devplatform.logs;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Display settings for {@link LogStreamer#stream}. All configured filters must pass for an entry
 * to be shown.
 */
public final class LogStreamConfig {

    public static final int DEFAULT_LINES = 100;

    private final boolean follow;
    private final Integer lines;
    private final LogLevel minLevel;
    private final String serviceFilter;
    private final Pattern pattern;
    private final LogFormat format;

    private LogStreamConfig(final Builder builder) {
        this.follow = builder.follow;
        this.lines = builder.lines;
        this.minLevel = builder.minLevel;
        this.serviceFilter = builder.serviceFilter;
        this.pattern = builder.pattern;
        this.format = builder.format;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static LogStreamConfig defaults() {
        return builder().build();
    }

    /**
     * Applies the level, service and pattern filters in that order.
     */
    public boolean matches(final LogEntry entry) {
        if (minLevel != null && !entry.level().isAtLeast(minLevel)) {
            return false;
        }
        if (serviceFilter != null && !entry.service().contains(serviceFilter)) {
            return false;
        }
        return pattern == null || pattern.matcher(entry.message()).find();
    }

    public boolean follow() {
        return follow;
    }

    /**
     * @return how many of the most recent matching entries a one-shot stream shows; empty for all.
     */
    public OptionalInt lines() {
        return lines == null ? OptionalInt.empty() : OptionalInt.of(lines);
    }

    public LogLevel minLevel() {
        return minLevel;
    }

    public String serviceFilter() {
        return serviceFilter;
    }

    public Pattern pattern() {
        return pattern;
    }

    public LogFormat format() {
        return format;
    }

    public static final class Builder {
        private boolean follow;
        private Integer lines = DEFAULT_LINES;
        private LogLevel minLevel;
        private String serviceFilter;
        private Pattern pattern;
        private LogFormat format = LogFormat.PRETTY;

        private Builder() {
        }

        public Builder follow(final boolean follow) {
            this.follow = follow;
            return this;
        }

        /**
         * @param lines the tail size, or {@code null} to show every matching entry.
         */
        public Builder lines(final Integer lines) {
            if (lines != null && lines < 0) {
                throw new IllegalArgumentException("lines must not be negative, was " + lines);
            }
            this.lines = lines;
            return this;
        }

        public Builder minLevel(final LogLevel minLevel) {
            this.minLevel = minLevel;
            return this;
        }

        public Builder serviceFilter(final String serviceFilter) {
            this.serviceFilter = serviceFilter;
            return this;
        }

        public Builder pattern(final String regex) {
            this.pattern = regex == null ? null : Pattern.compile(regex);
            return this;
        }

        public Builder format(final LogFormat format) {
            this.format = Objects.requireNonNull(format, "format");
            return this;
        }

        public LogStreamConfig build() {
            return new LogStreamConfig(this);
        }
    }
}
