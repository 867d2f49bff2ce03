package org.devplatform.health;

import java.time.Duration;
import java.util.Objects;

/**
 * A health check definition for the {@link HealthMonitor}.
 *
 * @param endpoint An {@code http://} or {@code https://} URL, or a shell command.
 * @param interval How often the check runs when the monitor is scheduling.
 * @param timeout  Upper bound for a single probe.
 * @param retries  Consecutive failures tolerated before the check counts as exhausted.
 */
public record HealthCheck(String endpoint, Duration interval, Duration timeout, int retries) {

    public HealthCheck {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(timeout, "timeout");
        if (endpoint.isBlank()) {
            throw new IllegalArgumentException("Health check endpoint must not be blank");
        }
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Health check interval must be positive, was " + interval);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Health check timeout must be positive, was " + timeout);
        }
        if (retries < 0) {
            throw new IllegalArgumentException("Health check retries must not be negative, was " + retries);
        }
    }
}
