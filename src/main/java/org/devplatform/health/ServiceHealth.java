package org.devplatform.health;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * The last recorded health of one registered check.
 *
 * @param name                The registered name.
 * @param status              The status of the most recent probe, {@code UNKNOWN} before the first one.
 * @param lastCheck           When the most recent probe finished, or {@code null}.
 * @param responseTime        How long the most recent probe took, or {@code null}.
 * @param consecutiveFailures Probes in a row that were not healthy; reset only by a healthy probe.
 * @param healthySince        When the check first turned healthy, or {@code null}.
 * @param retries             The retry budget of the check.
 */
public record ServiceHealth(
    String name,
    HealthStatus status,
    Instant lastCheck,
    Duration responseTime,
    int consecutiveFailures,
    Instant healthySince,
    int retries
) {

    static ServiceHealth initial(final String name, final HealthCheck check) {
        return new ServiceHealth(name, HealthStatus.UNKNOWN, null, null, 0, null, check.retries());
    }

    ServiceHealth record(final HealthStatus newStatus, final Instant checkedAt, final Duration latency) {
        final int failures = newStatus.isHealthy() ? 0 : consecutiveFailures + 1;
        final Instant since = newStatus.isHealthy() && healthySince == null ? checkedAt : healthySince;
        return new ServiceHealth(name, newStatus, checkedAt, latency, failures, since, retries);
    }

    /**
     * @return true once more consecutive probes have failed than the check allows.
     */
    public boolean retriesExhausted() {
        return consecutiveFailures > retries;
    }

    public Optional<Duration> uptime() {
        return Optional.ofNullable(healthySince).map(since -> Duration.between(since, Instant.now()));
    }
}
