package org.devplatform.health;

import java.time.Duration;

/**
 * Performs a single bounded health probe against a target.
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * Probes the target once.
     *
     * @param target  The URL or command to probe.
     * @param timeout Upper bound for the probe.
     * @return The classified status of the target.
     * @throws HealthCheckException if the target could not be reached within the timeout.
     */
    HealthStatus probe(String target, Duration timeout);
}
