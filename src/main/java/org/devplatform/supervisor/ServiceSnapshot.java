package org.devplatform.supervisor;

import org.devplatform.health.HealthStatus;

import java.time.Instant;

/**
 * Read-only view of one supervised service at a point in time.
 *
 * @param name            The service name.
 * @param state           The lifecycle state.
 * @param health          The last health status.
 * @param restartCount    Restarts since the service was first started.
 * @param pid             The child's process id, or {@code null} if no child is owned.
 * @param startedAt       When the current child was spawned, or {@code null}.
 * @param lastHealthCheck When the last health probe finished, or {@code null}.
 * @param lastExitCode    Exit code of the last child that exited on its own, or {@code null}.
 */
public record ServiceSnapshot(
    String name,
    ProcessState state,
    HealthStatus health,
    int restartCount,
    Long pid,
    Instant startedAt,
    Instant lastHealthCheck,
    Integer lastExitCode
) {
}
