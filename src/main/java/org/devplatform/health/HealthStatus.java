package org.devplatform.health;

import java.util.Objects;

/**
 * Health classification of a service, shared by the process supervisor and the standalone
 * {@link HealthMonitor}. Statuses are classified, not ordered.
 *
 * @param state  The classification.
 * @param reason Why the service is degraded or unhealthy; {@code null} for the other states.
 */
public record HealthStatus(State state, String reason) {

    public static final HealthStatus UNKNOWN = new HealthStatus(State.UNKNOWN, null);
    public static final HealthStatus HEALTHY = new HealthStatus(State.HEALTHY, null);

    /**
     * The classification of a health status.
     */
    public enum State {
        UNKNOWN,
        HEALTHY,
        DEGRADED,
        UNHEALTHY
    }

    public HealthStatus {
        Objects.requireNonNull(state, "state");
    }

    public static HealthStatus degraded(final String reason) {
        return new HealthStatus(State.DEGRADED, reason);
    }

    public static HealthStatus unhealthy(final String reason) {
        return new HealthStatus(State.UNHEALTHY, reason);
    }

    public boolean isHealthy() {
        return state == State.HEALTHY;
    }

    public boolean isUnknown() {
        return state == State.UNKNOWN;
    }

    /**
     * @return true if the status is neither healthy nor unknown.
     */
    public boolean isFailing() {
        return state == State.DEGRADED || state == State.UNHEALTHY;
    }

    @Override
    public String toString() {
        return reason == null ? state.name() : state.name() + "(" + reason + ")";
    }
}
