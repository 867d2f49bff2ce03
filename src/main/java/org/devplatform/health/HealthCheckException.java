package org.devplatform.health;

/**
 * A probe could not reach its target: connection refused, timeout, unlaunchable command.
 * Recoverable; callers record it as an unhealthy status instead of propagating it.
 */
public class HealthCheckException extends RuntimeException {

    public HealthCheckException(final String message) {
        super(message);
    }

    public HealthCheckException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
