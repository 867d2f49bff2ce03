package org.devplatform.supervisor;

import org.devplatform.health.HealthStatus;

/**
 * Observes lifecycle and health changes of supervised services. Callbacks run synchronously on
 * the thread that made the change and must not block.
 */
public interface ServiceStateListener {

    default void onStateChange(final String service, final ProcessState from, final ProcessState to) {
    }

    default void onHealthChange(final String service, final HealthStatus status) {
    }
}
