package org.devplatform.supervisor;

import java.util.Objects;

/**
 * Lifecycle state of a supervised service.
 * <pre>
 * STARTING -> RUNNING -> STOPPING -> STOPPED
 *                     -> FAILED(reason)
 *                     -> RESTARTING -> STARTING
 * </pre>
 *
 * @param phase  The lifecycle phase.
 * @param reason Why the service failed; only set for {@link Phase#FAILED}.
 */
public record ProcessState(Phase phase, String reason) {

    public static final ProcessState STARTING = new ProcessState(Phase.STARTING, null);
    public static final ProcessState RUNNING = new ProcessState(Phase.RUNNING, null);
    public static final ProcessState STOPPING = new ProcessState(Phase.STOPPING, null);
    public static final ProcessState STOPPED = new ProcessState(Phase.STOPPED, null);
    public static final ProcessState RESTARTING = new ProcessState(Phase.RESTARTING, null);

    public enum Phase {
        STARTING,
        RUNNING,
        STOPPING,
        STOPPED,
        FAILED,
        RESTARTING
    }

    public ProcessState {
        Objects.requireNonNull(phase, "phase");
    }

    public static ProcessState failed(final String reason) {
        return new ProcessState(Phase.FAILED, reason);
    }

    public boolean is(final Phase expected) {
        return phase == expected;
    }

    @Override
    public String toString() {
        return reason == null ? phase.name() : phase.name() + "(" + reason + ")";
    }
}
