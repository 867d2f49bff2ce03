package org.devplatform.supervisor;

import org.devplatform.health.HealthStatus;

import java.time.Instant;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry entry of one supervised service.
 *
 * <p>The lifecycle lock serializes start, stop, restart and exit handling. Every field read by
 * status queries is atomic or volatile, so snapshots never wait on the lock.</p>
 */
final class ServiceProcess {

    final ReentrantLock lifecycleLock = new ReentrantLock();
    final ProcessSlot slot = new ProcessSlot();
    final AtomicInteger restartCount = new AtomicInteger();

    private final String name;
    private final AtomicReference<ProcessState> state = new AtomicReference<>(ProcessState.STOPPED);
    private final AtomicReference<HealthPoller> poller = new AtomicReference<>();
    private volatile ServiceConfig config;
    private volatile HealthStatus health = HealthStatus.UNKNOWN;
    private volatile Instant startedAt;
    private volatile Instant lastHealthCheck;
    private volatile Integer lastExitCode;

    ServiceProcess(final ServiceConfig config) {
        this.name = config.name();
        this.config = config;
    }

    String name() {
        return name;
    }

    ServiceConfig config() {
        return config;
    }

    void config(final ServiceConfig updated) {
        this.config = updated;
    }

    ProcessState state() {
        return state.get();
    }

    /**
     * @return the previous state.
     */
    ProcessState setState(final ProcessState next) {
        return state.getAndSet(next);
    }

    boolean compareAndSetState(final ProcessState expected, final ProcessState next) {
        return state.compareAndSet(expected, next);
    }

    HealthStatus health() {
        return health;
    }

    void recordHealth(final HealthStatus status, final Instant checkedAt) {
        this.health = status;
        this.lastHealthCheck = checkedAt;
    }

    void resetHealth() {
        this.health = HealthStatus.UNKNOWN;
    }

    Instant startedAt() {
        return startedAt;
    }

    void startedAt(final Instant instant) {
        this.startedAt = instant;
    }

    void lastExitCode(final int code) {
        this.lastExitCode = code;
    }

    /**
     * Installs a new poller and cancels the one it replaces.
     */
    void replacePoller(final HealthPoller next) {
        final HealthPoller previous = poller.getAndSet(next);
        if (previous != null) {
            previous.cancel();
        }
    }

    void cancelPoller() {
        replacePoller(null);
    }

    boolean isCurrentPoller(final HealthPoller candidate) {
        return poller.get() == candidate;
    }

    ServiceSnapshot snapshot() {
        final OptionalLong current = slot.pid();
        final Long pid = current.isPresent() ? current.getAsLong() : null;
        return new ServiceSnapshot(name, state.get(), health, restartCount.get(), pid,
            startedAt, lastHealthCheck, lastExitCode);
    }
}
