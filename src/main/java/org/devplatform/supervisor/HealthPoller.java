package org.devplatform.supervisor;

import org.devplatform.health.HealthCheckException;
import org.devplatform.health.HealthProbe;
import org.devplatform.health.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Periodic health probe of one running service.
 *
 * <p>Waits the check interval on a latch so that {@link #cancel()} ends the wait at once. Each
 * round re-checks that the service is still {@code RUNNING} with a target before probing. A
 * failing probe past the startup window marks the service {@code RESTARTING} and hands it to the
 * supervisor; only one of concurrent markers wins the compare-and-set.</p>
 */
final class HealthPoller implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HealthPoller.class);

    private final ProcessSupervisor supervisor;
    private final ServiceProcess service;
    private final HealthProbe probe;
    private final Duration timeout;
    private final CountDownLatch cancelled = new CountDownLatch(1);

    HealthPoller(final ProcessSupervisor supervisor, final ServiceProcess service, final HealthProbe probe,
                 final Duration timeout) {
        this.supervisor = supervisor;
        this.service = service;
        this.probe = probe;
        this.timeout = timeout;
    }

    void cancel() {
        cancelled.countDown();
    }

    boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    @Override
    public void run() {
        final String name = service.name();
        log.debug("Health polling started for '{}'", name);
        try {
            while (true) {
                final ServiceConfig config = service.config();
                if (cancelled.await(config.healthCheckInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
                if (!service.isCurrentPoller(this) || !service.state().is(ProcessState.Phase.RUNNING)
                        || !config.hasHealthCheck()) {
                    break;
                }

                final HealthStatus status = probeOnce(config.healthCheck());
                if (isCancelled()) {
                    break;
                }
                supervisor.recordHealth(service, status);

                if (!status.isHealthy() && config.restartPolicy().restartsWhenUnhealthy()
                        && startupWindowElapsed(config)) {
                    if (supervisor.markRestarting(service, status)) {
                        supervisor.restartIfMarked(name);
                    }
                    break;
                }
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (final RuntimeException e) {
            log.error("Health polling for '{}' failed", name, e);
        }
        log.debug("Health polling stopped for '{}'", name);
    }

    private HealthStatus probeOnce(final String target) {
        try {
            final HealthStatus status = probe.probe(target, timeout);
            return status.isHealthy() ? status : HealthStatus.unhealthy(reasonOf(status));
        } catch (final HealthCheckException e) {
            return HealthStatus.unhealthy(e.getMessage());
        }
    }

    private static String reasonOf(final HealthStatus status) {
        return status.reason() != null ? status.reason() : status.state().name();
    }

    private boolean startupWindowElapsed(final ServiceConfig config) {
        final Instant started = service.startedAt();
        return started == null || !Instant.now().isBefore(started.plus(config.startupTimeout()));
    }
}
