package org.devplatform.health;

import org.devplatform.common.ServiceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Standalone registry of named health checks, independent of any supervised process. Used for
 * ad-hoc status reporting. Checks can be run on demand ({@link #checkOne}, {@link #checkAll}) or
 * scheduled at their own intervals with {@link #start()}.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();
    private final Map<String, ServiceHealth> results = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> scheduled = new ConcurrentHashMap<>();
    private final HealthProbe probe;
    private ScheduledExecutorService scheduler;

    public HealthMonitor() {
        this(new HealthProbes());
    }

    public HealthMonitor(final HealthProbe probe) {
        this.probe = probe;
    }

    /**
     * Registers or replaces a check. Its status starts as {@code UNKNOWN}. Once the monitor is
     * started, the check is scheduled right away at its own interval, replacing any schedule of
     * the check it replaces.
     */
    public synchronized void register(final String name, final HealthCheck check) {
        checks.put(name, check);
        results.put(name, ServiceHealth.initial(name, check));
        log.debug("Registered health check '{}' -> {}", name, check.endpoint());
        if (scheduler != null) {
            schedule(name, check);
        }
    }

    /**
     * Performs exactly one probe for the named check and records the outcome.
     *
     * @throws ServiceNotFoundException if no check is registered under the name.
     */
    public HealthStatus checkOne(final String name) {
        final HealthCheck check = checks.get(name);
        if (check == null) {
            throw new ServiceNotFoundException(name);
        }

        final long started = System.nanoTime();
        HealthStatus status;
        try {
            status = probe.probe(check.endpoint(), check.timeout());
        } catch (final HealthCheckException e) {
            status = HealthStatus.unhealthy(e.getMessage());
        }
        final Duration latency = Duration.ofNanos(System.nanoTime() - started);
        final HealthStatus recorded = status;

        results.compute(name, (key, previous) -> {
            final ServiceHealth base = previous != null ? previous : ServiceHealth.initial(key, check);
            return base.record(recorded, Instant.now(), latency);
        });

        if (!recorded.isHealthy()) {
            log.debug("Health check '{}' reported {}", name, recorded);
        }
        return recorded;
    }

    /**
     * Checks every registered name. A failing check does not abort the batch.
     */
    public Map<String, HealthStatus> checkAll() {
        final Map<String, HealthStatus> statuses = new LinkedHashMap<>();
        for (final String name : new ArrayList<>(checks.keySet())) {
            try {
                statuses.put(name, checkOne(name));
            } catch (final RuntimeException e) {
                log.warn("Health check '{}' failed: {}", name, e.getMessage());
            }
        }
        return statuses;
    }

    /**
     * @return names whose last status is neither healthy nor unknown.
     */
    public List<String> unhealthyServices() {
        final List<String> names = new ArrayList<>();
        results.forEach((name, health) -> {
            if (health.status().isFailing()) {
                names.add(name);
            }
        });
        Collections.sort(names);
        return names;
    }

    public boolean isHealthy(final String name) {
        final ServiceHealth health = results.get(name);
        return health != null && health.status().isHealthy();
    }

    public Optional<ServiceHealth> health(final String name) {
        return Optional.ofNullable(results.get(name));
    }

    public Map<String, ServiceHealth> allHealth() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    /**
     * Schedules every registered check at its own interval on a daemon thread.
     */
    public synchronized void start() {
        if (scheduler != null) {
            log.debug("Health monitor already started");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "health-monitor");
            t.setDaemon(true);
            return t;
        });
        checks.forEach(this::schedule);
        log.debug("Scheduled {} health checks", checks.size());
    }

    private void schedule(final String name, final HealthCheck check) {
        final ScheduledFuture<?> previous = scheduled.put(name, scheduler.scheduleWithFixedDelay(
            () -> runScheduled(name), 0, check.interval().toMillis(), TimeUnit.MILLISECONDS));
        if (previous != null) {
            previous.cancel(false);
        }
    }

    private void runScheduled(final String name) {
        try {
            checkOne(name);
        } catch (final RuntimeException e) {
            log.warn("Scheduled health check '{}' failed: {}", name, e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (final InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduled.clear();
        scheduler = null;
    }
}
