package org.devplatform.supervisor;

import com.typesafe.config.Config;
import org.devplatform.common.ServiceNotFoundException;
import org.devplatform.health.HealthProbe;
import org.devplatform.health.HealthProbes;
import org.devplatform.health.HealthStatus;
import org.devplatform.logs.LogStreamer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the child processes of all supervised services.
 *
 * <p>Each service has one {@link ServiceProcess} entry that survives restarts. Lifecycle
 * operations on a service are serialized by its own lock; status queries read atomic fields and
 * never wait on a lifecycle operation. Background work (health polling, exit handling, output
 * pumps) runs on a daemon pool that {@link #close()} shuts down.</p>
 *
 * <h3>Configuration (all optional):</h3>
 * <pre>
 * supervisor {
 *   grace-period = 5s      # wait after SIGTERM before killing
 *   settle-delay = 1s      # pause between stop and start on restart
 *   force-kill-wait = 5s   # wait for a killed process to be reaped
 *   health-timeout = 5s    # upper bound for one health probe
 * }
 * </pre>
 */
public class ProcessSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

    private final Map<String, ServiceProcess> services = new ConcurrentHashMap<>();
    private final List<ServiceStateListener> listeners = new CopyOnWriteArrayList<>();
    private final SupervisorOptions options;
    private final HealthProbe probe;
    private final LogStreamer logStreamer;
    private final ExecutorService executor;
    private volatile boolean closed = false;

    public ProcessSupervisor(final Config options) {
        this(options, null);
    }

    public ProcessSupervisor(final Config options, final LogStreamer logStreamer) {
        this(SupervisorOptions.fromConfig(options), new HealthProbes(), logStreamer);
    }

    /**
     * @param logStreamer receives a follow-mode watcher for each service with a log file; may be null.
     */
    public ProcessSupervisor(final SupervisorOptions options, final HealthProbe probe, final LogStreamer logStreamer) {
        this.options = options;
        this.probe = probe;
        this.logStreamer = logStreamer;

        final AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            final Thread t = new Thread(r, "supervisor-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.debug("ProcessSupervisor initialized ({})", options);
    }

    public void addListener(final ServiceStateListener listener) {
        listeners.add(listener);
    }

    /**
     * Starts a service, or does nothing if it is already running.
     *
     * @throws SpawnException if the command cannot be launched; the service is then {@code FAILED}.
     */
    public void start(final ServiceConfig config) {
        if (closed) {
            throw new IllegalStateException("ProcessSupervisor is closed");
        }
        final ServiceProcess service = services.computeIfAbsent(config.name(), n -> new ServiceProcess(config));
        service.lifecycleLock.lock();
        try {
            // close() may have run stopAll() while this thread waited for the lock.
            if (closed) {
                throw new IllegalStateException("ProcessSupervisor is closed");
            }
            if (service.state().is(ProcessState.Phase.RUNNING)) {
                log.debug("Service '{}' is already running", config.name());
                return;
            }
            service.config(config);
            transition(service, ProcessState.STARTING);
            service.cancelPoller();
            // A child marked for restart may still be alive.
            service.slot.take().ifPresent(previous -> terminate(config.name(), previous, false));
            service.resetHealth();
            spawn(service, config);
        } finally {
            service.lifecycleLock.unlock();
        }
    }

    private void spawn(final ServiceProcess service, final ServiceConfig config) {
        final String name = config.name();
        Path logFile = config.logFile();
        long logOffset = 0;
        if (logFile != null) {
            try {
                logOffset = Files.exists(logFile) ? Files.size(logFile) : 0;
                LogStreamer.appendStartMarker(name, logFile);
            } catch (final IOException e) {
                log.warn("Cannot write log file {} for '{}', logging output instead: {}", logFile, name, e.getMessage());
                logFile = null;
            }
        }

        final List<String> commandLine = new ArrayList<>();
        commandLine.add(config.command());
        commandLine.addAll(config.args());
        final ProcessBuilder builder = new ProcessBuilder(commandLine).directory(config.workingDirectory().toFile());
        builder.environment().putAll(config.environment());
        if (logFile != null) {
            builder.redirectErrorStream(true);
            builder.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        }

        final Process process;
        try {
            process = builder.start();
        } catch (final IOException e) {
            transition(service, ProcessState.failed(e.getMessage()));
            log.error("Failed to start service '{}': {}", name, e.getMessage());
            throw new SpawnException(name, e);
        }

        try {
            process.getOutputStream().close();
        } catch (final IOException e) {
            log.debug("Could not close stdin of '{}': {}", name, e.getMessage());
        }
        if (logFile == null) {
            executor.submit(new OutputPump(name, process.getInputStream(), false));
            executor.submit(new OutputPump(name, process.getErrorStream(), true));
        }

        service.slot.put(process);
        service.startedAt(Instant.now());
        transition(service, ProcessState.RUNNING);
        log.info("Started service '{}' (pid {})", name, process.pid());

        process.onExit().thenRunAsync(() -> handleExit(service, process), executor);

        if (logFile != null && logStreamer != null && !logStreamer.isWatching(name)) {
            logStreamer.addLogFile(name, logFile, logOffset);
        }
        if (config.hasHealthCheck()) {
            final HealthPoller poller = new HealthPoller(this, service, probe, options.healthTimeout());
            service.replacePoller(poller);
            executor.submit(poller);
        }
    }

    /**
     * Stops a service. Unknown or already stopped services are ignored.
     *
     * @param force kill at once instead of sending SIGTERM first.
     */
    public void stop(final String name, final boolean force) {
        final ServiceProcess service = services.get(name);
        if (service == null) {
            log.warn("Cannot stop '{}': no such service", name);
            return;
        }
        service.lifecycleLock.lock();
        try {
            if (service.state().is(ProcessState.Phase.STOPPED)) {
                return;
            }
            transition(service, ProcessState.STOPPING);
            service.cancelPoller();
            service.slot.take().ifPresent(process -> terminate(name, process, force));
            transition(service, ProcessState.STOPPED);
            log.info("Stopped service '{}'", name);
        } finally {
            service.lifecycleLock.unlock();
        }
    }

    private void terminate(final String name, final Process process, final boolean force) {
        if (force) {
            kill(process);
            awaitExit(process, options.forceKillWait());
            return;
        }
        try {
            signal(process);
        } catch (final SignalException e) {
            log.warn("{}, killing '{}'", e.getMessage(), name);
            kill(process);
            awaitExit(process, options.forceKillWait());
            return;
        }
        if (!awaitExit(process, options.gracePeriod())) {
            log.warn("Service '{}' did not exit within {} ms, killing", name, options.gracePeriod().toMillis());
            kill(process);
            if (!awaitExit(process, options.forceKillWait())) {
                log.error("Service '{}' (pid {}) is still alive after kill", name, process.pid());
            }
        }
    }

    private static void signal(final Process process) {
        process.descendants().forEach(ProcessHandle::destroy);
        if (!process.toHandle().destroy() && process.isAlive()) {
            throw new SignalException("Could not deliver SIGTERM to pid " + process.pid());
        }
    }

    private static void kill(final Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static boolean awaitExit(final Process process, final Duration timeout) {
        try {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        }
    }

    /**
     * Stops the service gracefully, waits the settle delay and starts it again with its stored
     * configuration. The restart counter grows by one even when the new start fails.
     *
     * @throws ServiceNotFoundException if the service was never started.
     * @throws SpawnException if the command can no longer be launched.
     */
    public void restart(final String name) {
        final ServiceProcess service = services.get(name);
        if (service == null) {
            throw new ServiceNotFoundException(name);
        }
        service.lifecycleLock.lock();
        try {
            final int count = service.restartCount.incrementAndGet();
            log.info("Restarting service '{}' (restart #{})", name, count);
            stop(name, false);
            settle();
            start(service.config());
        } finally {
            service.lifecycleLock.unlock();
        }
    }

    /**
     * Restarts a service only if it is still marked {@code RESTARTING}, so a restart raced by a
     * manual stop or an earlier restart does nothing.
     */
    void restartIfMarked(final String name) {
        final ServiceProcess service = entry(name);
        if (service == null || closed) {
            return;
        }
        service.lifecycleLock.lock();
        try {
            if (!service.state().is(ProcessState.Phase.RESTARTING)) {
                return;
            }
            restart(name);
        } catch (final SpawnException e) {
            log.error("Automatic restart of '{}' failed: {}", name, e.getMessage());
        } finally {
            service.lifecycleLock.unlock();
        }
    }

    ServiceProcess entry(final String name) {
        return services.get(name);
    }

    boolean markRestarting(final ServiceProcess service, final HealthStatus status) {
        if (!service.compareAndSetState(ProcessState.RUNNING, ProcessState.RESTARTING)) {
            return false;
        }
        log.warn("Service '{}' is {}, restarting", service.name(), status);
        notifyStateChange(service.name(), ProcessState.RUNNING, ProcessState.RESTARTING);
        return true;
    }

    void recordHealth(final ServiceProcess service, final HealthStatus status) {
        final HealthStatus previous = service.health();
        service.recordHealth(status, Instant.now());
        if (!status.equals(previous)) {
            log.debug("Service '{}' health changed: {} -> {}", service.name(), previous, status);
        }
        for (final ServiceStateListener listener : listeners) {
            try {
                listener.onHealthChange(service.name(), status);
            } catch (final RuntimeException e) {
                log.warn("Listener failed on health change of '{}'", service.name(), e);
            }
        }
    }

    private void handleExit(final ServiceProcess service, final Process process) {
        final String name = service.name();
        service.lifecycleLock.lock();
        try {
            if (!service.slot.release(process)) {
                // Stopped on purpose; the stop path owns the handle.
                return;
            }
            final int exitCode = process.exitValue();
            service.lastExitCode(exitCode);
            service.cancelPoller();

            final RestartPolicy policy = service.config().restartPolicy();
            if (!closed && policy.restartsOnExit(exitCode)
                    && service.compareAndSetState(ProcessState.RUNNING, ProcessState.RESTARTING)) {
                log.warn("Service '{}' exited with code {}, restarting ({})", name, exitCode, policy);
                notifyStateChange(name, ProcessState.RUNNING, ProcessState.RESTARTING);
                restartIfMarked(name);
            } else if (exitCode == 0) {
                log.info("Service '{}' exited", name);
                transition(service, ProcessState.STOPPED);
            } else {
                log.warn("Service '{}' exited with code {}", name, exitCode);
                transition(service, ProcessState.failed("exited with code " + exitCode));
            }
        } catch (final RuntimeException e) {
            log.error("Exit handling for '{}' failed", name, e);
        } finally {
            service.lifecycleLock.unlock();
        }
    }

    private void settle() {
        try {
            Thread.sleep(options.settleDelay().toMillis());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public Optional<ServiceSnapshot> status(final String name) {
        final ServiceProcess service = services.get(name);
        return service == null ? Optional.empty() : Optional.of(service.snapshot());
    }

    /**
     * @return snapshots of all services, sorted by name.
     */
    public List<ServiceSnapshot> list() {
        final List<ServiceSnapshot> snapshots = new ArrayList<>();
        services.values().forEach(s -> snapshots.add(s.snapshot()));
        snapshots.sort(Comparator.comparing(ServiceSnapshot::name));
        return snapshots;
    }

    /**
     * Stops every service gracefully. Failures are logged and do not stop the loop.
     */
    public void stopAll() {
        for (final String name : services.keySet()) {
            try {
                stop(name, false);
            } catch (final RuntimeException e) {
                log.error("Failed to stop service '{}'", name, e);
            }
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        stopAll();
        executor.shutdownNow();
        log.debug("ProcessSupervisor closed");
    }

    private void transition(final ServiceProcess service, final ProcessState next) {
        final ProcessState previous = service.setState(next);
        if (!previous.equals(next)) {
            notifyStateChange(service.name(), previous, next);
        }
    }

    private void notifyStateChange(final String name, final ProcessState from, final ProcessState to) {
        for (final ServiceStateListener listener : listeners) {
            try {
                listener.onStateChange(name, from, to);
            } catch (final RuntimeException e) {
                log.warn("Listener failed on state change of '{}'", name, e);
            }
        }
    }
}
