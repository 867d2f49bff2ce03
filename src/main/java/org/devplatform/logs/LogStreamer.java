package org.devplatform.logs;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Aggregates the entries of every active {@link LogWatcher} and renders them with filters.
 *
 * <p>Watchers are the producers of a single shared queue; the streamer is its only consumer.
 * One-shot streams drain the queue until it stays quiet for the receive timeout and print the
 * tail; follow streams print every matching entry as it arrives until cancelled.</p>
 *
 * <h3>Configuration (all optional):</h3>
 * <pre>
 * logs {
 *   poll-interval = 100ms     # follow-mode polling of each watched file
 *   receive-timeout = 100ms   # how long a single receive waits
 * }
 * </pre>
 */
public class LogStreamer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LogStreamer.class);
    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);
    private static final Duration DEFAULT_RECEIVE_TIMEOUT = Duration.ofMillis(100);
    private static final DateTimeFormatter MARKER_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final BlockingQueue<LogEntry> channel = new LinkedBlockingQueue<>();
    private final Map<String, Watch> watchers = new ConcurrentHashMap<>();
    private final Object consumerLock = new Object();
    private final LogParser parser = new LogParser();
    private final LogRenderer renderer = new LogRenderer();
    private final ExecutorService executor;
    private final Duration pollInterval;
    private final Duration receiveTimeout;
    private volatile boolean closed = false;

    public LogStreamer(final Config options) {
        this.pollInterval = options.hasPath("poll-interval") ? options.getDuration("poll-interval") : DEFAULT_POLL_INTERVAL;
        this.receiveTimeout = options.hasPath("receive-timeout") ? options.getDuration("receive-timeout") : DEFAULT_RECEIVE_TIMEOUT;

        final AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            final Thread t = new Thread(r, "log-watcher-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.debug("LogStreamer initialized (pollInterval: {}, receiveTimeout: {})", pollInterval, receiveTimeout);
    }

    /**
     * Starts a watcher task for a service's log file. Adding a service again replaces the tracked
     * task; the previous one is abandoned, not interrupted.
     */
    public void addLogFile(final String service, final Path path, final boolean follow) {
        submit(service, path, follow, watcher -> watcher.watch(follow));
    }

    /**
     * Starts a follow watcher that emits everything written to the file from {@code startOffset}
     * on, including lines written before the watcher thread gets to open the file.
     */
    public void addLogFile(final String service, final Path path, final long startOffset) {
        submit(service, path, true, watcher -> watcher.watchFrom(startOffset));
    }

    private void submit(final String service, final Path path, final boolean follow, final WatchTask body) {
        if (closed) {
            throw new IllegalStateException("LogStreamer is closed");
        }
        final LogWatcher watcher = new LogWatcher(service, path, channel, parser, pollInterval, () -> !closed);
        final Future<?> task = executor.submit(() -> {
            try {
                body.run(watcher);
            } catch (final IOException e) {
                log.warn("Error watching log file for {}: {}", service, e.toString());
            }
        });
        final Watch previous = watchers.put(service, new Watch(task, follow));
        if (previous != null) {
            log.debug("Replaced watcher for '{}'", service);
        }
        log.debug("Watching {} for '{}' (follow: {})", path, service, follow);
    }

    public boolean isWatching(final String service) {
        final Watch watch = watchers.get(service);
        return watch != null && !watch.task().isDone();
    }

    public Set<String> watchedServices() {
        return new TreeSet<>(watchers.keySet());
    }

    /**
     * @return entries queued but not yet consumed.
     */
    public int backlog() {
        return channel.size();
    }

    /**
     * One-shot collection: drains the channel until no entry arrives within the receive timeout
     * and every one-shot watcher has finished, keeps the entries that pass the filters, and
     * returns the last {@code lines} of them in arrival order.
     */
    public List<LogEntry> collect(final LogStreamConfig config) {
        final List<LogEntry> matched = new ArrayList<>();
        synchronized (consumerLock) {
            try {
                while (true) {
                    final LogEntry entry = channel.poll(receiveTimeout.toMillis(), TimeUnit.MILLISECONDS);
                    if (entry == null) {
                        if (oneShotWatchersRunning()) {
                            continue;
                        }
                        break;
                    }
                    if (config.matches(entry)) {
                        matched.add(entry);
                    }
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        final int limit = config.lines().orElse(matched.size());
        final int start = Math.max(0, matched.size() - limit);
        return new ArrayList<>(matched.subList(start, matched.size()));
    }

    private boolean oneShotWatchersRunning() {
        return !closed && watchers.values().stream().anyMatch(w -> !w.follow() && !w.task().isDone());
    }

    public void stream(final LogStreamConfig config, final PrintStream out) {
        stream(config, out, () -> false);
    }

    /**
     * Renders entries to {@code out}. A one-shot stream prints {@link #collect} and returns. A
     * follow stream prints each matching entry as it arrives and returns once {@code cancelled}
     * reports true, the streamer is closed, or the calling thread is interrupted.
     */
    public void stream(final LogStreamConfig config, final PrintStream out, final BooleanSupplier cancelled) {
        if (!config.follow()) {
            for (final LogEntry entry : collect(config)) {
                out.println(renderer.render(entry, config.format()));
            }
            out.flush();
            return;
        }

        log.info("Streaming logs (press Ctrl-C to stop)...");
        synchronized (consumerLock) {
            try {
                while (!closed && !cancelled.getAsBoolean()) {
                    final LogEntry entry = channel.poll(receiveTimeout.toMillis(), TimeUnit.MILLISECONDS);
                    if (entry != null && config.matches(entry)) {
                        out.println(renderer.render(entry, config.format()));
                        out.flush();
                    }
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.debug("Log stream ended");
    }

    /**
     * Creates {@code <dir>/<service>.log} if needed and appends the service-started marker.
     *
     * @return the log file path.
     */
    public static Path createLogFile(final String service, final Path dir) throws IOException {
        Files.createDirectories(dir);
        final Path logFile = dir.resolve(service + ".log");
        appendStartMarker(service, logFile);
        return logFile;
    }

    /**
     * Appends the human-readable service-started line to a log file, creating it and its parent
     * directory if needed.
     */
    public static void appendStartMarker(final String service, final Path logFile) throws IOException {
        final Path parent = logFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            writer.write(String.format("%s [INFO] Service '%s' started",
                MARKER_TIME.format(ZonedDateTime.now(ZoneOffset.UTC)), service));
            writer.newLine();
        }
    }

    /**
     * Stops follow streams and lets follow-mode watchers exit at their next poll.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        watchers.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("LogStreamer closed");
    }

    @FunctionalInterface
    private interface WatchTask {
        void run(LogWatcher watcher) throws IOException;
    }

    private record Watch(Future<?> task, boolean follow) {
    }
}
