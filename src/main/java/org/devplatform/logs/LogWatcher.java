package org.devplatform.logs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.Objects;
import java.util.Queue;
import java.util.function.BooleanSupplier;

/**
 * Tails one log file and pushes each parsed line onto a shared queue, in file order.
 *
 * <p>The watcher keeps a byte cursor into the file. In follow mode it polls for new data at a
 * fixed interval and reopens the file from offset zero when the file shrinks below the cursor
 * (truncation) or is replaced by a different file (rotation), so a stale offset is never applied
 * to new content.</p>
 */
public class LogWatcher {

    private static final Logger log = LoggerFactory.getLogger(LogWatcher.class);
    private static final int BUFFER_SIZE = 8192;
    private static final long END_OF_FILE = -1;

    private final String service;
    private final Path path;
    private final Queue<LogEntry> sink;
    private final LogParser parser;
    private final Duration pollInterval;
    private final BooleanSupplier active;

    private final ByteBuffer buffer = ByteBuffer.allocate(BUFFER_SIZE);
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private long position;

    /**
     * @param service      The service the file belongs to.
     * @param path         The file to tail.
     * @param sink         The queue parsed entries are offered to.
     * @param parser       The line parser.
     * @param pollInterval How long to sleep between polls in follow mode.
     * @param active       Follow mode runs while this returns true.
     */
    public LogWatcher(final String service, final Path path, final Queue<LogEntry> sink,
                      final LogParser parser, final Duration pollInterval, final BooleanSupplier active) {
        this.service = service;
        this.path = path;
        this.sink = sink;
        this.parser = parser;
        this.pollInterval = pollInterval;
        this.active = active;
    }

    /**
     * Reads the file. Without {@code follow}, every line from the start is emitted and the call
     * returns at end of file. With {@code follow}, only lines appended after the call are emitted
     * and the call returns once the watcher is deactivated or its thread is interrupted.
     *
     * @throws IOException if the file cannot be opened or read.
     */
    public void watch(final boolean follow) throws IOException {
        watch(follow, follow ? END_OF_FILE : 0);
    }

    /**
     * Follows the file from a byte offset captured earlier, so lines appended between capturing
     * the offset and starting the watcher are still emitted. An offset past the current end of
     * file (the file was truncated in between) starts at the end.
     *
     * @throws IOException if the file cannot be opened or read.
     */
    public void watchFrom(final long startOffset) throws IOException {
        if (startOffset < 0) {
            throw new IllegalArgumentException("Start offset must not be negative: " + startOffset);
        }
        watch(true, startOffset);
    }

    private void watch(final boolean follow, final long startOffset) throws IOException {
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        Object fileKey = fileKey(path);
        try {
            final long size = channel.size();
            position = startOffset == END_OF_FILE ? size : Math.min(startOffset, size);
            channel.position(position);

            while (true) {
                drain(channel);

                if (!follow) {
                    flushPending();
                    return;
                }
                if (!active.getAsBoolean() || !sleep()) {
                    return;
                }

                final Object currentKey;
                final long currentSize;
                try {
                    currentKey = fileKey(path);
                    currentSize = Files.size(path);
                } catch (final NoSuchFileException e) {
                    // Rotated away; keep polling until the replacement appears.
                    continue;
                }

                final boolean rotated = !Objects.equals(currentKey, fileKey);
                if (rotated || currentSize < position) {
                    if (rotated) {
                        drain(channel);
                        flushPending();
                        log.debug("Log file for '{}' was rotated, reopening {}", service, path);
                    } else {
                        log.debug("Log file for '{}' was truncated ({} < {}), reopening {}", service, currentSize, position, path);
                    }
                    channel.close();
                    channel = FileChannel.open(path, StandardOpenOption.READ);
                    fileKey = currentKey;
                    position = 0;
                    pending.reset();
                }
            }
        } finally {
            channel.close();
        }
    }

    private void drain(final FileChannel channel) throws IOException {
        buffer.clear();
        while (channel.read(buffer) > 0) {
            buffer.flip();
            while (buffer.hasRemaining()) {
                final byte b = buffer.get();
                if (b == '\n') {
                    emit();
                } else {
                    pending.write(b);
                }
            }
            buffer.clear();
        }
        position = channel.position();
    }

    private void flushPending() {
        if (pending.size() > 0) {
            emit();
        }
    }

    private void emit() {
        String line = pending.toString(StandardCharsets.UTF_8);
        pending.reset();
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        parser.parse(line, service).ifPresent(sink::offer);
    }

    private boolean sleep() {
        try {
            Thread.sleep(pollInterval.toMillis());
            return true;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Object fileKey(final Path path) throws IOException {
        return Files.readAttributes(path, BasicFileAttributes.class).fileKey();
    }
}
