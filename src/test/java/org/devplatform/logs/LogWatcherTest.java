package org.devplatform.logs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@Tag("integration")
class LogWatcherTest {

    private static final Duration POLL = Duration.ofMillis(50);

    @TempDir
    Path tempDir;

    private final ConcurrentLinkedQueue<LogEntry> sink = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean active = new AtomicBoolean(true);

    private LogWatcher watcher(final Path file) {
        return new LogWatcher("api", file, sink, new LogParser(), POLL, active::get);
    }

    private List<String> messages() {
        return sink.stream().map(LogEntry::message).collect(Collectors.toList());
    }

    private static void append(final Path file, final String text) throws IOException {
        Files.writeString(file, text, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    @Test
    @DisplayName("One-shot read emits every line in order, including a trailing partial line")
    void watch_oneShot() throws IOException {
        final Path file = tempDir.resolve("api.log");
        Files.writeString(file, "first\r\n\nsecond\nthird");

        watcher(file).watch(false);

        assertThat(messages()).containsExactly("first", "second", "third");
    }

    @Test
    @DisplayName("Follow mode starts at the end and emits appended lines")
    void watch_follow() throws Exception {
        final Path file = tempDir.resolve("api.log");
        Files.writeString(file, "old line\n");

        final ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            final Future<?> task = executor.submit(() -> {
                watcher(file).watch(true);
                return null;
            });
            Thread.sleep(150);
            append(file, "new ");
            Thread.sleep(150);
            assertThat(sink).isEmpty();
            append(file, "line\nanother\n");

            await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(messages()).containsExactly("new line", "another"));

            active.set(false);
            task.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Following from an earlier offset emits lines written before the watcher opened the file")
    void watchFrom_offset() throws Exception {
        final Path file = tempDir.resolve("api.log");
        Files.writeString(file, "previous run\n");
        final long offset = Files.size(file);
        append(file, "started\nfirst output\n");

        final ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            final Future<?> task = executor.submit(() -> {
                watcher(file).watchFrom(offset);
                return null;
            });
            await().atMost(Duration.ofSeconds(5)).until(() -> sink.size() == 2);
            append(file, "later\n");

            await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(messages()).containsExactly("started", "first output", "later"));

            active.set(false);
            task.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("An offset beyond the end of a truncated file starts at the end")
    void watchFrom_offsetPastEnd() throws Exception {
        final Path file = tempDir.resolve("api.log");
        Files.writeString(file, "short\n");

        final ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(() -> {
                watcher(file).watchFrom(1_000);
                return null;
            });
            Thread.sleep(150);
            append(file, "appended\n");

            await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(messages()).containsExactly("appended"));
        } finally {
            active.set(false);
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Truncation reopens the file from the start")
    void watch_truncation() throws Exception {
        final Path file = tempDir.resolve("api.log");
        Files.writeString(file, "");

        final ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(() -> {
                watcher(file).watch(true);
                return null;
            });
            Thread.sleep(150);
            append(file, "a1 padding padding\na2 padding padding\na3 padding padding\n");
            await().atMost(Duration.ofSeconds(5)).until(() -> sink.size() == 3);

            Files.writeString(file, "", StandardOpenOption.TRUNCATE_EXISTING);
            Thread.sleep(300);
            append(file, "b1\nb2\n");

            await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(messages()).containsExactly(
                "a1 padding padding", "a2 padding padding", "a3 padding padding", "b1", "b2"));
        } finally {
            active.set(false);
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Rotation drains the old file and continues with the new one")
    void watch_rotation() throws Exception {
        final Path file = tempDir.resolve("api.log");
        Files.writeString(file, "");

        final ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(() -> {
                watcher(file).watch(true);
                return null;
            });
            Thread.sleep(150);
            append(file, "before\n");
            await().atMost(Duration.ofSeconds(5)).until(() -> sink.size() == 1);

            Files.move(file, tempDir.resolve("api.log.1"));
            Files.writeString(file, "after rotation padding\n");

            await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(messages()).containsExactly("before", "after rotation padding"));
        } finally {
            active.set(false);
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("A missing file fails with an IOException")
    void watch_missingFile() {
        assertThatThrownBy(() -> watcher(tempDir.resolve("absent.log")).watch(false))
            .isInstanceOf(IOException.class);
    }
}
