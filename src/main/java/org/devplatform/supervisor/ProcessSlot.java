package org.devplatform.supervisor;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Exclusive owner of at most one child process. The handle is moved out with {@link #take()}
 * before it is signaled, so a process can never be signaled or reaped twice.
 */
final class ProcessSlot {

    private final AtomicReference<Process> process = new AtomicReference<>();

    /**
     * @throws IllegalStateException if the slot already owns a process.
     */
    void put(final Process child) {
        if (!process.compareAndSet(null, child)) {
            throw new IllegalStateException("Slot already owns process " + process.get().pid());
        }
    }

    /**
     * Moves the handle out. Subsequent calls return empty until a new process is put.
     */
    Optional<Process> take() {
        return Optional.ofNullable(process.getAndSet(null));
    }

    /**
     * Takes the handle only if it is still {@code child}.
     *
     * @return true if this call removed it.
     */
    boolean release(final Process child) {
        return process.compareAndSet(child, null);
    }

    OptionalLong pid() {
        final Process current = process.get();
        return current == null ? OptionalLong.empty() : OptionalLong.of(current.pid());
    }
}
