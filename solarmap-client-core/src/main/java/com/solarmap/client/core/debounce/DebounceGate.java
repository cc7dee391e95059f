package com.solarmap.client.core.debounce;

import com.solarmap.client.api.ScheduledTask;
import com.solarmap.client.api.TaskScheduler;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lets a value through only after it has been left alone for the quiescence delay.
 *
 * <p>Every {@link #submit} cancels the propagation scheduled by the previous one and starts the
 * delay again, so a burst of changes reaches the downstream consumer as its last value, once.
 * There is no leading edge: the first value waits too.
 */
public final class DebounceGate<T> implements AutoCloseable {
    public static final Duration DEFAULT_QUIESCENCE = Duration.ofMillis(250);

    private static final Logger log = LoggerFactory.getLogger(DebounceGate.class);

    private final Duration quiescence;
    private final TaskScheduler scheduler;
    private final Consumer<? super T> downstream;

    private ScheduledTask pendingTask;
    private T pendingValue;
    private long generation;
    private boolean closed;

    public DebounceGate(Duration quiescence, TaskScheduler scheduler, Consumer<? super T> downstream) {
        Objects.requireNonNull(quiescence, "quiescence");
        if (quiescence.isNegative()) {
            throw new IllegalArgumentException("quiescence must not be negative: " + quiescence);
        }
        this.quiescence = quiescence;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.downstream = Objects.requireNonNull(downstream, "downstream");
    }

    public DebounceGate(TaskScheduler scheduler, Consumer<? super T> downstream) {
        this(DEFAULT_QUIESCENCE, scheduler, downstream);
    }

    public synchronized void submit(T value) {
        Objects.requireNonNull(value, "value");
        if (closed) {
            log.debug("Ignoring {} submitted after close", value);
            return;
        }
        if (pendingTask != null) {
            pendingTask.cancel();
        }
        long gen = ++generation;
        pendingValue = value;
        pendingTask = scheduler.schedule(() -> propagate(gen), quiescence);
    }

    private void propagate(long gen) {
        T value;
        synchronized (this) {
            // a newer submit raced with this timer
            if (closed || gen != generation) return;
            value = pendingValue;
            pendingValue = null;
            pendingTask = null;
        }
        downstream.accept(value);
    }

    /** The value waiting for its quiescence delay to elapse, if any. */
    public synchronized Optional<T> pending() {
        return Optional.ofNullable(pendingValue);
    }

    public Duration quiescence() {
        return quiescence;
    }

    /** Drops the pending value; later submits are ignored. */
    @Override
    public synchronized void close() {
        closed = true;
        if (pendingTask != null) {
            pendingTask.cancel();
            pendingTask = null;
        }
        pendingValue = null;
    }
}
