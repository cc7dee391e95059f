package com.solarmap.client.sensors;

import com.solarmap.client.api.CancellationToken;
import com.solarmap.client.api.ScheduledTask;
import com.solarmap.client.api.TaskScheduler;
import com.solarmap.client.api.error.DataFetchException;
import com.solarmap.client.api.error.FetchCancelledException;
import com.solarmap.client.core.RequestExecutor;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls {@code /api/heatmap} and hands every grid to a consumer.
 *
 * <p>The next poll is scheduled {@code period} after the previous one completes, so polls never
 * overlap. A failed poll is logged and polling continues.
 */
public final class HeatmapPoller implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HeatmapPoller.class);

    public static final Duration DEFAULT_PERIOD = Duration.ofSeconds(1);

    private final SensorDataClient client;
    private final TaskScheduler scheduler;
    private final Duration period;
    private final Consumer<List<SensorSnapshot>> consumer;

    private CancellationToken token;
    private ScheduledTask next;
    private boolean running;
    private long failures;

    public HeatmapPoller(SensorDataClient client, TaskScheduler scheduler, Consumer<List<SensorSnapshot>> consumer) {
        this(client, scheduler, DEFAULT_PERIOD, consumer);
    }

    public HeatmapPoller(
            SensorDataClient client,
            TaskScheduler scheduler,
            Duration period,
            Consumer<List<SensorSnapshot>> consumer) {
        this.client = Objects.requireNonNull(client, "client");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        Objects.requireNonNull(period, "period");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive: " + period);
        }
        this.period = period;
    }

    /** Polls immediately, then keeps polling until {@link #stop()}. */
    public void start() {
        CancellationToken current;
        synchronized (this) {
            if (running) return;
            running = true;
            token = CancellationToken.create();
            current = token;
        }
        log.info("Polling heatmap every {} ms", period.toMillis());
        poll(current);
    }

    public void stop() {
        CancellationToken current;
        synchronized (this) {
            if (!running) return;
            running = false;
            if (next != null) {
                next.cancel();
                next = null;
            }
            current = token;
            token = null;
        }
        current.cancel();
    }

    public synchronized boolean isRunning() {
        return running;
    }

    /** Number of polls that failed since construction. */
    public synchronized long failureCount() {
        return failures;
    }

    private void poll(CancellationToken current) {
        synchronized (this) {
            if (!running || token != current) return;
            next = null;
        }
        client.latestReadings(current).whenComplete((grid, error) -> {
            if (error == null) {
                if (!current.isCancellationRequested()) deliver(grid);
            } else {
                DataFetchException failure = RequestExecutor.unwrap(error);
                if (!(failure instanceof FetchCancelledException)) {
                    synchronized (this) {
                        failures++;
                    }
                    log.warn("Heatmap poll failed: {}", failure.getMessage());
                }
            }
            scheduleNext(current);
        });
    }

    private void deliver(List<SensorSnapshot> grid) {
        try {
            consumer.accept(grid);
        } catch (RuntimeException e) {
            log.warn("Heatmap consumer failed", e);
        }
    }

    private synchronized void scheduleNext(CancellationToken current) {
        if (!running || token != current) return;
        next = scheduler.schedule(() -> poll(current), period);
    }

    @Override
    public void close() {
        stop();
    }
}
