package com.solarmap.client.core.schedule;

import com.solarmap.client.api.ScheduledTask;
import com.solarmap.client.api.TaskScheduler;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Timer thread shared by request timeouts, retry backoff and debouncing. Cancelled timers are
 * removed from the queue straight away.
 */
public final class ExecutorTaskScheduler implements TaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskScheduler.class);
    private static final AtomicInteger INSTANCES = new AtomicInteger();

    private final ScheduledThreadPoolExecutor executor;

    public ExecutorTaskScheduler() {
        String name = "solarmap-scheduler-" + INSTANCES.incrementAndGet();
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
        this.executor.setRemoveOnCancelPolicy(true);
    }

    @Override
    public ScheduledTask schedule(Runnable action, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(() -> run(action), delay.toNanos(), TimeUnit.NANOSECONDS);
        return new FutureTask(future);
    }

    private static void run(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Scheduled action {} failed: {}", action, e.getMessage(), e);
        }
    }

    /** Timers waiting to fire. */
    public int pendingCount() {
        return executor.getQueue().size();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static final class FutureTask implements ScheduledTask {
        private final ScheduledFuture<?> future;

        FutureTask(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            return future.cancel(false);
        }

        @Override
        public boolean isDone() {
            return future.isDone();
        }
    }
}
