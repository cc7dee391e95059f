package com.solarmap.client.api;

import java.time.Duration;

/** Runs actions after a delay. Used for request timeouts, retry backoff and debouncing. */
public interface TaskScheduler extends AutoCloseable {

    ScheduledTask schedule(Runnable action, Duration delay);

    @Override
    default void close() {
        /* no-op */
    }
}
