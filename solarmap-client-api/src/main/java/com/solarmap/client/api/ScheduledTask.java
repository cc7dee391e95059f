package com.solarmap.client.api;

/** Handle to a delayed action registered with a {@link TaskScheduler}. */
public interface ScheduledTask {

    /**
     * Prevents the action from running if it has not started yet.
     *
     * @return {@code true} if this call cancelled the action
     */
    boolean cancel();

    /** Whether the action ran, was cancelled or otherwise completed. */
    boolean isDone();
}
