package com.solarmap.client.core;

/** Lifecycle of one logical request inside {@link RequestExecutor}. */
public enum CallState {
    /** An attempt is in flight. */
    PENDING,
    /** Waiting out the delay before the next attempt. */
    BACKOFF,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
