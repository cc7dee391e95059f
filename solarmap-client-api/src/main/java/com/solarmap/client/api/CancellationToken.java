package com.solarmap.client.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation signal checked by callers at their suspension points.
 *
 * <p>Tokens may be derived with {@link #child()}: cancelling a parent cancels every child that is
 * still linked to it, while cancelling a child leaves the parent untouched.
 */
public final class CancellationToken {
    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);
    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final Object lock = new Object();
    private final Map<Long, Runnable> listeners = new LinkedHashMap<>();
    private long nextListenerId;
    private volatile boolean cancelled;
    private volatile Registration parentLink = Registration.NOOP;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /** A fresh token that is not cancelled yet. */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /** A token that can never be cancelled. */
    public static CancellationToken none() {
        return NONE;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    /**
     * Signals cancellation and runs the registered listeners once, in registration order.
     * Repeated calls are no-ops.
     */
    public void cancel() {
        if (!cancellable) return;
        List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) return;
            cancelled = true;
            toRun = new ArrayList<>(listeners.values());
            listeners.clear();
        }
        parentLink.close();
        for (Runnable listener : toRun) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation listener {} failed: {}", listener, e.getMessage(), e);
            }
        }
    }

    /**
     * Registers a listener fired on cancellation. If the token is already cancelled the listener
     * runs immediately on the calling thread.
     */
    public Registration onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        if (!cancellable) return Registration.NOOP;
        long id;
        synchronized (lock) {
            if (!cancelled) {
                id = nextListenerId++;
                listeners.put(id, listener);
                return () -> {
                    synchronized (lock) {
                        listeners.remove(id);
                    }
                };
            }
        }
        listener.run();
        return Registration.NOOP;
    }

    /** Derives a token cancelled together with this one. */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken(true);
        if (!cancellable) return child;
        Registration link = onCancel(child::cancel);
        if (!child.cancelled) {
            child.parentLink = link;
        }
        return child;
    }

    /** Unlinks this token from its parent without cancelling it. */
    public void detach() {
        Registration link = parentLink;
        parentLink = Registration.NOOP;
        link.close();
    }

    /** Number of listeners still registered; zero once cancelled. */
    public int listenerCount() {
        synchronized (lock) {
            return listeners.size();
        }
    }

    @Override
    public String toString() {
        if (!cancellable) return "CancellationToken[none]";
        return "CancellationToken[cancelled=" + cancelled + "]";
    }

    /** Handle that removes a listener. Closing twice is harmless. */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        Registration NOOP = () -> {};

        @Override
        void close();
    }
}
