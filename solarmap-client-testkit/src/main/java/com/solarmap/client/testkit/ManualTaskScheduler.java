package com.solarmap.client.testkit;

import com.solarmap.client.api.ScheduledTask;
import com.solarmap.client.api.TaskScheduler;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Virtual-time scheduler. Nothing runs until the test calls {@link #advance(Duration)}; actions
 * due within the advanced span run on the calling thread in due-time order.
 */
public class ManualTaskScheduler implements TaskScheduler {
    private final PriorityQueue<Entry> queue = new PriorityQueue<>();
    private final List<Duration> requestedDelays = new ArrayList<>();
    private Instant now;
    private long sequence;

    public ManualTaskScheduler() {
        this(Instant.parse("2025-01-01T00:00:00Z"));
    }

    public ManualTaskScheduler(Instant start) {
        this.now = Objects.requireNonNull(start, "start");
    }

    @Override
    public synchronized ScheduledTask schedule(Runnable action, Duration delay) {
        requestedDelays.add(delay);
        Entry entry = new Entry(now.plus(delay), sequence++, action);
        queue.add(entry);
        return entry;
    }

    /** Moves virtual time forward, running every action that falls due on the way. */
    public void advance(Duration amount) {
        Instant target;
        synchronized (this) {
            target = now.plus(amount);
        }
        while (true) {
            Entry due;
            synchronized (this) {
                Entry head = queue.peek();
                if (head == null || head.dueAt.isAfter(target)) {
                    now = target;
                    return;
                }
                due = queue.poll();
                now = due.dueAt;
            }
            due.run();
        }
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    /** Actions scheduled but neither run nor cancelled. */
    public synchronized int pendingCount() {
        return queue.size();
    }

    /** Every delay ever passed to {@link #schedule}, in call order. */
    public synchronized List<Duration> requestedDelays() {
        return Collections.unmodifiableList(new ArrayList<>(requestedDelays));
    }

    public synchronized Instant now() {
        return now;
    }

    /** A clock reading this scheduler's virtual time. */
    public Clock clock() {
        return new VirtualClock(ZoneOffset.UTC);
    }

    private final class Entry implements ScheduledTask, Comparable<Entry> {
        private final Instant dueAt;
        private final long seq;
        private final Runnable action;
        private boolean done;

        Entry(Instant dueAt, long seq, Runnable action) {
            this.dueAt = dueAt;
            this.seq = seq;
            this.action = action;
        }

        void run() {
            synchronized (ManualTaskScheduler.this) {
                if (done) return;
                done = true;
            }
            action.run();
        }

        @Override
        public boolean cancel() {
            synchronized (ManualTaskScheduler.this) {
                if (done) return false;
                done = true;
                queue.remove(this);
                return true;
            }
        }

        @Override
        public boolean isDone() {
            synchronized (ManualTaskScheduler.this) {
                return done;
            }
        }

        @Override
        public int compareTo(Entry other) {
            int byTime = dueAt.compareTo(other.dueAt);
            return byTime != 0 ? byTime : Long.compare(seq, other.seq);
        }
    }

    private final class VirtualClock extends Clock {
        private final ZoneId zone;

        VirtualClock(ZoneId zone) {
            this.zone = zone;
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return new VirtualClock(zone);
        }

        @Override
        public Instant instant() {
            return now();
        }
    }
}
