package com.solarmap.client.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import com.solarmap.client.api.ScheduledTask;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ExecutorTaskSchedulerTest {

    private final ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler();

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void runsActionAfterDelay() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);

        ScheduledTask task = scheduler.schedule(ran::countDown, Duration.ofMillis(20));

        assertThat(ran.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(task.isDone()).isTrue();
    }

    @Test
    void cancelledTimerIsRemovedAndNeverRuns() throws Exception {
        AtomicBoolean ran = new AtomicBoolean();

        ScheduledTask task = scheduler.schedule(() -> ran.set(true), Duration.ofMillis(200));
        assertThat(task.cancel()).isTrue();

        assertThat(scheduler.pendingCount()).isZero();
        Thread.sleep(300);
        assertThat(ran).isFalse();
    }

    @Test
    void failingActionDoesNotKillTheTimerThread() throws Exception {
        scheduler.schedule(() -> {
            throw new IllegalStateException("boom");
        }, Duration.ZERO);
        CountDownLatch ran = new CountDownLatch(1);

        scheduler.schedule(ran::countDown, Duration.ofMillis(10));

        assertThat(ran.await(2, TimeUnit.SECONDS)).isTrue();
    }
}
