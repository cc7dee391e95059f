package com.solarmap.client.core.debounce;

import static org.assertj.core.api.Assertions.assertThat;

import com.solarmap.client.testkit.ManualTaskScheduler;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DebounceGateTest {

    private final ManualTaskScheduler scheduler = new ManualTaskScheduler();
    private final List<String> propagated = new ArrayList<>();
    private final List<Instant> propagatedAt = new ArrayList<>();
    private final DebounceGate<String> gate = new DebounceGate<>(Duration.ofMillis(220), scheduler, v -> {
        propagated.add(v);
        propagatedAt.add(scheduler.now());
    });

    @Test
    void burstCollapsesIntoItsLastValue() {
        Instant start = scheduler.now();
        for (int i = 1; i <= 5; i++) {
            gate.submit("v" + i);
            if (i < 5) scheduler.advanceMillis(10);
        }
        Instant lastSubmit = scheduler.now();

        scheduler.advanceMillis(219);
        assertThat(propagated).isEmpty();
        scheduler.advanceMillis(1);

        assertThat(propagated).containsExactly("v5");
        assertThat(propagatedAt.get(0)).isEqualTo(lastSubmit.plusMillis(220));
        assertThat(lastSubmit).isEqualTo(start.plusMillis(40));

        scheduler.advance(Duration.ofSeconds(5));
        assertThat(propagated).hasSize(1);
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void firstValueIsDelayedToo() {
        gate.submit("day");

        assertThat(propagated).isEmpty();
        assertThat(gate.pending()).contains("day");

        scheduler.advanceMillis(220);
        assertThat(propagated).containsExactly("day");
        assertThat(gate.pending()).isEmpty();
    }

    @Test
    void separateQuietPeriodsPropagateSeparately() {
        gate.submit("day");
        scheduler.advanceMillis(300);
        gate.submit("week");
        scheduler.advanceMillis(300);

        assertThat(propagated).containsExactly("day", "week");
    }

    @Test
    void closeDropsThePendingValueAndLaterSubmits() {
        gate.submit("month");
        gate.close();
        gate.submit("day");
        scheduler.advance(Duration.ofSeconds(1));

        assertThat(propagated).isEmpty();
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void defaultQuiescenceIs250ms() {
        DebounceGate<Integer> defaults = new DebounceGate<>(scheduler, v -> propagated.add(String.valueOf(v)));

        defaults.submit(24);
        scheduler.advanceMillis(249);
        assertThat(propagated).isEmpty();
        scheduler.advanceMillis(1);

        assertThat(propagated).containsExactly("24");
        assertThat(defaults.quiescence()).isEqualTo(DebounceGate.DEFAULT_QUIESCENCE);
    }
}
