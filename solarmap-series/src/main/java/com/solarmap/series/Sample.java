package com.solarmap.series;

import java.time.Instant;
import java.util.Objects;

/** One raw reading. */
public record Sample(Instant timestamp, double value) {

    public Sample {
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
