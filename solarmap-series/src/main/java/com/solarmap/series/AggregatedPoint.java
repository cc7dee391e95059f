package com.solarmap.series;

import java.time.Instant;

/** Mean of the samples falling in {@code [bucketStart, bucketStart + interval)}. */
public record AggregatedPoint(Instant bucketStart, double value, int sampleCount) {}
