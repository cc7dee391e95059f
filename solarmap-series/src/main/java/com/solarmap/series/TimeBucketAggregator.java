package com.solarmap.series;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Re-buckets raw samples into fixed-width averages.
 *
 * <p>Buckets are calendar-local: a sample's minute-of-hour in the reference zone is truncated to
 * the nearest lower multiple of the interval while year, month, day and hour are kept. A bucket
 * therefore never spans an hour boundary, and an interval that does not divide 60 leaves a short
 * last bucket in every hour (interval 7 gives minutes 0, 7, ..., 56 where 56 covers 56-59).
 *
 * <p>Stateless; the output depends only on the samples, the interval and the zone.
 */
public final class TimeBucketAggregator {
    private final ZoneId zone;

    public TimeBucketAggregator() {
        this(ZoneId.systemDefault());
    }

    public TimeBucketAggregator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public ZoneId zone() {
        return zone;
    }

    public List<AggregatedPoint> aggregate(List<Sample> samples, int intervalMinutes) {
        Objects.requireNonNull(samples, "samples");
        requirePositive(intervalMinutes);
        if (samples.isEmpty()) return List.of();

        Map<Instant, Accumulator> buckets = new TreeMap<>();
        for (Sample sample : samples) {
            Instant start = bucketStart(sample.timestamp(), intervalMinutes);
            buckets.computeIfAbsent(start, k -> new Accumulator()).add(sample.value());
        }

        List<AggregatedPoint> points = new ArrayList<>(buckets.size());
        buckets.forEach((start, acc) -> points.add(new AggregatedPoint(start, acc.sum / acc.count, acc.count)));
        return List.copyOf(points);
    }

    /** Start of the bucket containing {@code timestamp}. */
    public Instant bucketStart(Instant timestamp, int intervalMinutes) {
        requirePositive(intervalMinutes);
        ZonedDateTime zdt = timestamp.atZone(zone);
        int minute = zdt.getMinute();
        int aligned = minute - (minute % intervalMinutes);
        return zdt.withMinute(aligned).withSecond(0).withNano(0).toInstant();
    }

    private static void requirePositive(int intervalMinutes) {
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("intervalMinutes must be positive: " + intervalMinutes);
        }
    }

    private static final class Accumulator {
        private double sum;
        private int count;

        void add(double value) {
            sum += value;
            count++;
        }
    }
}
