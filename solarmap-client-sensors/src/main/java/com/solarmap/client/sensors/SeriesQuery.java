package com.solarmap.client.sensors;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/** What the series chart asks for: which sensors, how far back, and the bucket width. */
public record SeriesQuery(List<Integer> sensorIds, Duration window, int intervalMinutes) {

    public SeriesQuery {
        sensorIds = List.copyOf(sensorIds);
        Objects.requireNonNull(window, "window");
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("intervalMinutes must be positive: " + intervalMinutes);
        }
    }

    public static SeriesQuery lastHours(List<Integer> sensorIds, int hours, int intervalMinutes) {
        return new SeriesQuery(sensorIds, Duration.ofHours(hours), intervalMinutes);
    }
}
