package com.solarmap.client.sensors;

import com.solarmap.series.AggregatedPoint;
import java.util.List;

/** Aggregated readings of one sensor. */
public record SensorSeries(int sensorId, List<AggregatedPoint> points) {

    public SensorSeries {
        points = List.copyOf(points);
    }
}
