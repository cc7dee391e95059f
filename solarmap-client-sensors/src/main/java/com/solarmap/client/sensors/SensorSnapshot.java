package com.solarmap.client.sensors;

import java.time.Instant;

/** Latest reading of a sensor together with its position in the panel grid. */
public record SensorSnapshot(int id, String label, int row, int column, double lux, Instant timestamp) {}
