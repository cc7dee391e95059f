package com.solarmap.client.sensors;

/** One period of a report: average, maximum and minimum lux. */
public record ReportRow(String key, double avg, double max, double min) {}
