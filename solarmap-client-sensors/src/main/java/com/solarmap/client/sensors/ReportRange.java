package com.solarmap.client.sensors;

import java.util.Locale;

/** Period of the precomputed reports served by {@code /api/reports}. */
public enum ReportRange {
    DAY,
    WEEK,
    MONTH;

    public String queryValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
