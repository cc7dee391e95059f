package com.solarmap.client.sensors;

import com.solarmap.client.api.error.DataFetchException;
import java.util.List;
import org.slf4j.LoggerFactory;

/** Receives the outcome of each refresh run by {@link SeriesRefresher}. Cancelled refreshes are not reported. */
public interface SeriesListener {

    void onSeries(SeriesQuery query, List<SensorSeries> series);

    default void onFailure(SeriesQuery query, DataFetchException error) {
        LoggerFactory.getLogger(SeriesListener.class)
                .warn("Series refresh for {} failed: {}", query, error.getMessage());
    }
}
