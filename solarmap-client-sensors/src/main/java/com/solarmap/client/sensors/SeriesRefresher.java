package com.solarmap.client.sensors;

import com.solarmap.client.api.CancellationToken;
import com.solarmap.client.api.TaskScheduler;
import com.solarmap.client.api.error.DataFetchException;
import com.solarmap.client.api.error.FetchCancelledException;
import com.solarmap.client.core.RequestExecutor;
import com.solarmap.client.core.debounce.DebounceGate;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a bucketed series view in step with rapidly changing query parameters.
 *
 * <p>Queries pass through a {@link DebounceGate}; only the value that survives the quiescence
 * period is fetched. Starting a refresh cancels the one still in flight, so listeners only ever
 * see results for the most recent query.
 */
public final class SeriesRefresher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SeriesRefresher.class);

    private final SensorDataClient client;
    private final SeriesListener listener;
    private final DebounceGate<SeriesQuery> gate;
    private final CancellationToken lifetime = CancellationToken.create();

    private CancellationToken inFlight;
    private boolean closed;

    public SeriesRefresher(SensorDataClient client, TaskScheduler scheduler, SeriesListener listener) {
        this(client, scheduler, DebounceGate.DEFAULT_QUIESCENCE, listener);
    }

    public SeriesRefresher(
            SensorDataClient client, TaskScheduler scheduler, Duration quiescence, SeriesListener listener) {
        this.client = Objects.requireNonNull(client, "client");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.gate = new DebounceGate<>(quiescence, scheduler, this::refresh);
    }

    /** Requests a refresh; bursts of calls collapse into one fetch for the last query. */
    public void request(SeriesQuery query) {
        Objects.requireNonNull(query, "query");
        gate.submit(query);
    }

    /** Whether a fetch is currently running. */
    public synchronized boolean isRefreshing() {
        return inFlight != null;
    }

    private void refresh(SeriesQuery query) {
        CancellationToken token;
        CancellationToken superseded;
        synchronized (this) {
            if (closed) return;
            superseded = inFlight;
            token = lifetime.child();
            inFlight = token;
        }
        if (superseded != null) {
            log.debug("Superseding in-flight series refresh");
            superseded.cancel();
        }
        client.recentSeries(query, token).whenComplete((series, error) -> {
            token.detach();
            synchronized (this) {
                if (inFlight == token) inFlight = null;
            }
            if (token.isCancellationRequested()) {
                log.debug("Dropping result of cancelled refresh for {}", query);
                return;
            }
            if (error == null) {
                deliver(query, series);
                return;
            }
            DataFetchException failure = RequestExecutor.unwrap(error);
            if (failure instanceof FetchCancelledException) {
                log.debug("Series refresh for {} cancelled", query);
                return;
            }
            listener.onFailure(query, failure);
        });
    }

    private void deliver(SeriesQuery query, List<SensorSeries> series) {
        try {
            listener.onSeries(query, series);
        } catch (RuntimeException e) {
            log.warn("Series listener failed for {}", query, e);
        }
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) return;
            closed = true;
            inFlight = null;
        }
        gate.close();
        lifetime.cancel();
    }
}
