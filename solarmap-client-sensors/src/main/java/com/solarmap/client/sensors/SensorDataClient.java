package com.solarmap.client.sensors;

import com.fasterxml.jackson.databind.JsonNode;
import com.solarmap.client.api.CancellationToken;
import com.solarmap.client.core.RequestConfig;
import com.solarmap.client.core.RequestExecutor;
import com.solarmap.client.core.ResponsePayload;
import com.solarmap.series.Sample;
import com.solarmap.series.TimeBucketAggregator;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed access to the Data Service endpoints used by the dashboard: raw and bucketed series,
 * period reports, and the latest reading per sensor.
 *
 * <p>All calls go through the shared {@link RequestExecutor}, so they inherit its timeout, retry,
 * cache and cancellation behaviour. Futures fail with the executor's classified exceptions.
 */
public class SensorDataClient {
    private static final Logger log = LoggerFactory.getLogger(SensorDataClient.class);

    static final String SERIES_PATH = "/api/series";
    static final String REPORTS_PATH = "/api/reports";
    static final String HEATMAP_PATH = "/api/heatmap";

    private final RequestExecutor executor;
    private final TimeBucketAggregator aggregator;
    private final SensorClientSettings settings;
    private final SensorPayloadMapper mapper;
    private final Clock clock;

    public SensorDataClient(RequestExecutor executor, TimeBucketAggregator aggregator, SensorClientSettings settings) {
        this(executor, aggregator, settings, Clock.systemUTC());
    }

    public SensorDataClient(
            RequestExecutor executor, TimeBucketAggregator aggregator, SensorClientSettings settings, Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mapper = new SensorPayloadMapper(settings.valueField(), aggregator.zone());
    }

    public SensorClientSettings settings() {
        return settings;
    }

    /** Raw readings of one sensor; {@code from} and {@code to} are optional bounds. */
    public CompletableFuture<List<Sample>> series(int sensorId, Instant from, Instant to, CancellationToken token) {
        StringBuilder url = new StringBuilder(settings.url(SERIES_PATH)).append("?sensorId=").append(sensorId);
        if (from != null) url.append("&from=").append(encode(from.toString()));
        if (to != null) url.append("&to=").append(encode(to.toString()));
        return get(url.toString(), settings.requestDefaults(), token)
                .thenApply(body -> mapper.samples(sensorId, body));
    }

    public CompletableFuture<List<Sample>> series(int sensorId, CancellationToken token) {
        return series(sensorId, null, null, token);
    }

    /**
     * Fetches every sensor concurrently, keeps readings no older than {@code window} and buckets
     * each sensor into {@code intervalMinutes}-wide points.
     *
     * <p>The first sensor failure fails the result straight away and aborts the other requests.
     * The window is applied on the client so the request URL, and therefore the cache key, does
     * not change from one refresh to the next.
     */
    public CompletableFuture<List<SensorSeries>> recentSeries(
            List<Integer> sensorIds, Duration window, int intervalMinutes, CancellationToken token) {
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("intervalMinutes must be positive: " + intervalMinutes);
        }
        Instant cutoff = clock.instant().minus(window);
        CancellationToken group = (token == null ? CancellationToken.none() : token).child();
        CompletableFuture<List<SensorSeries>> combined = new CompletableFuture<>();
        combined.whenComplete((series, error) -> {
            if (combined.isCancelled()) group.cancel();
            group.detach();
        });

        List<CompletableFuture<SensorSeries>> perSensor = new ArrayList<>(sensorIds.size());
        for (Integer id : sensorIds) {
            CompletableFuture<SensorSeries> one =
                    series(id, group).thenApply(samples -> toSeries(id, samples, cutoff, intervalMinutes));
            one.whenComplete((series, error) -> {
                if (error != null && combined.completeExceptionally(RequestExecutor.unwrap(error))) {
                    log.debug("Sensor {} failed, aborting the remaining series requests", id);
                    group.cancel();
                }
            });
            perSensor.add(one);
        }
        CompletableFuture.allOf(perSensor.toArray(new CompletableFuture<?>[0]))
                .thenRun(() -> combined.complete(
                        perSensor.stream().map(CompletableFuture::join).collect(Collectors.toList())));
        return combined;
    }

    public CompletableFuture<List<SensorSeries>> recentSeries(SeriesQuery query, CancellationToken token) {
        return recentSeries(query.sensorIds(), query.window(), query.intervalMinutes(), token);
    }

    public CompletableFuture<List<ReportRow>> reports(ReportRange range, CancellationToken token) {
        Objects.requireNonNull(range, "range");
        String url = settings.url(REPORTS_PATH) + "?range=" + range.queryValue();
        return get(url, settings.requestDefaults(), token).thenApply(body -> mapper.reports(range, body));
    }

    /** Latest reading of every sensor with its grid position. Never served from the cache. */
    public CompletableFuture<List<SensorSnapshot>> latestReadings(CancellationToken token) {
        RequestConfig live = settings.requestDefaults().toBuilder().cacheTtl(Duration.ZERO).build();
        return get(settings.url(HEATMAP_PATH), live, token).thenApply(mapper::snapshots);
    }

    private SensorSeries toSeries(int sensorId, List<Sample> samples, Instant cutoff, int intervalMinutes) {
        List<Sample> recent = samples.stream()
                .filter(s -> !s.timestamp().isBefore(cutoff))
                .collect(Collectors.toList());
        if (log.isDebugEnabled()) {
            log.debug("Sensor {}: {} of {} readings inside window", sensorId, recent.size(), samples.size());
        }
        return new SensorSeries(sensorId, aggregator.aggregate(recent, intervalMinutes));
    }

    private CompletableFuture<JsonNode> get(String url, RequestConfig defaults, CancellationToken token) {
        RequestConfig config = defaults.toBuilder()
                .method("GET")
                .cancellationToken(token == null ? CancellationToken.none() : token)
                .build();
        return executor.execute(url, config).thenApply(payload -> jsonBody(url, payload));
    }

    private static JsonNode jsonBody(String url, ResponsePayload payload) {
        if (payload.isJson()) return payload.json();
        log.warn("{} answered with {} instead of JSON", url, payload.contentType());
        return null;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
