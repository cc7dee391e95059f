package com.solarmap.reference.client;

import com.solarmap.client.api.CancellationToken;
import com.solarmap.client.api.error.DataFetchException;
import com.solarmap.client.core.RequestExecutor;
import com.solarmap.client.core.cache.InMemoryResponseCache;
import com.solarmap.client.core.schedule.ExecutorTaskScheduler;
import com.solarmap.client.sensors.ReportRange;
import com.solarmap.client.sensors.ReportRow;
import com.solarmap.client.sensors.SensorClientSettings;
import com.solarmap.client.sensors.SensorDataClient;
import com.solarmap.client.sensors.SensorSeries;
import com.solarmap.client.sensors.SensorSnapshot;
import com.solarmap.client.transport.HttpTransport;
import com.solarmap.client.transport.jdkhttp.JdkHttpTransport;
import com.solarmap.series.AggregatedPoint;
import com.solarmap.series.TimeBucketAggregator;
import java.io.IOException;
import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints bucketed series, the daily report and the latest grid from a running Data Service.
 *
 * <p>Usage: {@code RefClientMain [hours] [intervalMinutes] [sensorId...]}; defaults to the last 6
 * hours of sensors 1 to 3 in 2-minute buckets.
 */
public class RefClientMain {
    private static final Logger log = LoggerFactory.getLogger(RefClientMain.class);

    public static void main(String[] args) throws IOException {
        int exitCode = run(args, SensorClientSettings.fromEnvironment(), new JdkHttpTransport(), System.out);
        if (exitCode != 0) System.exit(exitCode);
    }

    /** Runs the queries and returns the process exit code; the transport is always closed. */
    static int run(String[] args, SensorClientSettings settings, HttpTransport transport, PrintStream out)
            throws IOException {
        int hours = args.length > 0 ? Integer.parseInt(args[0]) : 6;
        int interval = args.length > 1 ? Integer.parseInt(args[1]) : 2;
        List<Integer> sensors = new ArrayList<>();
        for (int i = 2; i < args.length; i++) {
            sensors.add(Integer.parseInt(args[i]));
        }
        if (sensors.isEmpty()) sensors = List.of(1, 2, 3);
        log.info("Querying {} for sensors {}", settings.baseUrl(), sensors);

        try (transport;
                var scheduler = new ExecutorTaskScheduler()) {
            var executor = new RequestExecutor(transport, new InMemoryResponseCache(), scheduler);
            var client = new SensorDataClient(executor, new TimeBucketAggregator(), settings);
            CancellationToken token = CancellationToken.create();

            for (SensorSeries series : client.recentSeries(sensors, Duration.ofHours(hours), interval, token)
                    .join()) {
                out.println("Sensor " + series.sensorId() + ": " + series.points().size() + " buckets");
                for (AggregatedPoint point : series.points()) {
                    out.printf("  %s  %8.1f lux  (%d)%n", point.bucketStart(), point.value(), point.sampleCount());
                }
            }
            for (ReportRow row : client.reports(ReportRange.DAY, token).join()) {
                out.printf("Report %s  avg %.1f  max %.1f  min %.1f%n", row.key(), row.avg(), row.max(), row.min());
            }
            for (SensorSnapshot cell : client.latestReadings(token).join()) {
                out.printf(
                        "Panel %s [%d,%d]  %.1f lux at %s%n",
                        cell.label(), cell.row(), cell.column(), cell.lux(), cell.timestamp());
            }
            return 0;
        } catch (RuntimeException e) {
            DataFetchException failure = RequestExecutor.unwrap(e);
            log.error("Data Service request failed: {}", failure.getMessage());
            return 1;
        }
    }
}
