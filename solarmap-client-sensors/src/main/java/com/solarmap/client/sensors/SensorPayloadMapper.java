package com.solarmap.client.sensors;

import com.fasterxml.jackson.databind.JsonNode;
import com.solarmap.series.Sample;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns Data Service JSON into domain records. Malformed elements are skipped, never fatal.
 *
 * <p>Numeric columns may arrive as JSON strings ({@code "412.5"}), so both forms are accepted.
 * Timestamps are ISO-8601 (with or without offset, {@code T} or space separated) or epoch
 * milliseconds; local date-times are read in the reference zone.
 */
final class SensorPayloadMapper {
    private static final Logger log = LoggerFactory.getLogger(SensorPayloadMapper.class);

    private final String valueField;
    private final ZoneId zone;

    SensorPayloadMapper(String valueField, ZoneId zone) {
        this.valueField = valueField;
        this.zone = zone;
    }

    List<Sample> samples(int sensorId, JsonNode body) {
        if (body == null || !body.isArray()) {
            log.warn("Expected a JSON array of readings for sensor {}, got {}", sensorId, nodeType(body));
            return List.of();
        }
        List<Sample> samples = new ArrayList<>(body.size());
        for (JsonNode row : body) {
            Instant ts = timestamp(row.get("ts"));
            Double value = number(row.get(valueField));
            if (ts == null || value == null) {
                log.debug("Skipping reading of sensor {} without a usable ts/{}: {}", sensorId, valueField, row);
                continue;
            }
            samples.add(new Sample(ts, value));
        }
        return samples;
    }

    List<ReportRow> reports(ReportRange range, JsonNode body) {
        if (body == null || !body.isArray()) {
            log.warn("Expected a JSON array for {} report, got {}", range.queryValue(), nodeType(body));
            return List.of();
        }
        List<ReportRow> rows = new ArrayList<>(body.size());
        for (JsonNode row : body) {
            JsonNode key = row.get("key");
            Double avg = number(row.get("avg"));
            Double max = number(row.get("max"));
            Double min = number(row.get("min"));
            if (key == null || key.isNull() || avg == null || max == null || min == null) {
                log.debug("Skipping malformed report row: {}", row);
                continue;
            }
            rows.add(new ReportRow(key.asText(), avg, max, min));
        }
        return rows;
    }

    List<SensorSnapshot> snapshots(JsonNode body) {
        JsonNode grid = body == null ? null : body.get("grid");
        if (grid == null || !grid.isArray()) {
            log.warn("Heatmap response has no grid array: {}", nodeType(body));
            return List.of();
        }
        List<SensorSnapshot> snapshots = new ArrayList<>(grid.size());
        for (JsonNode cell : grid) {
            Double id = number(cell.get("id"));
            Double row = number(cell.get("fila"));
            Double column = number(cell.get("columna"));
            if (id == null || row == null || column == null) {
                log.debug("Skipping heatmap cell without id/fila/columna: {}", cell);
                continue;
            }
            Double lux = number(cell.get("lux"));
            JsonNode label = cell.get("etiqueta");
            snapshots.add(new SensorSnapshot(
                    id.intValue(),
                    label == null || label.isNull() ? "S" + id.intValue() : label.asText(),
                    row.intValue(),
                    column.intValue(),
                    lux == null ? 0.0 : lux,
                    timestamp(cell.get("ts"))));
        }
        return snapshots;
    }

    Instant timestamp(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isIntegralNumber()) return Instant.ofEpochMilli(node.asLong());
        if (!node.isTextual()) return null;
        String text = node.asText().trim();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        try {
            TemporalAccessor parsed =
                    DateTimeFormatter.ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime) return ((ZonedDateTime) parsed).toInstant();
            return ((LocalDateTime) parsed).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static Double number(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) return node.asDouble();
        if (node.isTextual()) {
            try {
                double parsed = Double.parseDouble(node.asText().trim());
                return Double.isFinite(parsed) ? parsed : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String nodeType(JsonNode node) {
        return node == null ? "nothing" : node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
