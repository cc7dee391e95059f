package com.solarmap.client.sensors;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solarmap.series.Sample;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

class SensorPayloadMapperTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final SensorPayloadMapper mapper = new SensorPayloadMapper("lux", ZoneId.of("America/Bogota"));

    @Test
    void localTimestampsAreReadInTheReferenceZone() throws Exception {
        JsonNode body = JSON.readTree("["
                + "{\"ts\":\"2025-01-01T09:01:00\",\"lux\":10},"
                + "{\"ts\":\"2025-01-01 09:02:00\",\"lux\":20},"
                + "{\"ts\":\"2025-01-01 09:03:00.250\",\"lux\":30}"
                + "]");

        List<Sample> samples = mapper.samples(1, body);

        assertThat(samples)
                .containsExactly(
                        new Sample(Instant.parse("2025-01-01T14:01:00Z"), 10.0),
                        new Sample(Instant.parse("2025-01-01T14:02:00Z"), 20.0),
                        new Sample(Instant.parse("2025-01-01T14:03:00.250Z"), 30.0));
    }

    @Test
    void explicitOffsetsIgnoreTheReferenceZone() throws Exception {
        assertThat(mapper.timestamp(JSON.readTree("\"2025-01-01T09:01:00Z\"")))
                .isEqualTo(Instant.parse("2025-01-01T09:01:00Z"));
        assertThat(mapper.timestamp(JSON.readTree("\"2025-01-01 09:01:00+02:00\"")))
                .isEqualTo(Instant.parse("2025-01-01T07:01:00Z"));
        assertThat(mapper.timestamp(JSON.readTree("1735722000000")))
                .isEqualTo(Instant.parse("2025-01-01T09:00:00Z"));
    }

    @Test
    void unparseableTimestampsAreRejected() throws Exception {
        assertThat(mapper.timestamp(JSON.readTree("\"yesterday\""))).isNull();
        assertThat(mapper.timestamp(JSON.readTree("\"2025-01-01\""))).isNull();
        assertThat(mapper.timestamp(JSON.readTree("true"))).isNull();
        assertThat(mapper.timestamp(null)).isNull();
    }
}
