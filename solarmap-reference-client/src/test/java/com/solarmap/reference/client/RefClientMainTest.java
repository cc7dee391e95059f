package com.solarmap.reference.client;

import static org.assertj.core.api.Assertions.assertThat;

import com.solarmap.client.sensors.SensorClientSettings;
import com.solarmap.client.testkit.ScriptedHttpTransport;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RefClientMainTest {

    private final ByteArrayOutputStream printed = new ByteArrayOutputStream();
    private ClosingTransport transport;

    @BeforeEach
    void setup() {
        transport = new ClosingTransport();
    }

    private int run(String... args) throws Exception {
        return RefClientMain.run(
                args,
                SensorClientSettings.of("http://data.local:3000"),
                transport,
                new PrintStream(printed, true, StandardCharsets.UTF_8));
    }

    @Test
    void failedRequestReturnsErrorCodeAndStillClosesTransport() throws Exception {
        transport.respondStatus(400);

        assertThat(run("1", "2", "1")).isEqualTo(1);
        assertThat(transport.closed).isTrue();
    }

    @Test
    void printsEverySectionAndClosesTransport() throws Exception {
        transport.otherwise(r -> {
            String path = r.uri().getPath();
            String body = path.equals("/api/heatmap")
                    ? "{\"grid\":[{\"id\":1,\"etiqueta\":\"A1\",\"fila\":0,\"columna\":0,\"lux\":500}]}"
                    : path.equals("/api/reports") ? "[{\"key\":\"2025-01-01\",\"avg\":1,\"max\":2,\"min\":0}]" : "[]";
            return ScriptedHttpTransport.response(200, "application/json", body);
        });

        assertThat(run("1", "2", "7")).isZero();

        String output = printed.toString(StandardCharsets.UTF_8);
        assertThat(output).contains("Sensor 7: 0 buckets", "Report 2025-01-01", "Panel A1 [0,0]");
        assertThat(transport.closed).isTrue();
    }

    private static final class ClosingTransport extends ScriptedHttpTransport {
        private boolean closed;

        @Override
        public void close() {
            closed = true;
        }
    }
}
