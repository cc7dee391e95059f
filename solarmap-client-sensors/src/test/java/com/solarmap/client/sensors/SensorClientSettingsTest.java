package com.solarmap.client.sensors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.solarmap.client.core.RequestConfig;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SensorClientSettingsTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(SensorClientSettings.PROP_BASE_URL);
        System.clearProperty(SensorClientSettings.PROP_VALUE_FIELD);
        System.clearProperty(SensorClientSettings.PROP_TIMEOUT_MS);
        System.clearProperty(SensorClientSettings.PROP_RETRIES);
        System.clearProperty(SensorClientSettings.PROP_CACHE_TTL_MS);
    }

    @Test
    void defaultsPointAtLocalDataService() {
        SensorClientSettings settings = SensorClientSettings.defaults();

        assertThat(settings.baseUrl()).isEqualTo("http://localhost:3000");
        assertThat(settings.valueField()).isEqualTo("lux");
        assertThat(settings.url("/api/heatmap")).isEqualTo("http://localhost:3000/api/heatmap");
        assertThat(settings.url("api/heatmap")).isEqualTo("http://localhost:3000/api/heatmap");
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty(SensorClientSettings.PROP_BASE_URL, " http://sensors.example:8080// ");
        System.setProperty(SensorClientSettings.PROP_VALUE_FIELD, "irradiance");
        System.setProperty(SensorClientSettings.PROP_TIMEOUT_MS, "2500");
        System.setProperty(SensorClientSettings.PROP_RETRIES, "3");
        System.setProperty(SensorClientSettings.PROP_CACHE_TTL_MS, "60000");

        SensorClientSettings settings = SensorClientSettings.fromEnvironment();

        assertThat(settings.baseUrl()).isEqualTo("http://sensors.example:8080");
        assertThat(settings.valueField()).isEqualTo("irradiance");
        RequestConfig request = settings.requestDefaults();
        assertThat(request.timeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(request.maxAttempts()).isEqualTo(4);
        assertThat(request.retryDelay()).isEqualTo(RequestConfig.DEFAULT_RETRY_DELAY);
        assertThat(request.cacheTtl()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void invalidNumberNamesTheProperty() {
        System.setProperty(SensorClientSettings.PROP_TIMEOUT_MS, "soon");

        assertThatThrownBy(SensorClientSettings::fromEnvironment)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(SensorClientSettings.PROP_TIMEOUT_MS);
    }

    @Test
    void blankValueFieldIsRejected() {
        assertThatThrownBy(() -> new SensorClientSettings("http://x", " ", RequestConfig.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
