package com.solarmap.client.spring.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;

import com.solarmap.client.core.RequestConfig;
import com.solarmap.client.core.RequestExecutor;
import com.solarmap.client.sensors.SensorClientSettings;
import com.solarmap.client.sensors.SensorDataClient;
import com.solarmap.client.transport.HttpTransport;
import com.solarmap.client.transport.jdkhttp.JdkHttpTransport;
import com.solarmap.client.transport.okhttp.OkHttpTransport;
import com.solarmap.series.TimeBucketAggregator;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.FilteredClassLoader;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class SolarmapClientAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SolarmapClientAutoConfiguration.class));

    @Test
    void prefersOkhttpWhenPresent() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(HttpTransport.class);
            assertThat(context.getBean(HttpTransport.class)).isInstanceOf(OkHttpTransport.class);
            assertThat(context).hasSingleBean(RequestExecutor.class);
            assertThat(context).hasSingleBean(SensorDataClient.class);
        });
    }

    @Test
    void fallsBackToJdkHttpClientWithoutOkhttp() {
        runner.withClassLoader(new FilteredClassLoader(OkHttpTransport.class)).run(context -> {
            assertThat(context).hasSingleBean(HttpTransport.class);
            assertThat(context.getBean(HttpTransport.class)).isInstanceOf(JdkHttpTransport.class);
        });
    }

    @Test
    void defaultsMatchPlainSettings() {
        runner.run(context -> {
            SensorClientSettings settings = context.getBean(SensorDataClient.class).settings();
            assertThat(settings.baseUrl()).isEqualTo("http://localhost:3000");
            assertThat(settings.valueField()).isEqualTo("lux");
            assertThat(settings.requestDefaults().timeout()).isEqualTo(RequestConfig.DEFAULT_TIMEOUT);
            assertThat(settings.requestDefaults().isCacheable()).isFalse();
        });
    }

    @Test
    void bindsClientProperties() {
        runner.withPropertyValues(
                        "solarmap.client.base-url=http://sensors.example:8080/",
                        "solarmap.client.value-field=irradiance",
                        "solarmap.client.zone=America/Bogota",
                        "solarmap.client.request.timeout=2s",
                        "solarmap.client.request.retries=3",
                        "solarmap.client.request.retry-delay=100ms",
                        "solarmap.client.request.cache-ttl=30s")
                .run(context -> {
                    SensorClientSettings settings = context.getBean(SensorDataClient.class).settings();
                    assertThat(settings.baseUrl()).isEqualTo("http://sensors.example:8080");
                    assertThat(settings.valueField()).isEqualTo("irradiance");
                    RequestConfig request = settings.requestDefaults();
                    assertThat(request.timeout()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(request.maxAttempts()).isEqualTo(4);
                    assertThat(request.retryDelay()).isEqualTo(Duration.ofMillis(100));
                    assertThat(request.cacheTtl()).isEqualTo(Duration.ofSeconds(30));
                    assertThat(context.getBean(TimeBucketAggregator.class).zone())
                            .isEqualTo(ZoneId.of("America/Bogota"));
                });
    }

    @Test
    void userTransportWins() {
        runner.withUserConfiguration(CustomTransportConfig.class).run(context -> {
            assertThat(context).hasSingleBean(HttpTransport.class);
            assertThat(context.getBean(HttpTransport.class)).isSameAs(CustomTransportConfig.TRANSPORT);
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomTransportConfig {
        static final HttpTransport TRANSPORT = request -> new CompletableFuture<>();

        @Bean
        HttpTransport customTransport() {
            return TRANSPORT;
        }
    }
}
