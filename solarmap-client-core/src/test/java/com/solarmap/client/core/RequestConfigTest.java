package com.solarmap.client.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RequestConfigTest {

    @Test
    void defaultsMatchTheDocumentedValues() {
        RequestConfig config = RequestConfig.defaults();

        assertThat(config.method()).isEqualTo("GET");
        assertThat(config.timeout()).isEqualTo(Duration.ofMillis(7000));
        assertThat(config.retries()).isEqualTo(1);
        assertThat(config.maxAttempts()).isEqualTo(2);
        assertThat(config.retryDelay()).isEqualTo(Duration.ofMillis(350));
        assertThat(config.cacheTtl()).isZero();
        assertThat(config.isCacheable()).isFalse();
        assertThat(config.cancellationToken().isCancellationRequested()).isFalse();
    }

    @Test
    void cacheKeyDefaultsToMethodAndUrl() {
        RequestConfig config = RequestConfig.builder().method("get").cacheTtlMillis(1000).build();

        assertThat(config.isCacheable()).isTrue();
        assertThat(config.resolveCacheKey("http://x/api/heatmap")).isEqualTo("GET:http://x/api/heatmap");
        assertThat(config.toBuilder().cacheKey("grid").build().resolveCacheKey("http://x/api/heatmap"))
                .isEqualTo("grid");
    }

    @Test
    void onlyReadsAreCacheable() {
        assertThat(RequestConfig.builder().method("POST").cacheTtlMillis(1000).build().isCacheable())
                .isFalse();
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThatThrownBy(() -> RequestConfig.builder().timeout(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
