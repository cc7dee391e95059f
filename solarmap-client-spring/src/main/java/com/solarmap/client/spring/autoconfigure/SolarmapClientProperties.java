package com.solarmap.client.spring.autoconfigure;

import com.solarmap.client.core.RequestConfig;
import com.solarmap.client.sensors.SensorClientSettings;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the SolarMap Data Service client.
 *
 * <h3>Configuration Example:</h3>
 * <pre>{@code
 * # application.yml
 * solarmap:
 *   client:
 *     base-url: http://localhost:3000
 *     value-field: lux
 *     zone: America/Bogota      # bucket boundaries; system zone when unset
 *     request:
 *       timeout: 7s
 *       retries: 1
 *       retry-delay: 350ms
 *       cache-ttl: 0s           # 0 disables response caching
 * }</pre>
 */
@ConfigurationProperties(prefix = "solarmap.client")
public class SolarmapClientProperties {

    /** Data Service root URL. */
    private String baseUrl = SensorClientSettings.DEFAULT_BASE_URL;

    /** JSON field holding the reading in series responses. */
    private String valueField = SensorClientSettings.DEFAULT_VALUE_FIELD;

    /** Zone whose wall clock defines bucket boundaries. */
    private ZoneId zone;

    private final Request request = new Request();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getValueField() {
        return valueField;
    }

    public void setValueField(String valueField) {
        this.valueField = valueField;
    }

    public ZoneId getZone() {
        return zone;
    }

    public void setZone(ZoneId zone) {
        this.zone = zone;
    }

    public Request getRequest() {
        return request;
    }

    SensorClientSettings toSettings() {
        return new SensorClientSettings(baseUrl, valueField, request.toConfig());
    }

    /** Defaults applied to every Data Service request. */
    public static class Request {

        /** Deadline of a single attempt. */
        private Duration timeout = RequestConfig.DEFAULT_TIMEOUT;

        /** Additional attempts after the first one fails with a retryable error. */
        private int retries = RequestConfig.DEFAULT_RETRIES;

        /** Backoff unit; the wait before attempt n+1 is n times this value. */
        private Duration retryDelay = RequestConfig.DEFAULT_RETRY_DELAY;

        /** How long a successful GET is served from memory. */
        private Duration cacheTtl = Duration.ZERO;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getRetries() {
            return retries;
        }

        public void setRetries(int retries) {
            this.retries = retries;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }

        RequestConfig toConfig() {
            return RequestConfig.builder()
                    .timeout(timeout)
                    .retries(retries)
                    .retryDelay(retryDelay)
                    .cacheTtl(cacheTtl)
                    .build();
        }
    }
}
