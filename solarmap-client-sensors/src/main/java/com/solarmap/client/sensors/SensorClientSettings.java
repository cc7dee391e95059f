package com.solarmap.client.sensors;

import com.solarmap.client.core.RequestConfig;
import java.util.Objects;

/**
 * Where the Data Service lives and how requests to it behave.
 *
 * <p>{@link #fromEnvironment()} reads system properties first, then environment variables, then
 * falls back to the defaults.
 */
public record SensorClientSettings(String baseUrl, String valueField, RequestConfig requestDefaults) {

    public static final String DEFAULT_BASE_URL = "http://localhost:3000";
    public static final String DEFAULT_VALUE_FIELD = "lux";

    public static final String PROP_BASE_URL = "solarmap.data.url";
    public static final String ENV_BASE_URL = "SOLARMAP_DATA_URL";
    public static final String PROP_VALUE_FIELD = "solarmap.data.value-field";
    public static final String ENV_VALUE_FIELD = "SOLARMAP_DATA_VALUE_FIELD";
    public static final String PROP_TIMEOUT_MS = "solarmap.request.timeout-ms";
    public static final String ENV_TIMEOUT_MS = "SOLARMAP_REQUEST_TIMEOUT_MS";
    public static final String PROP_RETRIES = "solarmap.request.retries";
    public static final String ENV_RETRIES = "SOLARMAP_REQUEST_RETRIES";
    public static final String PROP_RETRY_DELAY_MS = "solarmap.request.retry-delay-ms";
    public static final String ENV_RETRY_DELAY_MS = "SOLARMAP_REQUEST_RETRY_DELAY_MS";
    public static final String PROP_CACHE_TTL_MS = "solarmap.request.cache-ttl-ms";
    public static final String ENV_CACHE_TTL_MS = "SOLARMAP_REQUEST_CACHE_TTL_MS";

    public SensorClientSettings {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(requestDefaults, "requestDefaults");
        baseUrl = stripTrailingSlash(baseUrl.trim());
        if (baseUrl.isEmpty()) throw new IllegalArgumentException("baseUrl must not be blank");
        if (valueField == null || valueField.isBlank()) {
            throw new IllegalArgumentException("valueField must not be blank");
        }
    }

    public static SensorClientSettings defaults() {
        return new SensorClientSettings(DEFAULT_BASE_URL, DEFAULT_VALUE_FIELD, RequestConfig.defaults());
    }

    public static SensorClientSettings of(String baseUrl) {
        return new SensorClientSettings(baseUrl, DEFAULT_VALUE_FIELD, RequestConfig.defaults());
    }

    public static SensorClientSettings fromEnvironment() {
        RequestConfig.Builder request = RequestConfig.builder();
        String timeout = resolve(PROP_TIMEOUT_MS, ENV_TIMEOUT_MS);
        if (timeout != null) request.timeoutMillis(parseLong(PROP_TIMEOUT_MS, timeout));
        String retries = resolve(PROP_RETRIES, ENV_RETRIES);
        if (retries != null) request.retries((int) parseLong(PROP_RETRIES, retries));
        String retryDelay = resolve(PROP_RETRY_DELAY_MS, ENV_RETRY_DELAY_MS);
        if (retryDelay != null) request.retryDelayMillis(parseLong(PROP_RETRY_DELAY_MS, retryDelay));
        String cacheTtl = resolve(PROP_CACHE_TTL_MS, ENV_CACHE_TTL_MS);
        if (cacheTtl != null) request.cacheTtlMillis(parseLong(PROP_CACHE_TTL_MS, cacheTtl));

        String baseUrl = resolve(PROP_BASE_URL, ENV_BASE_URL);
        String valueField = resolve(PROP_VALUE_FIELD, ENV_VALUE_FIELD);
        return new SensorClientSettings(
                baseUrl != null ? baseUrl : DEFAULT_BASE_URL,
                valueField != null ? valueField : DEFAULT_VALUE_FIELD,
                request.build());
    }

    public SensorClientSettings withRequestDefaults(RequestConfig requestDefaults) {
        return new SensorClientSettings(baseUrl, valueField, requestDefaults);
    }

    /** Absolute URL for a path such as {@code /api/series}. */
    public String url(String path) {
        return baseUrl + (path.startsWith("/") ? path : "/" + path);
    }

    static String resolve(String property, String env) {
        String sys = System.getProperty(property);
        if (sys != null && !sys.isBlank()) return sys.trim();
        String envValue = System.getenv(env);
        if (envValue != null && !envValue.isBlank()) return envValue.trim();
        return null;
    }

    private static long parseLong(String property, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + property + ": '" + value + "'", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
