package com.solarmap.client.core;

import com.solarmap.client.api.CancellationToken;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Per-call options of {@link RequestExecutor}. Immutable; derive variants with {@link #toBuilder()}.
 *
 * <table>
 *   <caption>Defaults</caption>
 *   <tr><td>method</td><td>GET</td></tr>
 *   <tr><td>timeout</td><td>7000 ms per attempt</td></tr>
 *   <tr><td>retries</td><td>1 (so two attempts at most)</td></tr>
 *   <tr><td>retryDelay</td><td>350 ms, multiplied by the attempt number</td></tr>
 *   <tr><td>cacheTtl</td><td>zero, caching disabled</td></tr>
 * </table>
 */
public final class RequestConfig {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(7000);
    public static final int DEFAULT_RETRIES = 1;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(350);

    private static final RequestConfig DEFAULTS = builder().build();

    private final String method;
    private final Map<String, String> headers;
    private final byte[] body;
    private final Duration timeout;
    private final int retries;
    private final Duration retryDelay;
    private final Duration cacheTtl;
    private final String cacheKey;
    private final CancellationToken cancellationToken;

    private RequestConfig(Builder b) {
        this.method = b.method.toUpperCase(Locale.ROOT);
        this.headers = Map.copyOf(b.headers);
        this.body = b.body;
        this.timeout = b.timeout;
        this.retries = b.retries;
        this.retryDelay = b.retryDelay;
        this.cacheTtl = b.cacheTtl;
        this.cacheKey = b.cacheKey;
        this.cancellationToken = b.cancellationToken;
    }

    public static RequestConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.method = method;
        b.headers.putAll(headers);
        b.body = body;
        b.timeout = timeout;
        b.retries = retries;
        b.retryDelay = retryDelay;
        b.cacheTtl = cacheTtl;
        b.cacheKey = cacheKey;
        b.cancellationToken = cancellationToken;
        return b;
    }

    public String method() {
        return method;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public byte[] body() {
        return body;
    }

    public Duration timeout() {
        return timeout;
    }

    public int retries() {
        return retries;
    }

    /** Attempts allowed for one call: {@code retries + 1}, never less than one. */
    public int maxAttempts() {
        return Math.max(1, retries + 1);
    }

    public Duration retryDelay() {
        return retryDelay;
    }

    public Duration cacheTtl() {
        return cacheTtl;
    }

    public String cacheKey() {
        return cacheKey;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    /** Only reads with a positive TTL touch the cache. */
    public boolean isCacheable() {
        return "GET".equals(method) && cacheTtl.compareTo(Duration.ZERO) > 0;
    }

    /** The explicit cache key, else {@code METHOD:url}. */
    public String resolveCacheKey(String url) {
        return cacheKey != null && !cacheKey.isBlank() ? cacheKey : method + ":" + url;
    }

    @Override
    public String toString() {
        return "RequestConfig{method=" + method + ", timeout=" + timeout.toMillis() + "ms, retries=" + retries
                + ", retryDelay=" + retryDelay.toMillis() + "ms, cacheTtl=" + cacheTtl.toMillis() + "ms"
                + (cacheKey != null ? ", cacheKey=" + cacheKey : "") + "}";
    }

    public static final class Builder {
        private String method = "GET";
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private Duration timeout = DEFAULT_TIMEOUT;
        private int retries = DEFAULT_RETRIES;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private Duration cacheTtl = Duration.ZERO;
        private String cacheKey;
        private CancellationToken cancellationToken = CancellationToken.none();

        private Builder() {}

        public Builder method(String method) {
            this.method = Objects.requireNonNull(method, "method");
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.putAll(headers);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder body(String body) {
            this.body = body == null ? null : body.getBytes(StandardCharsets.UTF_8);
            return this;
        }

        public Builder timeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public Builder timeoutMillis(long millis) {
            return timeout(Duration.ofMillis(millis));
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            Objects.requireNonNull(retryDelay, "retryDelay");
            if (retryDelay.isNegative()) {
                throw new IllegalArgumentException("retryDelay must not be negative: " + retryDelay);
            }
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder retryDelayMillis(long millis) {
            return retryDelay(Duration.ofMillis(millis));
        }

        public Builder cacheTtl(Duration cacheTtl) {
            Objects.requireNonNull(cacheTtl, "cacheTtl");
            this.cacheTtl = cacheTtl.isNegative() ? Duration.ZERO : cacheTtl;
            return this;
        }

        public Builder cacheTtlMillis(long millis) {
            return cacheTtl(Duration.ofMillis(millis));
        }

        public Builder cacheKey(String cacheKey) {
            this.cacheKey = cacheKey;
            return this;
        }

        public Builder cancellationToken(CancellationToken token) {
            this.cancellationToken = token == null ? CancellationToken.none() : token;
            return this;
        }

        public RequestConfig build() {
            return new RequestConfig(this);
        }
    }
}
