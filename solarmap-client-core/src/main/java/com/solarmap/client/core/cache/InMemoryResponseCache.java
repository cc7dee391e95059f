package com.solarmap.client.core.cache;

import com.solarmap.client.core.ResponsePayload;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed cache without eviction. Expiry is checked lazily on lookup, so the map grows with the
 * number of distinct keys; fine for the bounded sensor/range key space of the dashboard.
 *
 * <p>Concurrent stores under one key are not coordinated: the last writer wins. Payloads are copied
 * on the way in and out, so callers editing a JSON tree never touch the cached one.
 */
public class InMemoryResponseCache implements ResponseCache {
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryResponseCache() {
        this(Clock.systemUTC());
    }

    public InMemoryResponseCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<ResponsePayload> lookup(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null || !entry.isFresh(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.data().copy());
    }

    @Override
    public void store(String key, ResponsePayload payload, Duration ttl) {
        Instant expiresAt = clock.instant().plus(ttl);
        entries.put(key, new CacheEntry(key, payload.copy(), expiresAt));
    }

    @Override
    public int size() {
        return entries.size();
    }

    /** Raw entry under {@code key}, fresh or stale. */
    public Optional<CacheEntry> entry(String key) {
        return Optional.ofNullable(entries.get(key));
    }
}
