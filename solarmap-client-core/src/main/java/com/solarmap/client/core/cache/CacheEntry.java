package com.solarmap.client.core.cache;

import com.solarmap.client.core.ResponsePayload;
import java.time.Instant;

/** A cached response; stale once its expiry has been reached, never removed. */
public record CacheEntry(String key, ResponsePayload data, Instant expiresAt) {

    public boolean isFresh(Instant now) {
        return now.isBefore(expiresAt);
    }
}
