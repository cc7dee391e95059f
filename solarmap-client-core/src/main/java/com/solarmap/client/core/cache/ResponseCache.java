package com.solarmap.client.core.cache;

import com.solarmap.client.core.ResponsePayload;
import java.time.Duration;
import java.util.Optional;

/** Store of decoded responses keyed by request, consulted only for cacheable reads. */
public interface ResponseCache {

    /** The cached payload under {@code key} if it has not expired yet. */
    Optional<ResponsePayload> lookup(String key);

    /** Stores or overwrites the entry under {@code key}; it expires {@code ttl} from now. */
    void store(String key, ResponsePayload payload, Duration ttl);

    /** Number of entries held, stale ones included. */
    int size();
}
