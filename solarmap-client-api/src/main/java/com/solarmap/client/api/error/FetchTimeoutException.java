package com.solarmap.client.api.error;

import java.time.Duration;

/** The last attempt exceeded its deadline. */
public class FetchTimeoutException extends DataFetchException {
    private final Duration timeout;

    public FetchTimeoutException(Duration timeout) {
        super("Request timed out after " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
