package com.solarmap.client.api.error;

/** The caller's cancellation token fired. Never retried. */
public class FetchCancelledException extends DataFetchException {

    public FetchCancelledException() {
        super("Request cancelled");
    }

    public FetchCancelledException(String message) {
        super(message);
    }
}
