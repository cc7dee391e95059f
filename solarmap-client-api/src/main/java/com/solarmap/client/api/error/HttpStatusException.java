package com.solarmap.client.api.error;

/**
 * The server answered with a non-2xx status that was either not retryable or persisted after the
 * last retry.
 */
public class HttpStatusException extends DataFetchException {
    private final int status;
    private final String errorBody;

    public HttpStatusException(int status, String errorBody) {
        super("HTTP " + status);
        this.status = status;
        this.errorBody = errorBody == null ? "" : errorBody;
    }

    public int status() {
        return status;
    }

    /** Response body sent along with the error status; empty when there was none. */
    public String errorBody() {
        return errorBody;
    }

    public boolean isRetryable() {
        return isRetryableStatus(status);
    }

    /** 429 and every 5xx are worth another attempt. */
    public static boolean isRetryableStatus(int status) {
        return status == 429 || status >= 500;
    }
}
