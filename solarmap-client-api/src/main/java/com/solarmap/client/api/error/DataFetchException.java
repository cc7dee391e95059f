package com.solarmap.client.api.error;

/** Root of the classified failures a data request can end with. */
public class DataFetchException extends RuntimeException {

    public DataFetchException(String message) {
        super(message);
    }

    public DataFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
