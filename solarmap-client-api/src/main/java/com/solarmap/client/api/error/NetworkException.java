package com.solarmap.client.api.error;

import java.io.IOException;

/** Transport-level failure (connection reset, DNS, ...) that outlived every retry. */
public class NetworkException extends DataFetchException {

    public NetworkException(IOException cause) {
        super("Network failure: " + cause.getMessage(), cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
