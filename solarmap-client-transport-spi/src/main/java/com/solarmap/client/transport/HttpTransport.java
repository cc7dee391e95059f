package com.solarmap.client.transport;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Minimal transport SPI: perform one HTTP exchange with the Data Service.
 *
 * <p>The returned future completes with the response whatever its status, or exceptionally with
 * an {@link IOException} when the exchange could not be carried out. Cancelling the future aborts
 * the exchange if it is still in flight.
 */
public interface HttpTransport extends Closeable {

    CompletableFuture<TransportResponse> exchange(TransportRequest request);

    @Override
    default void close() throws IOException {
        /* no-op */
    }
}
