package com.solarmap.client.transport;

import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** One outgoing HTTP request. Headers and body are passed through verbatim. */
public record TransportRequest(String method, URI uri, Map<String, String> headers, byte[] body) {

    public TransportRequest {
        method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
        Objects.requireNonNull(uri, "uri");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static TransportRequest get(String uri) {
        return new TransportRequest("GET", URI.create(uri), Map.of(), null);
    }

    public boolean hasBody() {
        return body != null && body.length > 0;
    }
}
