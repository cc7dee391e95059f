package com.solarmap.client.transport;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/** Status, headers and raw body of a completed exchange. Header names are case-insensitive. */
public record TransportResponse(int status, Map<String, String> headers, byte[] body) {

    public TransportResponse {
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) copy.putAll(headers);
        headers = copy;
        body = body == null ? new byte[0] : body;
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    /** Content type in lower case, or an empty string when the server sent none. */
    public String contentType() {
        String value = headers.get("Content-Type");
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
