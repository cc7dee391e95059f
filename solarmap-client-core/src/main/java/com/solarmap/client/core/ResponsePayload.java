package com.solarmap.client.core;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/** A decoded 2xx body: a JSON tree when the server said JSON, raw text otherwise. */
public final class ResponsePayload {
    private final String contentType;
    private final JsonNode json;
    private final String text;

    private ResponsePayload(String contentType, JsonNode json, String text) {
        this.contentType = contentType;
        this.json = json;
        this.text = text;
    }

    public static ResponsePayload json(String contentType, JsonNode json) {
        return new ResponsePayload(contentType, Objects.requireNonNull(json, "json"), null);
    }

    public static ResponsePayload text(String contentType, String text) {
        return new ResponsePayload(contentType, null, Objects.requireNonNull(text, "text"));
    }

    public boolean isJson() {
        return json != null;
    }

    /** The JSON tree. Jackson trees are mutable; {@link #copy()} before editing a shared payload. */
    public JsonNode json() {
        if (json == null) {
            throw new IllegalStateException("Response is not JSON (content type '" + contentType + "')");
        }
        return json;
    }

    /** An independent payload; the JSON tree is deep-copied. */
    public ResponsePayload copy() {
        return json != null ? new ResponsePayload(contentType, json.deepCopy(), null) : this;
    }

    /** The raw text, or the serialized JSON tree. */
    public String text() {
        return json != null ? json.toString() : text;
    }

    public String contentType() {
        return contentType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResponsePayload)) return false;
        ResponsePayload that = (ResponsePayload) o;
        return Objects.equals(json, that.json) && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(json, text);
    }

    @Override
    public String toString() {
        return "ResponsePayload{" + (isJson() ? "json" : "text") + "=" + text() + "}";
    }
}
