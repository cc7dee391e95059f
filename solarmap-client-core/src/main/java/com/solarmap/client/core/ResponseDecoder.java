package com.solarmap.client.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.solarmap.client.transport.TransportResponse;
import java.io.IOException;

/** Turns a successful exchange into a {@link ResponsePayload} according to its content type. */
public class ResponseDecoder {
    private final ObjectMapper mapper;

    public ResponseDecoder() {
        this(new ObjectMapper());
    }

    public ResponseDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ResponsePayload decode(TransportResponse response) throws IOException {
        String contentType = response.contentType();
        if (!isJson(contentType)) {
            return ResponsePayload.text(contentType, response.bodyAsString());
        }
        JsonNode tree = mapper.readTree(response.body());
        if (tree == null || tree.isMissingNode()) {
            tree = NullNode.getInstance();
        }
        return ResponsePayload.json(contentType, tree);
    }

    static boolean isJson(String contentType) {
        int semicolon = contentType.indexOf(';');
        String mime = (semicolon >= 0 ? contentType.substring(0, semicolon) : contentType).trim();
        return mime.equals("application/json") || mime.endsWith("+json");
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
