package com.solarmap.client.testkit;

import com.solarmap.client.transport.HttpTransport;
import com.solarmap.client.transport.TransportRequest;
import com.solarmap.client.transport.TransportResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Test double that answers exchanges from a script and records every request it sees.
 *
 * <p>Scripted outcomes are consumed in order; once the script is exhausted the fallback answers
 * (by default a 404). {@link #hang()} leaves an exchange in flight until the caller cancels it.
 */
public class ScriptedHttpTransport implements HttpTransport {
    private final Deque<Function<TransportRequest, CompletableFuture<TransportResponse>>> script = new ArrayDeque<>();
    private final List<TransportRequest> requests = new ArrayList<>();
    private final List<CompletableFuture<TransportResponse>> hanging = new ArrayList<>();
    private Function<TransportRequest, CompletableFuture<TransportResponse>> fallback =
            r -> CompletableFuture.completedFuture(new TransportResponse(404, Map.of(), new byte[0]));

    public synchronized ScriptedHttpTransport respond(int status, String contentType, String body) {
        TransportResponse response = response(status, contentType, body);
        script.add(r -> CompletableFuture.completedFuture(response));
        return this;
    }

    public ScriptedHttpTransport respondJson(String json) {
        return respond(200, "application/json", json);
    }

    public ScriptedHttpTransport respondStatus(int status) {
        return respond(status, "application/json", "{\"error\":\"HTTP " + status + "\"}");
    }

    public synchronized ScriptedHttpTransport fail(IOException error) {
        script.add(r -> CompletableFuture.failedFuture(error));
        return this;
    }

    /** Leaves the next exchange pending; it only ends when the caller cancels it. */
    public synchronized ScriptedHttpTransport hang() {
        script.add(r -> {
            CompletableFuture<TransportResponse> pending = new CompletableFuture<>();
            hanging.add(pending);
            return pending;
        });
        return this;
    }

    /** Answers by route: every request not consumed by the script goes to {@code handler}. */
    public synchronized ScriptedHttpTransport otherwise(Function<TransportRequest, TransportResponse> handler) {
        this.fallback = r -> CompletableFuture.completedFuture(handler.apply(r));
        return this;
    }

    @Override
    public CompletableFuture<TransportResponse> exchange(TransportRequest request) {
        Function<TransportRequest, CompletableFuture<TransportResponse>> next;
        synchronized (this) {
            requests.add(request);
            next = script.isEmpty() ? fallback : script.poll();
        }
        return next.apply(request);
    }

    public synchronized List<TransportRequest> requests() {
        return Collections.unmodifiableList(new ArrayList<>(requests));
    }

    public synchronized int requestCount() {
        return requests.size();
    }

    /** Number of hung exchanges the caller aborted. */
    public synchronized long abortedCount() {
        return hanging.stream().filter(CompletableFuture::isCancelled).count();
    }

    public synchronized int remainingScript() {
        return script.size();
    }

    public synchronized void clear() {
        script.clear();
        requests.clear();
        hanging.clear();
    }

    public static TransportResponse response(int status, String contentType, String body) {
        Map<String, String> headers = contentType == null ? Map.of() : Map.of("Content-Type", contentType);
        byte[] bytes = body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8);
        return new TransportResponse(status, headers, bytes);
    }
}
