package com.solarmap.client.transport.okhttp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.solarmap.client.transport.TransportRequest;
import com.solarmap.client.transport.TransportResponse;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class OkHttpTransportTest {

    static HttpServer server;
    static String base;
    static final CountDownLatch slowStarted = new CountDownLatch(1);
    static final CountDownLatch release = new CountDownLatch(1);

    private final OkHttpTransport transport = new OkHttpTransport();

    @BeforeAll
    static void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        base = "http://127.0.0.1:" + server.getAddress().getPort();
        server.createContext("/api/reports", exchange ->
                reply(exchange, 200, "application/json; charset=utf-8", "[{\"key\":\"2025-01-01\",\"avg\":1}]"));
        server.createContext("/limited", exchange -> reply(exchange, 429, "text/plain", "slow down"));
        server.createContext("/echo", exchange -> {
            byte[] in = exchange.getRequestBody().readAllBytes();
            reply(exchange, 200, "text/plain", exchange.getRequestMethod() + ":" + new String(in, StandardCharsets.UTF_8));
        });
        server.createContext("/slow", exchange -> {
            slowStarted.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            try {
                reply(exchange, 200, "text/plain", "late");
            } catch (IOException ignore) {
                // client went away
            }
        });
        server.setExecutor(Executors.newCachedThreadPool());
        server.start();
    }

    @AfterAll
    static void stop() {
        release.countDown();
        server.stop(0);
    }

    @AfterEach
    void closeTransport() {
        transport.close();
    }

    private static void reply(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void getReturnsBodyAndContentType() throws Exception {
        TransportResponse response = transport.exchange(TransportRequest.get(base + "/api/reports?range=day"))
                .get(5, TimeUnit.SECONDS);

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.contentType()).startsWith("application/json");
        assertThat(response.bodyAsString()).contains("\"avg\":1");
    }

    @Test
    void nonSuccessStatusIsReturnedNotThrown() throws Exception {
        TransportResponse response = transport.exchange(TransportRequest.get(base + "/limited"))
                .get(5, TimeUnit.SECONDS);

        assertThat(response.status()).isEqualTo(429);
        assertThat(response.isSuccessful()).isFalse();
    }

    @Test
    void postBodyIsSent() throws Exception {
        TransportRequest request = new TransportRequest(
                "POST",
                URI.create(base + "/echo"),
                Map.of("Content-Type", "application/json"),
                "{\"sensor_id\":3,\"lux\":120}".getBytes(StandardCharsets.UTF_8));

        TransportResponse response = transport.exchange(request).get(5, TimeUnit.SECONDS);

        assertThat(response.bodyAsString()).isEqualTo("POST:{\"sensor_id\":3,\"lux\":120}");
    }

    @Test
    void cancellingTheFutureCancelsTheCall() throws Exception {
        CompletableFuture<TransportResponse> future = transport.exchange(TransportRequest.get(base + "/slow"));
        assertThat(slowStarted.await(5, TimeUnit.SECONDS)).isTrue();

        future.cancel(true);
        release.countDown();

        assertThat(future).isCancelled();
    }

    @Test
    void refusedConnectionCompletesWithIoException() throws Exception {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0)) {
            freePort = socket.getLocalPort();
        }

        CompletableFuture<TransportResponse> future =
                transport.exchange(TransportRequest.get("http://127.0.0.1:" + freePort + "/api/series"));

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
