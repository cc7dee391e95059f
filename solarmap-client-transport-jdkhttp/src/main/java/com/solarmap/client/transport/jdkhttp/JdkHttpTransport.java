package com.solarmap.client.transport.jdkhttp;

import com.solarmap.client.transport.HttpTransport;
import com.solarmap.client.transport.TransportRequest;
import com.solarmap.client.transport.TransportResponse;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** JDK11+ HttpClient transport (zero external deps). */
public class JdkHttpTransport implements HttpTransport {
    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final HttpClient client;

    public JdkHttpTransport() {
        this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build());
    }

    public JdkHttpTransport(HttpClient client) {
        this.client = client;
    }

    @Override
    public CompletableFuture<TransportResponse> exchange(TransportRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
                .method(
                        request.method(),
                        request.hasBody()
                                ? HttpRequest.BodyPublishers.ofByteArray(request.body())
                                : HttpRequest.BodyPublishers.noBody());
        request.headers().forEach(builder::header);

        if (log.isDebugEnabled()) {
            log.debug("Sending {} {}", request.method(), request.uri());
        }
        CompletableFuture<HttpResponse<byte[]>> inFlight =
                client.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        CompletableFuture<TransportResponse> result = new CompletableFuture<>();
        inFlight.whenComplete((response, error) -> {
            if (error != null) {
                result.completeExceptionally(asIOException(error));
            } else {
                result.complete(new TransportResponse(
                        response.statusCode(), flatten(response.headers()), response.body()));
            }
        });
        // aborts the underlying exchange when the caller gives up on it
        result.whenComplete((response, error) -> {
            if (result.isCancelled()) inFlight.cancel(true);
        });
        return result;
    }

    private static Map<String, String> flatten(HttpHeaders headers) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : headers.map().entrySet()) {
            if (!e.getValue().isEmpty()) out.put(e.getKey(), e.getValue().get(0));
        }
        return out;
    }

    private static Throwable asIOException(Throwable error) {
        Throwable root = error;
        while ((root instanceof CompletionException || root instanceof ExecutionException) && root.getCause() != null) {
            root = root.getCause();
        }
        if (root instanceof IOException) return root;
        return new IOException(root.getMessage(), root);
    }
}
