package com.solarmap.client.transport.okhttp;

import com.solarmap.client.transport.HttpTransport;
import com.solarmap.client.transport.TransportRequest;
import com.solarmap.client.transport.TransportResponse;
import java.io.IOException;
import java.net.Inet4Address;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Dns;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** OkHttp-based transport. Cancelling the returned future cancels the {@link Call}. */
public class OkHttpTransport implements HttpTransport {
    private static final Logger log = LoggerFactory.getLogger(OkHttpTransport.class);
    private static final Dns PREFER_IPV4_DNS = hostname -> {
        var addresses = new ArrayList<>(Dns.SYSTEM.lookup(hostname));
        addresses.sort((a, b) -> {
            boolean aV4 = a instanceof Inet4Address;
            boolean bV4 = b instanceof Inet4Address;
            if (aV4 == bV4) return 0;
            return aV4 ? -1 : 1;
        });
        return addresses;
    };

    private static final Set<String> METHODS_WITH_BODY = Set.of("POST", "PUT", "PATCH");

    private final OkHttpClient client;

    public OkHttpTransport() {
        this(new OkHttpClient.Builder().dns(PREFER_IPV4_DNS).build());
    }

    public OkHttpTransport(OkHttpClient client) {
        this.client = client;
    }

    @Override
    public CompletableFuture<TransportResponse> exchange(TransportRequest request) {
        Request req = toOkHttp(request);
        log.info("Sending data request {} {}", req.method(), req.url());
        Call call = client.newCall(req);
        CompletableFuture<TransportResponse> result = new CompletableFuture<>();
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call c, IOException e) {
                if (c.isCanceled()) {
                    log.debug("Data request {} {} cancelled", req.method(), req.url());
                } else {
                    log.warn("Data request {} {} failed: {}", req.method(), req.url(), e.getMessage());
                }
                result.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call c, Response r) {
                try (r) {
                    ResponseBody body = r.body();
                    byte[] bytes = body != null ? body.bytes() : new byte[0];
                    if (!r.isSuccessful()) {
                        log.warn(
                                "Data request {} {} answered with status {}",
                                req.method(),
                                req.url(),
                                r.code());
                    } else if (log.isDebugEnabled()) {
                        log.debug(
                                "Data request {} {} succeeded with status {} ({} bytes)",
                                req.method(),
                                req.url(),
                                r.code(),
                                bytes.length);
                    }
                    result.complete(new TransportResponse(r.code(), flatten(r.headers()), bytes));
                } catch (IOException e) {
                    result.completeExceptionally(e);
                }
            }
        });
        result.whenComplete((response, error) -> {
            if (result.isCancelled()) call.cancel();
        });
        return result;
    }

    private static Request toOkHttp(TransportRequest request) {
        Request.Builder builder = new Request.Builder().url(request.uri().toString());
        request.headers().forEach(builder::header);
        RequestBody body = null;
        if (request.hasBody()) {
            String contentType = request.headers().getOrDefault("Content-Type", "application/json");
            body = RequestBody.create(request.body(), MediaType.parse(contentType));
        } else if (METHODS_WITH_BODY.contains(request.method())) {
            body = RequestBody.create(new byte[0], null);
        }
        return builder.method(request.method(), body).build();
    }

    private static Map<String, String> flatten(Headers headers) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String name : headers.names()) {
            out.put(name, headers.get(name));
        }
        return out;
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
