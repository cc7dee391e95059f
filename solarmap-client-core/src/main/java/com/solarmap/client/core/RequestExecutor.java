package com.solarmap.client.core;

import com.solarmap.client.api.CancellationToken;
import com.solarmap.client.api.ScheduledTask;
import com.solarmap.client.api.TaskScheduler;
import com.solarmap.client.api.error.DataFetchException;
import com.solarmap.client.api.error.FetchCancelledException;
import com.solarmap.client.api.error.FetchTimeoutException;
import com.solarmap.client.api.error.HttpStatusException;
import com.solarmap.client.api.error.NetworkException;
import com.solarmap.client.core.cache.ResponseCache;
import com.solarmap.client.transport.HttpTransport;
import com.solarmap.client.transport.TransportRequest;
import com.solarmap.client.transport.TransportResponse;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues one logical request with per-attempt timeout, bounded retry with linear backoff,
 * response caching and cooperative cancellation.
 *
 * <p>Each call runs as a small state machine ({@link CallState}). Attempts are strictly
 * sequential; the response, the attempt timer and the cancellation signal may race, and the first
 * of them to arrive settles the attempt. Timers and cancellation listeners are released on every
 * exit path.
 *
 * <p>Only terminal, classified errors reach the caller: {@link FetchTimeoutException},
 * {@link HttpStatusException}, {@link NetworkException} and {@link FetchCancelledException}.
 */
public final class RequestExecutor {
    private static final Logger log = LoggerFactory.getLogger(RequestExecutor.class);

    private final HttpTransport transport;
    private final ResponseCache cache;
    private final TaskScheduler scheduler;
    private final ResponseDecoder decoder;

    public RequestExecutor(HttpTransport transport, ResponseCache cache, TaskScheduler scheduler) {
        this(transport, cache, scheduler, new ResponseDecoder());
    }

    public RequestExecutor(
            HttpTransport transport, ResponseCache cache, TaskScheduler scheduler, ResponseDecoder decoder) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    public CompletableFuture<ResponsePayload> execute(String url) {
        return execute(url, RequestConfig.defaults());
    }

    /**
     * Starts the call. The future completes with the decoded body or exceptionally with a
     * {@link DataFetchException}. Cancelling the future cancels the call.
     */
    public CompletableFuture<ResponsePayload> execute(String url, RequestConfig config) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(config, "config");
        Call call = new Call(url, config);
        call.start();
        return call.result;
    }

    /** Blocking variant of {@link #execute(String, RequestConfig)}. */
    public ResponsePayload fetch(String url, RequestConfig config) {
        CompletableFuture<ResponsePayload> future = execute(url, config);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new FetchCancelledException("Interrupted while waiting for " + url);
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    public ResponsePayload fetch(String url) {
        return fetch(url, RequestConfig.defaults());
    }

    /** Maps a future's failure back to the classified exception it carries. */
    public static DataFetchException unwrap(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof DataFetchException) return (DataFetchException) cause;
        if (cause instanceof CancellationException) return new FetchCancelledException();
        return new DataFetchException("Request failed: " + cause.getMessage(), cause);
    }

    private final class Call {
        private final String url;
        private final RequestConfig config;
        private final CancellationToken token;
        private final boolean cacheable;
        private final String cacheKey;
        private final int maxAttempts;
        private final CompletableFuture<ResponsePayload> result = new CompletableFuture<>();

        private CallState state = CallState.PENDING;
        private int attemptNumber;
        private Attempt current;
        private ScheduledTask backoffTask;
        private CancellationToken.Registration backoffCancellation = CancellationToken.Registration.NOOP;

        Call(String url, RequestConfig config) {
            this.url = url;
            this.config = config;
            this.token = config.cancellationToken();
            this.cacheable = config.isCacheable();
            this.cacheKey = config.resolveCacheKey(url);
            this.maxAttempts = config.maxAttempts();
        }

        synchronized void start() {
            result.whenComplete((payload, error) -> {
                if (result.isCancelled()) onCancelled();
            });
            if (cacheable) {
                Optional<ResponsePayload> cached = cache.lookup(cacheKey);
                if (cached.isPresent()) {
                    log.debug("Cache hit for {}", cacheKey);
                    succeed(cached.get(), false);
                    return;
                }
            }
            startAttempt();
        }

        private void startAttempt() {
            attemptNumber++;
            if (token.isCancellationRequested()) {
                cancelled();
                return;
            }
            state = CallState.PENDING;
            Attempt attempt = new Attempt(attemptNumber);
            current = attempt;
            attempt.cancellation = token.onCancel(this::onCancelled);
            if (state.isTerminal()) return;
            attempt.timer = scheduler.schedule(() -> onTimeout(attempt), config.timeout());

            if (log.isDebugEnabled()) {
                log.debug("{} {} attempt {}/{}", config.method(), url, attempt.number, maxAttempts);
            }
            try {
                attempt.exchange = transport.exchange(new TransportRequest(
                        config.method(), URI.create(url), config.headers(), config.body()));
            } catch (RuntimeException e) {
                onExchangeComplete(attempt, null, e);
                return;
            }
            attempt.exchange.whenComplete((response, error) -> onExchangeComplete(attempt, response, error));
        }

        private synchronized void onExchangeComplete(Attempt attempt, TransportResponse response, Throwable error) {
            if (attempt != current || attempt.settled || state.isTerminal()) return;
            attempt.settle();
            if (token.isCancellationRequested()) {
                cancelled();
                return;
            }
            if (error != null) {
                Throwable cause = rootCause(error);
                if (cause instanceof IOException) {
                    retryOrFail(new NetworkException((IOException) cause));
                } else {
                    fail(new DataFetchException("Request to " + url + " failed: " + cause.getMessage(), cause));
                }
                return;
            }
            if (response.isSuccessful()) {
                ResponsePayload payload;
                try {
                    payload = decoder.decode(response);
                } catch (IOException e) {
                    fail(new DataFetchException("Could not decode response from " + url, e));
                    return;
                }
                succeed(payload, cacheable);
                return;
            }
            HttpStatusException httpError = new HttpStatusException(response.status(), response.bodyAsString());
            if (httpError.isRetryable()) {
                retryOrFail(httpError);
            } else {
                fail(httpError);
            }
        }

        private synchronized void onTimeout(Attempt attempt) {
            if (attempt != current || attempt.settled || state.isTerminal()) return;
            attempt.settle();
            attempt.abort();
            retryOrFail(new FetchTimeoutException(config.timeout()));
        }

        private synchronized void onCancelled() {
            if (state.isTerminal()) return;
            if (current != null && !current.settled) {
                current.settle();
                current.abort();
            }
            cancelled();
        }

        private synchronized void onBackoffElapsed() {
            if (state != CallState.BACKOFF) return;
            releaseBackoff();
            startAttempt();
        }

        private void retryOrFail(DataFetchException error) {
            if (attemptNumber >= maxAttempts) {
                fail(error);
                return;
            }
            Duration delay = config.retryDelay().multipliedBy(attemptNumber);
            log.warn(
                    "{} {} attempt {}/{} failed ({}); retrying in {} ms",
                    config.method(),
                    url,
                    attemptNumber,
                    maxAttempts,
                    error.getMessage(),
                    delay.toMillis());
            state = CallState.BACKOFF;
            backoffCancellation = token.onCancel(this::onCancelled);
            if (state.isTerminal()) return;
            backoffTask = scheduler.schedule(this::onBackoffElapsed, delay);
        }

        private void succeed(ResponsePayload payload, boolean store) {
            state = CallState.SUCCEEDED;
            releaseBackoff();
            if (store) {
                cache.store(cacheKey, payload, config.cacheTtl());
            }
            result.complete(payload);
        }

        private void fail(DataFetchException error) {
            state = CallState.FAILED;
            releaseBackoff();
            log.warn("{} {} failed after {} attempt(s): {}", config.method(), url, attemptNumber, error.getMessage());
            result.completeExceptionally(error);
        }

        private void cancelled() {
            state = CallState.CANCELLED;
            releaseBackoff();
            log.debug("{} {} cancelled", config.method(), url);
            result.completeExceptionally(new FetchCancelledException());
        }

        private void releaseBackoff() {
            if (backoffTask != null) {
                backoffTask.cancel();
                backoffTask = null;
            }
            backoffCancellation.close();
            backoffCancellation = CancellationToken.Registration.NOOP;
        }
    }

    /** Transient per-attempt state. */
    private static final class Attempt {
        private final int number;
        private CompletableFuture<TransportResponse> exchange;
        private ScheduledTask timer;
        private CancellationToken.Registration cancellation = CancellationToken.Registration.NOOP;
        private boolean settled;

        Attempt(int number) {
            this.number = number;
        }

        void settle() {
            settled = true;
            if (timer != null) timer.cancel();
            cancellation.close();
        }

        void abort() {
            if (exchange != null) exchange.cancel(true);
        }
    }

    private static Throwable rootCause(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
