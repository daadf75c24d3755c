package com.vclient.core.http;

import com.vclient.core.api.IHttpTransport;
import com.vclient.core.error.ApiException;
import com.vclient.core.error.NetworkException;
import com.vclient.core.error.NetworkFaults;
import com.vclient.core.error.RateLimitException;
import com.vclient.core.error.ServerException;
import com.vclient.core.model.ApiResponse;
import com.vclient.core.model.ClientConfig;
import com.vclient.core.util.Sleeper;
import com.vclient.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Runs one logical call: send, classify, then retry or raise.
 * <ul>
 *   <li>attempts = {@code maxRetries + 1} when rate-limit auto retry is on, else 1</li>
 *   <li>429: retried for every verb, waiting at least the server's hint</li>
 *   <li>5xx: retried only for statuses in {@code retryStatuses} and when
 *       {@link IdempotencyGuard} allows it</li>
 *   <li>connect/timeout failures: retried when {@link IdempotencyGuard} allows it; other I/O
 *       errors surface at once</li>
 *   <li>any other fault surfaces on first occurrence</li>
 * </ul>
 * Runs on the caller's thread and keeps no state between calls. Interrupting the thread during
 * a send or a backoff wait aborts the call with {@link CancellationException}.
 */
public final class RequestExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(RequestExecutor.class);
    private static final StructuredLog SLOG = StructuredLog.get(RequestExecutor.class);

    private final IHttpTransport transport;
    private final ClientConfig config;
    private final ErrorClassifier classifier;
    private final BackoffCalculator backoff;
    private final Sleeper sleeper;

    public RequestExecutor(IHttpTransport transport, ClientConfig config, ErrorClassifier classifier,
                           BackoffCalculator backoff, Sleeper sleeper) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.config = Objects.requireNonNull(config, "config");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * @return the 2xx response
     * @throws ApiException          the classified fault, after retries where they apply
     * @throws NetworkException      the transport gave no response
     * @throws CancellationException the calling thread was interrupted
     */
    public ApiResponse execute(ApiRequest request) {
        Objects.requireNonNull(request, "request");
        final int maxAttempts = config.maxAttempts();
        final String method = request.getVerb().name();
        StructuredLog rlog = SLOG.bind("method", method, "path", request.getPath());
        rlog.debug("request-send");

        ApiException lastFault = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            final boolean lastAttempt = attempt >= maxAttempts - 1;
            final long start = System.nanoTime();

            ApiResponse response;
            try {
                response = transport.send(request);
            } catch (InterruptedException e) {
                throw cancelled(request, e);
            } catch (IOException e) {
                if (!NetworkFaults.isRetryable(e) || !IdempotencyGuard.canRetry(request) || lastAttempt) {
                    LOG.warn("{} {} failed on attempt {}/{}: {}", method, request.getPath(), attempt + 1, maxAttempts, e.toString());
                    throw new NetworkException(method + " " + request.getPath() + " failed: " + e.getMessage(), e);
                }
                Duration delay = backoff.delay(attempt);
                rlog.warn("retry-network",
                        "errorType", e.getClass().getSimpleName(),
                        "attempt", attempt + 1, "maxAttempts", maxAttempts, "delayMs", delay.toMillis());
                pause(delay, request);
                continue;
            }

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            Optional<ApiException> fault = classifier.classify(request, response);
            if (fault.isEmpty()) {
                rlog.debug("response-received",
                        "status", response.getStatusCode(), "elapsedMs", elapsedMs, "attempt", attempt + 1);
                return response;
            }

            ApiException e = fault.get();
            if (e instanceof RateLimitException rl) {
                lastFault = rl;
                if (lastAttempt) break;
                Duration delay = backoff.delay(attempt, rl.getRetryAfter().orElse(0));
                rlog.warn("retry-rate-limit",
                        "attempt", attempt + 1, "maxAttempts", maxAttempts, "delayMs", delay.toMillis(),
                        "remaining", rl.getRemaining().isPresent() ? rl.getRemaining().getAsInt() : null);
                pause(delay, request);
                continue;
            }
            if (e instanceof ServerException se) {
                if (!config.getRetryStatuses().contains(se.getStatusCode()) || !IdempotencyGuard.canRetry(request)) {
                    throw se;
                }
                lastFault = se;
                if (lastAttempt) break;
                Duration delay = backoff.delay(attempt);
                rlog.warn("retry-server-error",
                        "status", se.getStatusCode(),
                        "attempt", attempt + 1, "maxAttempts", maxAttempts, "delayMs", delay.toMillis());
                pause(delay, request);
                continue;
            }
            throw e;
        }

        if (lastFault != null) {
            rlog.error("retries-exhausted", null, "attempts", maxAttempts, "status", lastFault.getStatusCode());
            LOG.warn("{} {} gave up after {} attempts: {}", method, request.getPath(), maxAttempts, lastFault.toString());
            throw lastFault;
        }
        throw new IllegalStateException("Unexpected state: no response or error");
    }

    private void pause(Duration delay, ApiRequest request) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            throw cancelled(request, e);
        }
    }

    private static CancellationException cancelled(ApiRequest request, InterruptedException cause) {
        Thread.currentThread().interrupt();
        CancellationException ce = new CancellationException(request.getVerb() + " " + request.getPath() + " interrupted");
        ce.initCause(cause);
        return ce;
    }
}
