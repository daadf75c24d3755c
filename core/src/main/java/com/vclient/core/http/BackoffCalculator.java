package com.vclient.core.http;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with up to 25% jitter.
 * base = max(configured, serverHint) when the hint is positive, else configured;
 * delay = base * 2^attempt + U[0, 0.25 * base * 2^attempt).
 */
public final class BackoffCalculator {
    static final double JITTER_RATIO = 0.25;

    private final Duration baseDelay;
    private final DoubleSupplier random; // [0, 1)

    public BackoffCalculator(Duration baseDelay) {
        this(baseDelay, () -> ThreadLocalRandom.current().nextDouble());
    }

    public BackoffCalculator(Duration baseDelay, DoubleSupplier random) {
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * @param attempt        0-based index of the attempt that just failed
     * @param serverHintSecs seconds requested by the server; ignored unless positive
     */
    public Duration delay(int attempt, int serverHintSecs) {
        if (attempt < 0) throw new IllegalArgumentException("attempt must be >= 0");
        double base = baseDelay.toNanos() / 1_000_000_000.0;
        if (serverHintSecs > 0) {
            base = Math.max(base, serverHintSecs);
        }
        double delay = base * Math.pow(2, attempt);
        double jitter = random.getAsDouble() * delay * JITTER_RATIO;
        return Duration.ofNanos(Math.round((delay + jitter) * 1_000_000_000.0));
    }

    /** No server hint. */
    public Duration delay(int attempt) {
        return delay(attempt, 0);
    }
}
