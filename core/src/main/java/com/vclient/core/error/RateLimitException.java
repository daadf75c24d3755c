package com.vclient.core.error;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * 429 Too Many Requests. Both hints come from response headers only:
 * {@code retryAfter} from the {@code RateLimit} header's {@code t} (or {@code Retry-After}),
 * {@code remaining} from its {@code r}.
 */
public class RateLimitException extends ApiException {
    private final Integer retryAfter;
    private final Integer remaining;

    public RateLimitException(String message, int statusCode, String body, Map<String, Object> responseData,
                              OptionalInt retryAfter, OptionalInt remaining) {
        super(message, statusCode, body, responseData);
        this.retryAfter = retryAfter.isPresent() ? retryAfter.getAsInt() : null;
        this.remaining = remaining.isPresent() ? remaining.getAsInt() : null;
    }

    /** Seconds the server asked us to wait. */
    public OptionalInt getRetryAfter() {
        return retryAfter == null ? OptionalInt.empty() : OptionalInt.of(retryAfter);
    }

    /** Tokens left in the bucket when the limit was hit. */
    public OptionalInt getRemaining() {
        return remaining == null ? OptionalInt.empty() : OptionalInt.of(remaining);
    }

    @Override
    protected String describeExtras() {
        List<String> extras = new ArrayList<>(2);
        if (retryAfter != null) extras.add("retry_after=" + retryAfter + "s");
        if (remaining != null) extras.add("remaining=" + remaining);
        return extras.isEmpty() ? null : String.join(", ", extras);
    }
}
