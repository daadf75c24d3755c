package com.vclient.core.http;

import com.vclient.core.model.ApiResponse;

import java.util.OptionalInt;

/**
 * Reads the {@code RateLimit} response header, format {@code "policy";r=REMAINING;t=SECONDS},
 * optionally several policies separated by commas. The first policy carrying a key wins.
 * Never throws: anything unparseable reads as absent.
 */
public final class RateLimitHeaders {
    public static final String RATE_LIMIT = "RateLimit";
    public static final String RETRY_AFTER = "Retry-After";

    private RateLimitHeaders() {}

    /** Integer value of {@code ;key=} in {@code header}. */
    public static OptionalInt extract(String header, String key) {
        if (header == null || key == null || key.isEmpty()) return OptionalInt.empty();
        String pattern = ";" + key + "=";
        int at = header.indexOf(pattern);
        if (at < 0) return OptionalInt.empty();

        String rest = header.substring(at + pattern.length());
        int end = rest.length();
        int semi = rest.indexOf(';');
        int comma = rest.indexOf(',');
        if (semi >= 0) end = Math.min(end, semi);
        if (comma >= 0) end = Math.min(end, comma);
        return parseInt(rest.substring(0, end));
    }

    /** {@code t} of the RateLimit header, else integer {@code Retry-After}, else empty. */
    public static OptionalInt retryAfterSeconds(ApiResponse response) {
        String rateLimit = response.header(RATE_LIMIT);
        if (rateLimit != null && !rateLimit.isEmpty()) {
            OptionalInt t = extract(rateLimit, "t");
            if (t.isPresent()) return t;
        }
        // HTTP-date form of Retry-After is not supported
        return parseInt(response.header(RETRY_AFTER));
    }

    /** {@code r} of the RateLimit header. No fallback. */
    public static OptionalInt remaining(ApiResponse response) {
        String rateLimit = response.header(RATE_LIMIT);
        if (rateLimit == null || rateLimit.isEmpty()) return OptionalInt.empty();
        return extract(rateLimit, "r");
    }

    private static OptionalInt parseInt(String s) {
        if (s == null) return OptionalInt.empty();
        try {
            return OptionalInt.of(Integer.parseInt(s.trim()));
        } catch (NumberFormatException ignore) {
            return OptionalInt.empty();
        }
    }
}
