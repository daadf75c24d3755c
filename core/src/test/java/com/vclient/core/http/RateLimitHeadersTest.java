package com.vclient.core.http;

import com.vclient.core.model.ApiResponse;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitHeadersTest {

    @Test
    void extracts_remaining_and_reset() {
        String h = "\"default\";r=42;t=7";
        assertThat(RateLimitHeaders.extract(h, "r")).hasValue(42);
        assertThat(RateLimitHeaders.extract(h, "t")).hasValue(7);
    }

    @Test
    void first_policy_with_the_key_wins() {
        String h = "\"burst\";r=0;t=3, \"daily\";r=900;t=3600";
        assertThat(RateLimitHeaders.extract(h, "r")).hasValue(0);
        assertThat(RateLimitHeaders.extract(h, "t")).hasValue(3);
    }

    @Test
    void missing_or_malformed_values_read_as_absent() {
        assertThat(RateLimitHeaders.extract(null, "r")).isEmpty();
        assertThat(RateLimitHeaders.extract("", "r")).isEmpty();
        assertThat(RateLimitHeaders.extract("\"default\";t=5", "r")).isEmpty();
        assertThat(RateLimitHeaders.extract("\"default\";r=abc;t=5", "r")).isEmpty();
        assertThat(RateLimitHeaders.extract("\"default\";r=;t=5", "r")).isEmpty();
        assertThat(RateLimitHeaders.extract(";;;==,,", "t")).isEmpty();
        assertThat(RateLimitHeaders.extract("\"default\";r=1", "")).isEmpty();
    }

    @Test
    void retry_after_prefers_rate_limit_header() {
        var resp = ApiResponse.of(429, Map.of(
                "RateLimit", List.of("\"default\";r=0;t=12"),
                "Retry-After", List.of("30")), "");
        assertThat(RateLimitHeaders.retryAfterSeconds(resp)).hasValue(12);
    }

    @Test
    void retry_after_falls_back_to_retry_after_header() {
        var resp = ApiResponse.of(429, Map.of("retry-after", List.of(" 30 ")), "");
        assertThat(RateLimitHeaders.retryAfterSeconds(resp)).hasValue(30);
    }

    @Test
    void http_date_retry_after_is_ignored() {
        var resp = ApiResponse.of(429, Map.of("Retry-After", List.of("Wed, 21 Oct 2015 07:28:00 GMT")), "");
        assertThat(RateLimitHeaders.retryAfterSeconds(resp)).isEqualTo(OptionalInt.empty());
    }

    @Test
    void remaining_has_no_fallback() {
        var none = ApiResponse.of(429, Map.of("Retry-After", List.of("5")), "");
        assertThat(RateLimitHeaders.remaining(none)).isEmpty();

        var some = ApiResponse.of(429, Map.of("ratelimit", List.of("\"default\";r=3;t=1")), "");
        assertThat(RateLimitHeaders.remaining(some)).hasValue(3);
    }
}
