package com.vclient.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientConfigTest {

    private static ClientConfig.Builder minimal() {
        return ClientConfig.builder().baseUrl("https://api.test").apiKey("k");
    }

    @Test
    void defaults() {
        ClientConfig c = minimal().build();

        assertThat(c.getTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(c.getMaxRetries()).isEqualTo(3);
        assertThat(c.getRetryDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(c.isAutoRetryRateLimit()).isTrue();
        assertThat(c.isAutoIdempotencyKeys()).isFalse();
        assertThat(c.getRetryStatuses()).containsExactly(500, 502, 503, 504);
        assertThat(c.getServerErrorUpperBound()).isEqualTo(600);
        assertThat(c.getDefaultCompanyId()).isNull();
        assertThat(c.getHeaders()).isEmpty();
        assertThat(c.maxAttempts()).isEqualTo(4);
    }

    @Test
    void null_header_values_and_blank_names_are_rejected() {
        assertThatThrownBy(() -> minimal().header("X-Trace", null).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("X-Trace");
        assertThatThrownBy(() -> minimal().header(" ", "v").build()).isInstanceOf(IllegalArgumentException.class);

        Map<String, String> withNull = new HashMap<>();
        withNull.put("X-A", "1");
        withNull.put("X-B", null);
        assertThatThrownBy(() -> minimal().headers(withNull).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("X-B");
    }

    @Test
    void null_retry_status_is_rejected() {
        Set<Integer> statuses = new HashSet<>(Arrays.asList(503, null));

        assertThatThrownBy(() -> minimal().retryStatuses(statuses).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("retryStatuses");
    }

    @Test
    void trailing_slashes_are_stripped() {
        assertThat(minimal().baseUrl("https://api.test//").build().getBaseUrl()).isEqualTo("https://api.test");
    }

    @Test
    void single_attempt_when_auto_retry_is_off() {
        assertThat(minimal().autoRetryRateLimit(false).maxRetries(5).build().maxAttempts()).isEqualTo(1);
        assertThat(minimal().maxRetries(0).build().maxAttempts()).isEqualTo(1);
    }

    @Test
    void rejects_invalid_values() {
        assertThatThrownBy(() -> ClientConfig.builder().apiKey("k").build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("baseUrl");
        assertThatThrownBy(() -> ClientConfig.builder().baseUrl("https://api.test").apiKey(" ").build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("apiKey");
        assertThatThrownBy(() -> minimal().timeout(Duration.ZERO).build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> minimal().maxRetries(-1).build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> minimal().retryDelay(Duration.ofMillis(-1)).build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> minimal().serverErrorUpperBound(500).build()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void to_builder_round_trips_and_api_key_is_hidden() {
        ClientConfig c = minimal().apiKey("top-secret").retryStatuses(Set.of(503)).header("User-Agent", "x").build();
        ClientConfig copy = c.toBuilder().build();

        assertThat(copy.getApiKey()).isEqualTo("top-secret");
        assertThat(copy.getRetryStatuses()).containsExactly(503);
        assertThat(copy.getHeaders()).containsEntry("User-Agent", "x");
        assertThat(c.toString()).doesNotContain("top-secret");
    }
}
