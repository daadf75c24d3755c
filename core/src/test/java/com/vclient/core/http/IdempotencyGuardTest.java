package com.vclient.core.http;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IdempotencyGuardTest {

    @Test
    void idempotent_verbs_always_retry() {
        for (HttpVerb v : new HttpVerb[]{HttpVerb.GET, HttpVerb.PUT, HttpVerb.DELETE}) {
            assertThat(IdempotencyGuard.canRetry(v, Map.of())).as(v.name()).isTrue();
            assertThat(IdempotencyGuard.canRetry(v, null)).as(v.name()).isTrue();
        }
    }

    @Test
    void post_and_patch_need_a_key() {
        assertThat(IdempotencyGuard.canRetry(HttpVerb.POST, Map.of())).isFalse();
        assertThat(IdempotencyGuard.canRetry(HttpVerb.PATCH, null)).isFalse();
        assertThat(IdempotencyGuard.canRetry(HttpVerb.POST, Map.of("X-Other", "1"))).isFalse();

        assertThat(IdempotencyGuard.canRetry(HttpVerb.POST, Map.of("Idempotency-Key", "abc"))).isTrue();
        assertThat(IdempotencyGuard.canRetry(HttpVerb.PATCH, Map.of("idempotency-key", "abc"))).isTrue();
    }

    @Test
    void reads_headers_from_the_request() {
        ApiRequest keyed = ApiRequest.builder(HttpVerb.POST, "/x").header("Idempotency-Key", "k-1").build();
        ApiRequest bare = ApiRequest.builder(HttpVerb.POST, "/x").build();

        assertThat(IdempotencyGuard.canRetry(keyed)).isTrue();
        assertThat(IdempotencyGuard.canRetry(bare)).isFalse();
    }
}
