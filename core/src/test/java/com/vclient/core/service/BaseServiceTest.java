package com.vclient.core.service;

import com.vclient.core.error.RequestValidationException;
import com.vclient.core.error.ServerException;
import com.vclient.core.http.ApiRequest;
import com.vclient.core.http.HttpVerb;
import com.vclient.core.model.CampaignCreate;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BaseServiceTest extends ServiceTestSupport {

    @Test
    void build_params_drops_nulls_and_keeps_order() {
        Map<String, Object> p = BaseService.buildParams("a", 1, "b", null, "c", "x");
        assertThat(p).containsExactly(Map.entry("a", 1), Map.entry("c", "x"));
    }

    @Test
    void build_params_needs_pairs() {
        assertThatThrownBy(() -> BaseService.buildParams("a")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void generated_keys_are_uuid_v4() {
        UUID key = UUID.fromString(BaseService.generateIdempotencyKey());
        assertThat(key.version()).isEqualTo(4);
    }

    @Test
    void no_key_is_added_by_default() {
        transport.respond(201, "{}");

        client().http().post("/api/v1/things", RequestOptions.json(Map.of("a", 1)));

        assertThat(transport.lastRequest().hasHeader(ApiRequest.IDEMPOTENCY_KEY_HEADER)).isFalse();
    }

    @Test
    void auto_keys_cover_post_put_patch_only() {
        transport.respond(200, "{}");
        ApiService api = client(b -> b.autoIdempotencyKeys(true)).http();

        api.post("/a", RequestOptions.none());
        api.put("/a", RequestOptions.none());
        api.patch("/a", RequestOptions.none());
        api.get("/a");
        api.delete("/a");

        assertThat(transport.requests).extracting(r -> r.hasHeader("Idempotency-Key"))
                .containsExactly(true, true, true, false, false);
    }

    @Test
    void explicit_key_wins_over_auto_key() {
        transport.respond(200, "{}");

        client(b -> b.autoIdempotencyKeys(true)).http()
                .post("/a", RequestOptions.builder().idempotencyKey("mine").build());

        assertThat(transport.lastRequest().header("Idempotency-Key")).isEqualTo("mine");
    }

    @Test
    void auto_key_makes_post_retryable_and_is_reused() {
        transport.respond(503, "").respond(201, "{}");

        client(b -> b.autoIdempotencyKeys(true)).http().post("/a", RequestOptions.none());

        assertThat(transport.calls()).isEqualTo(2);
        String first = transport.requests.get(0).header("Idempotency-Key");
        assertThat(first).isNotBlank();
        assertThat(transport.requests.get(1).header("Idempotency-Key")).isEqualTo(first);
    }

    @Test
    void unkeyed_post_is_not_retried_on_server_error() {
        transport.respond(503, "");

        assertThrows(ServerException.class, () -> client().http().post("/a", RequestOptions.none()));
        assertThat(transport.calls()).isEqualTo(1);
    }

    @Test
    void invalid_body_fails_before_any_request() {
        RequestValidationException e = assertThrows(RequestValidationException.class,
                () -> client().http().post("/a", RequestOptions.json(new CampaignCreate().name("x").danger(9))));

        assertThat(e.getErrors()).containsExactly(
                "name: should have at least 3 characters",
                "danger: must be between 0 and 5");
        assertThat(e.getCause()).isInstanceOf(IllegalArgumentException.class);
        assertThat(transport.calls()).isZero();
    }

    @Test
    void options_carry_query_and_form() {
        transport.respond(200, "{}");

        client().http().put("/a", RequestOptions.builder()
                .param("x", 1).param("skip", null)
                .form(Map.of("note", "hi"))
                .build());

        ApiRequest sent = transport.lastRequest();
        assertThat(sent.getVerb()).isEqualTo(HttpVerb.PUT);
        assertThat(sent.getQuery()).containsExactly(Map.entry("x", "1"));
        assertThat(sent.getFormBody()).containsEntry("note", "hi");
        assertThat(sent.getJsonBody()).isNull();
    }

    @Test
    void json_and_form_together_are_rejected() {
        assertThatThrownBy(() -> RequestOptions.builder().json(Map.of()).form(Map.of()).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
