package com.vclient.core.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionTest {

    @Test
    void header_falls_back_to_message_without_title() {
        var e = new ServerException("database down", 503, "database down", Map.of());
        assertThat(e.toString()).isEqualTo("[503] database down");
    }

    @Test
    void detail_is_shown_when_it_differs() {
        var e = new ApiException("custom message", 418, "", Map.of("title", "Teapot", "detail", "short and stout"));
        assertThat(e.toString()).isEqualTo("[418] Teapot | Detail: short and stout");
    }

    @Test
    void faults_without_status_print_the_message_only() {
        var e = new NetworkException("GET /x failed: refused", new ConnectException("refused"));
        assertThat(e.hasStatus()).isFalse();
        assertThat(e.toString()).isEqualTo("GET /x failed: refused");
    }

    @Test
    void empty_fault_has_a_placeholder() {
        var e = new ApiException(null, ApiException.NO_STATUS, null, null);
        assertThat(e.toString()).isEqualTo("Unknown API error");
        assertThat(e.getBody()).isEmpty();
        assertThat(e.getResponseData()).isEmpty();
    }

    @Test
    void invalid_parameters_default_missing_parts() {
        var e = new ValidationException("bad", 400, "", Map.of("invalid_parameters",
                List.of(Map.of("field", "email"), Map.of("message", "nope"), "junk")));

        assertThat(e.getInvalidParameters()).hasSize(2);
        assertThat(e.toString()).endsWith("| Fields: email: invalid; unknown: nope");
    }

    @Test
    void request_validation_has_no_status() {
        var e = new RequestValidationException(List.of("name: field required", "danger: must be between 0 and 5"), null);

        assertThat(e.getStatusCode()).isEqualTo(ApiException.NO_STATUS);
        assertThat(e.getErrors()).hasSize(2);
        assertThat(e.getMessage()).isEqualTo("Request validation failed: name: field required; danger: must be between 0 and 5");
    }

    @Test
    void only_connect_and_timeout_are_retryable_network_faults() {
        assertThat(NetworkFaults.isRetryable(new ConnectException())).isTrue();
        assertThat(NetworkFaults.isRetryable(new HttpTimeoutException("t"))).isTrue();
        assertThat(NetworkFaults.isRetryable(new IOException("reset"))).isFalse();
        assertThat(NetworkFaults.isRetryable(null)).isFalse();
    }
}
