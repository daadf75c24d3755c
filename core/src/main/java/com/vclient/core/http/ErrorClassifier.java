package com.vclient.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vclient.core.error.ApiException;
import com.vclient.core.error.AuthenticationException;
import com.vclient.core.error.AuthorizationException;
import com.vclient.core.error.ConflictException;
import com.vclient.core.error.NotFoundException;
import com.vclient.core.error.RateLimitException;
import com.vclient.core.error.ServerException;
import com.vclient.core.error.ValidationException;
import com.vclient.core.model.ApiResponse;
import com.vclient.core.util.StructuredLog;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps a non-2xx response to its fault type:
 * 400 validation, 401 authentication, 403 authorization, 404 not found, 409 conflict,
 * 429 rate limit, 500..upperBound server error, anything else {@link ApiException}.
 * The verb plays no part; the request is used for log context only.
 */
public final class ErrorClassifier {
    private static final StructuredLog SLOG = StructuredLog.get(ErrorClassifier.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final int serverErrorUpperBound;

    public ErrorClassifier(ObjectMapper mapper, int serverErrorUpperBound) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.serverErrorUpperBound = serverErrorUpperBound;
    }

    /** Empty for 2xx, otherwise the fault to raise. */
    public Optional<ApiException> classify(ApiRequest request, ApiResponse response) {
        if (response.isSuccess()) return Optional.empty();

        int status = response.getStatusCode();
        String body = response.getBody();
        Map<String, Object> data = parseObject(body);
        String message = resolveMessage(status, body, data);
        StructuredLog elog = SLOG.bind("method", request.getVerb().name(), "path", request.getPath(), "status", status);

        switch (status) {
            case 400:
                elog.warn("validation-rejected");
                return Optional.of(new ValidationException(message, status, body, data));
            case 401:
                elog.error("authentication-failed", null);
                return Optional.of(new AuthenticationException(message, status, body, data));
            case 403:
                elog.error("authorization-denied", null);
                return Optional.of(new AuthorizationException(message, status, body, data));
            case 404:
                elog.debug("not-found");
                return Optional.of(new NotFoundException(message, status, body, data));
            case 409:
                elog.warn("conflict");
                return Optional.of(new ConflictException(message, status, body, data));
            case 429:
                return Optional.of(new RateLimitException(message, status, body, data,
                        RateLimitHeaders.retryAfterSeconds(response),
                        RateLimitHeaders.remaining(response)));
            default:
                if (status >= 500 && status < serverErrorUpperBound) {
                    return Optional.of(new ServerException(message, status, body, data));
                }
                return Optional.of(new ApiException(message, status, body, data));
        }
    }

    // detail field → raw text → "HTTP {status}"
    private static String resolveMessage(int status, String body, Map<String, Object> data) {
        Object detail = data.get("detail");
        if (detail != null) return String.valueOf(detail);
        if (body != null && !body.isEmpty()) return body;
        return "HTTP " + status;
    }

    private Map<String, Object> parseObject(String body) {
        if (body == null || body.isBlank()) return Map.of();
        String trimmed = body.trim();
        if (!trimmed.startsWith("{")) return Map.of();
        try {
            Map<String, Object> m = mapper.readValue(trimmed, MAP_TYPE);
            return m == null ? Map.of() : m;
        } catch (JsonProcessingException e) {
            return Map.of();
        }
    }
}
