package com.vclient.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Raw HTTP outcome as returned by a transport (body kept as text). */
public final class ApiResponse {
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final long elapsedMs;

    private ApiResponse(Builder b) {
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? "" : b.body;
        this.elapsedMs = b.elapsedMs;
    }

    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public long getElapsedMs() { return elapsedMs; }

    /** 2xx */
    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /** First header value (case-insensitive name). null when absent. */
    public String header(String name) {
        List<String> vs = headers(name);
        return vs.isEmpty() ? null : vs.get(0);
    }

    /** All header values (case-insensitive name). Empty list when absent. */
    public List<String> headers(String name) {
        if (name == null) return List.of();
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                return (e.getValue() != null) ? e.getValue() : List.of();
            }
        }
        return List.of();
    }

    @Override
    public String toString() {
        return "ApiResponse{status=" + statusCode + ", bodyLength=" + body.length() + ", elapsedMs=" + elapsedMs + '}';
    }

    // ----- builder -----
    public static Builder builder() { return new Builder(); }

    /** Shorthand for tests and fakes. */
    public static ApiResponse of(int statusCode, Map<String, List<String>> headers, String body) {
        return builder().statusCode(statusCode).headers(headers).body(body).build();
    }

    public static final class Builder {
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private long elapsedMs;

        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder elapsedMs(long elapsedMs) { this.elapsedMs = elapsedMs; return this; }

        public ApiResponse build() {
            if (statusCode < 100 || statusCode > 999) {
                throw new IllegalArgumentException("statusCode out of range: " + statusCode);
            }
            return new ApiResponse(this);
        }
    }
}
