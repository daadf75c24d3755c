package com.vclient.core.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One fully-formed HTTP call before sending: verb, path relative to the base URL, query, body
 * and per-call headers. Immutable; at most one of {@code jsonBody}, {@code formBody},
 * {@code file} is set.
 */
public final class ApiRequest {
    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final HttpVerb verb;
    private final String path;
    private final Map<String, String> query;
    private final Object jsonBody;
    private final Map<String, String> formBody;
    private final Map<String, String> headers;
    private final FilePayload file;

    private ApiRequest(Builder b) {
        this.verb = b.verb;
        this.path = b.path;
        this.query = Collections.unmodifiableMap(new LinkedHashMap<>(b.query));
        this.jsonBody = b.jsonBody;
        this.formBody = (b.formBody == null) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(b.formBody));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.file = b.file;
    }

    public HttpVerb getVerb() { return verb; }
    public String getPath() { return path; }
    /** Query parameters in insertion order, values already stringified. */
    public Map<String, String> getQuery() { return query; }
    public Object getJsonBody() { return jsonBody; }
    public Map<String, String> getFormBody() { return formBody; }
    public Map<String, String> getHeaders() { return headers; }
    public FilePayload getFile() { return file; }

    /** Per-call header present (case-insensitive name). */
    public boolean hasHeader(String name) {
        return header(name) != null;
    }

    /** Per-call header value (case-insensitive name), null when absent. */
    public String header(String name) {
        for (var e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    @Override
    public String toString() {
        return verb + " " + path + (query.isEmpty() ? "" : " " + query);
    }

    // ----- builder -----
    public static Builder builder(HttpVerb verb, String path) { return new Builder(verb, path); }

    public static final class Builder {
        private final HttpVerb verb;
        private final String path;
        private final Map<String, String> query = new LinkedHashMap<>();
        private Object jsonBody;
        private Map<String, String> formBody;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private FilePayload file;

        private Builder(HttpVerb verb, String path) {
            this.verb = Objects.requireNonNull(verb, "verb");
            this.path = Objects.requireNonNull(path, "path");
        }

        /** Null values are skipped. */
        public Builder query(String name, Object value) {
            if (value != null) query.put(name, String.valueOf(value));
            return this;
        }
        public Builder query(Map<String, ?> params) {
            if (params != null) params.forEach(this::query);
            return this;
        }
        public Builder json(Object body) { this.jsonBody = body; return this; }
        public Builder form(Map<String, ?> form) {
            if (form == null) { this.formBody = null; return this; }
            Map<String, String> m = new LinkedHashMap<>();
            form.forEach((k, v) -> { if (v != null) m.put(k, String.valueOf(v)); });
            this.formBody = m;
            return this;
        }
        public Builder header(String name, String value) {
            if (value != null) headers.put(name, value);
            return this;
        }
        public Builder headers(Map<String, String> hs) {
            if (hs != null) hs.forEach(this::header);
            return this;
        }
        public Builder file(FilePayload file) { this.file = file; return this; }

        public ApiRequest build() {
            int bodies = (jsonBody != null ? 1 : 0) + (formBody != null ? 1 : 0) + (file != null ? 1 : 0);
            if (bodies > 1) throw new IllegalArgumentException("json, form and file bodies are mutually exclusive");
            return new ApiRequest(this);
        }
    }
}
