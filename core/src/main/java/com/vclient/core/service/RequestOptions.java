package com.vclient.core.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call extras for {@link BaseService} requests. Every field defaults to absent:
 * no query params, no body, no idempotency key (one may still be generated when
 * auto idempotency keys are enabled).
 */
public final class RequestOptions {
    private static final RequestOptions NONE = builder().build();

    private final Map<String, Object> params;
    private final Object json;
    private final Map<String, Object> form;
    private final String idempotencyKey;

    private RequestOptions(Builder b) {
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(b.params));
        this.json = b.json;
        this.form = (b.form == null) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(b.form));
        this.idempotencyKey = b.idempotencyKey;
    }

    public static RequestOptions none() { return NONE; }
    public static RequestOptions json(Object body) { return builder().json(body).build(); }
    public static RequestOptions params(Map<String, ?> params) { return builder().params(params).build(); }

    public Map<String, Object> getParams() { return params; }
    public Object getJson() { return json; }
    public Map<String, Object> getForm() { return form; }
    public String getIdempotencyKey() { return idempotencyKey; }

    /** Copy with {@code key} as idempotency key. */
    public RequestOptions withIdempotencyKey(String key) {
        return toBuilder().idempotencyKey(key).build();
    }

    public Builder toBuilder() {
        Builder b = builder().params(params).json(json).idempotencyKey(idempotencyKey);
        if (form != null) b.form(form);
        return b;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private final Map<String, Object> params = new LinkedHashMap<>();
        private Object json;
        private Map<String, Object> form;
        private String idempotencyKey;

        /** Null values are dropped. */
        public Builder param(String name, Object value) {
            if (value != null) params.put(name, value);
            return this;
        }
        public Builder params(Map<String, ?> ps) {
            if (ps != null) ps.forEach(this::param);
            return this;
        }
        public Builder json(Object body) { this.json = body; return this; }
        public Builder form(Map<String, ?> f) {
            this.form = (f == null) ? null : new LinkedHashMap<>(f);
            return this;
        }
        public Builder idempotencyKey(String key) { this.idempotencyKey = key; return this; }

        public RequestOptions build() {
            if (json != null && form != null) throw new IllegalArgumentException("json and form bodies are mutually exclusive");
            return new RequestOptions(this);
        }
    }
}
