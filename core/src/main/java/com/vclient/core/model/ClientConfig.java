package com.vclient.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Client settings (vclient.yml mapping target). Built once through {@link Builder}; every field
 * is read-only afterwards so one config can back any number of concurrent calls.
 */
public final class ClientConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
    public static final Set<Integer> DEFAULT_RETRY_STATUSES = Set.of(500, 502, 503, 504);
    public static final int DEFAULT_SERVER_ERROR_UPPER_BOUND = 600;

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration retryDelay;
    private final boolean autoRetryRateLimit;
    private final boolean autoIdempotencyKeys;
    private final Set<Integer> retryStatuses;
    private final int serverErrorUpperBound;
    private final String defaultCompanyId;
    private final Map<String, String> headers;

    private ClientConfig(Builder b) {
        this.baseUrl = stripTrailingSlash(b.baseUrl);
        this.apiKey = b.apiKey;
        this.timeout = b.timeout;
        this.maxRetries = b.maxRetries;
        this.retryDelay = b.retryDelay;
        this.autoRetryRateLimit = b.autoRetryRateLimit;
        this.autoIdempotencyKeys = b.autoIdempotencyKeys;
        this.retryStatuses = Collections.unmodifiableSet(new TreeSet<>(b.retryStatuses));
        this.serverErrorUpperBound = b.serverErrorUpperBound;
        this.defaultCompanyId = b.defaultCompanyId;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
    }

    // ---------- getters ----------
    public String getBaseUrl() { return baseUrl; }
    public String getApiKey() { return apiKey; }
    public Duration getTimeout() { return timeout; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getRetryDelay() { return retryDelay; }
    public boolean isAutoRetryRateLimit() { return autoRetryRateLimit; }
    public boolean isAutoIdempotencyKeys() { return autoIdempotencyKeys; }
    public Set<Integer> getRetryStatuses() { return retryStatuses; }
    public int getServerErrorUpperBound() { return serverErrorUpperBound; }
    public String getDefaultCompanyId() { return defaultCompanyId; }
    /** Extra headers sent with every request. */
    public Map<String, String> getHeaders() { return headers; }

    /** Attempts per call: retries only apply when rate-limit auto retry is on. */
    public int maxAttempts() {
        return autoRetryRateLimit ? maxRetries + 1 : 1;
    }

    /** Builder pre-filled with this config's values. */
    public Builder toBuilder() {
        return builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .timeout(timeout)
                .maxRetries(maxRetries)
                .retryDelay(retryDelay)
                .autoRetryRateLimit(autoRetryRateLimit)
                .autoIdempotencyKeys(autoIdempotencyKeys)
                .retryStatuses(retryStatuses)
                .serverErrorUpperBound(serverErrorUpperBound)
                .defaultCompanyId(defaultCompanyId)
                .headers(headers);
    }

    @Override
    public String toString() {
        // apiKey is never printed
        return "ClientConfig{baseUrl=" + baseUrl
                + ", timeout=" + timeout
                + ", maxRetries=" + maxRetries
                + ", retryDelay=" + retryDelay
                + ", autoRetryRateLimit=" + autoRetryRateLimit
                + ", autoIdempotencyKeys=" + autoIdempotencyKeys
                + ", retryStatuses=" + retryStatuses
                + ", defaultCompanyId=" + defaultCompanyId + '}';
    }

    private static String stripTrailingSlash(String url) {
        String s = url;
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        return s;
    }

    // ----- builder -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String baseUrl;
        private String apiKey;
        private Duration timeout = DEFAULT_TIMEOUT;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private boolean autoRetryRateLimit = true;
        private boolean autoIdempotencyKeys = false;
        private Set<Integer> retryStatuses = DEFAULT_RETRY_STATUSES;
        private int serverErrorUpperBound = DEFAULT_SERVER_ERROR_UPPER_BOUND;
        private String defaultCompanyId;
        private Map<String, String> headers = new LinkedHashMap<>();

        public Builder baseUrl(String baseUrl) { this.baseUrl = baseUrl; return this; }
        public Builder apiKey(String apiKey) { this.apiKey = apiKey; return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Builder timeoutMs(long ms) { this.timeout = Duration.ofMillis(ms); return this; }
        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder retryDelay(Duration retryDelay) { this.retryDelay = retryDelay; return this; }
        public Builder autoRetryRateLimit(boolean v) { this.autoRetryRateLimit = v; return this; }
        public Builder autoIdempotencyKeys(boolean v) { this.autoIdempotencyKeys = v; return this; }
        public Builder retryStatuses(Set<Integer> statuses) {
            this.retryStatuses = (statuses != null ? statuses : Set.of());
            return this;
        }
        public Builder serverErrorUpperBound(int bound) { this.serverErrorUpperBound = bound; return this; }
        public Builder defaultCompanyId(String id) { this.defaultCompanyId = id; return this; }
        public Builder headers(Map<String, String> headers) {
            this.headers = new LinkedHashMap<>(headers != null ? headers : Map.of());
            return this;
        }
        public Builder header(String name, String value) { this.headers.put(name, value); return this; }

        /** @throws IllegalArgumentException when a required value is missing or out of range */
        public ClientConfig build() {
            validate();
            return new ClientConfig(this);
        }

        private void validate() {
            if (baseUrl == null || baseUrl.isBlank()) throw new IllegalArgumentException("baseUrl is required");
            if (apiKey == null || apiKey.isBlank()) throw new IllegalArgumentException("apiKey is required");
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isNegative() || timeout.isZero()) throw new IllegalArgumentException("timeout must be > 0");
            if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
            Objects.requireNonNull(retryDelay, "retryDelay");
            if (retryDelay.isNegative()) throw new IllegalArgumentException("retryDelay must be >= 0");
            if (serverErrorUpperBound <= 500) throw new IllegalArgumentException("serverErrorUpperBound must be > 500");
            for (Integer status : retryStatuses) {
                if (status == null) throw new IllegalArgumentException("retryStatuses must not contain null");
            }
            headers.forEach((name, value) -> {
                if (name == null || name.isBlank()) throw new IllegalArgumentException("header name must not be blank");
                if (value == null) throw new IllegalArgumentException("header " + name + " has no value");
            });
        }
    }
}
