package com.vclient.core.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.vclient.core.VClient;
import com.vclient.core.error.RequestValidationException;
import com.vclient.core.http.ApiRequest;
import com.vclient.core.http.FilePayload;
import com.vclient.core.http.HttpVerb;
import com.vclient.core.http.PaginationCursor;
import com.vclient.core.model.ApiResponse;
import com.vclient.core.model.Page;
import com.vclient.core.model.RequestChecks;
import com.vclient.core.model.Validatable;

import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Request plumbing shared by every resource service: verbs, idempotency keys, client-side
 * validation, paging and JSON decoding. All calls go through the client's
 * {@link com.vclient.core.http.RequestExecutor}, so retry and fault mapping are uniform.
 */
public abstract class BaseService {
    protected final VClient client;

    protected BaseService(VClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    // ---------- verbs ----------
    protected ApiResponse doGet(String path, RequestOptions options) {
        return send(HttpVerb.GET, path, options);
    }

    protected ApiResponse doGet(String path) {
        return doGet(path, RequestOptions.none());
    }

    protected ApiResponse doPost(String path, RequestOptions options) {
        return send(HttpVerb.POST, path, withAutoKey(options));
    }

    protected ApiResponse doPut(String path, RequestOptions options) {
        return send(HttpVerb.PUT, path, withAutoKey(options));
    }

    protected ApiResponse doPatch(String path, RequestOptions options) {
        return send(HttpVerb.PATCH, path, withAutoKey(options));
    }

    protected ApiResponse doDelete(String path, RequestOptions options) {
        return send(HttpVerb.DELETE, path, options);
    }

    protected ApiResponse doDelete(String path) {
        return doDelete(path, RequestOptions.none());
    }

    /**
     * Multipart upload of one file under the form field {@code file}. Only retried on 429 or
     * when {@code idempotencyKey} is given; no key is generated automatically.
     */
    protected ApiResponse doPostFile(String path, FilePayload file, String idempotencyKey) {
        Objects.requireNonNull(file, "file");
        ApiRequest request = ApiRequest.builder(HttpVerb.POST, path)
                .file(file)
                .header(ApiRequest.IDEMPOTENCY_KEY_HEADER, idempotencyKey)
                .build();
        return client.executor().execute(request);
    }

    // ---------- paging ----------
    protected Page<JsonNode> getPaginated(String path, int limit, int offset, Map<String, ?> params) {
        return client.pagination().fetchPage(path, limit, offset, params);
    }

    protected <T> Page<T> getPaginated(String path, Class<T> type, int limit, int offset, Map<String, ?> params) {
        return client.pagination().fetchPage(path, type, limit, offset, params);
    }

    /** Lazy walk over every item; one page is held at a time. */
    protected Iterator<JsonNode> iterateAllPages(String path, int limit, Map<String, ?> params) {
        return client.pagination().iterateAll(path, limit, params);
    }

    protected <T> Stream<T> streamAll(String path, Class<T> type, int limit, Map<String, ?> params) {
        return client.pagination().stream(path, type, limit, params);
    }

    /** Every item in memory. Unbounded. */
    protected <T> List<T> getAll(String path, Class<T> type, int limit, Map<String, ?> params) {
        return client.pagination().collectAll(path, type, limit, params);
    }

    protected <T> List<T> getAll(String path, Class<T> type, Map<String, ?> params) {
        return getAll(path, type, PaginationCursor.MAX_PAGE_LIMIT, params);
    }

    // ---------- helpers ----------
    /**
     * Runs the body's own checks.
     * @throws RequestValidationException before any network I/O when a check fails
     */
    protected <T extends Validatable> T validateRequest(T body) {
        Objects.requireNonNull(body, "request body");
        try {
            body.validate();
        } catch (IllegalArgumentException e) {
            String msg = (e.getMessage() == null) ? body.getClass().getSimpleName() + ": invalid" : e.getMessage();
            throw new RequestValidationException(Arrays.asList(msg.split(RequestChecks.SEPARATOR)), e);
        }
        return body;
    }

    protected <T> T parse(ApiResponse response, Class<T> type) {
        try {
            return client.mapper().readValue(response.getBody(), type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read " + type.getSimpleName() + " from response: " + e.getOriginalMessage(), e);
        }
    }

    /** Query map from {@code name, value, ...} pairs; null values are dropped. */
    protected static Map<String, Object> buildParams(Object... kvs) {
        if (kvs.length % 2 != 0) throw new IllegalArgumentException("buildParams needs name/value pairs");
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < kvs.length; i += 2) {
            if (kvs[i + 1] != null) out.put(String.valueOf(kvs[i]), kvs[i + 1]);
        }
        return out;
    }

    /** Random UUID v4. */
    protected static String generateIdempotencyKey() {
        return UUID.randomUUID().toString();
    }

    private RequestOptions withAutoKey(RequestOptions options) {
        RequestOptions o = (options == null) ? RequestOptions.none() : options;
        if (o.getIdempotencyKey() == null && client.config().isAutoIdempotencyKeys()) {
            return o.withIdempotencyKey(generateIdempotencyKey());
        }
        return o;
    }

    private ApiResponse send(HttpVerb verb, String path, RequestOptions options) {
        RequestOptions o = (options == null) ? RequestOptions.none() : options;
        if (o.getJson() instanceof Validatable v) validateRequest(v);

        ApiRequest request = ApiRequest.builder(verb, path)
                .query(o.getParams())
                .json(o.getJson())
                .form(o.getForm())
                .header(ApiRequest.IDEMPOTENCY_KEY_HEADER, o.getIdempotencyKey())
                .build();
        return client.executor().execute(request);
    }
}
