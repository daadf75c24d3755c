package com.vclient.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.vclient.core.VClient;
import com.vclient.core.http.FilePayload;
import com.vclient.core.model.ApiResponse;
import com.vclient.core.model.Page;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/** Raw access to any endpoint, for paths the typed services do not cover. */
public final class ApiService extends BaseService {

    public ApiService(VClient client) {
        super(client);
    }

    public ApiResponse get(String path, RequestOptions options) { return doGet(path, options); }
    public ApiResponse get(String path) { return doGet(path); }
    public ApiResponse post(String path, RequestOptions options) { return doPost(path, options); }
    public ApiResponse put(String path, RequestOptions options) { return doPut(path, options); }
    public ApiResponse patch(String path, RequestOptions options) { return doPatch(path, options); }
    public ApiResponse delete(String path, RequestOptions options) { return doDelete(path, options); }
    public ApiResponse delete(String path) { return doDelete(path); }

    public ApiResponse postFile(String path, FilePayload file, String idempotencyKey) {
        return doPostFile(path, file, idempotencyKey);
    }

    @Override
    public Page<JsonNode> getPaginated(String path, int limit, int offset, Map<String, ?> params) {
        return super.getPaginated(path, limit, offset, params);
    }

    @Override
    public Iterator<JsonNode> iterateAllPages(String path, int limit, Map<String, ?> params) {
        return super.iterateAllPages(path, limit, params);
    }

    public List<JsonNode> getAll(String path, int limit, Map<String, ?> params) {
        return super.getAll(path, JsonNode.class, limit, params);
    }

    /** Decodes a response body with the client's mapper. */
    public <T> T read(ApiResponse response, Class<T> type) {
        return parse(response, type);
    }
}
