package com.vclient.core.api;

import com.vclient.core.http.ApiRequest;
import com.vclient.core.model.ApiResponse;

import java.io.IOException;

/**
 * Minimal transport contract: send one request, return whatever status came back.
 * Non-2xx statuses are returned, not thrown. {@link IOException} means no response at all
 * ({@link java.net.ConnectException}, {@link java.net.http.HttpTimeoutException}, ...).
 */
public interface IHttpTransport extends AutoCloseable {
    ApiResponse send(ApiRequest request) throws IOException, InterruptedException;
    @Override default void close() {}
}
