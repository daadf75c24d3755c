package com.vclient.core.error;

import java.util.Map;

/** 5xx from the server. Retried when the status is configured as retryable and the verb is safe to repeat. */
public class ServerException extends ApiException {
    public ServerException(String message, int statusCode, String body, Map<String, Object> responseData) {
        super(message, statusCode, body, responseData);
    }
}
