package com.vclient.core.error;

import java.util.Map;

/** 409 Conflict. Commonly an idempotency key reused with a different body. */
public class ConflictException extends ApiException {
    public ConflictException(String message, int statusCode, String body, Map<String, Object> responseData) {
        super(message, statusCode, body, responseData);
    }
}
