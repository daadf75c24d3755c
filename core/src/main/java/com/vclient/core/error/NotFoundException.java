package com.vclient.core.error;

import java.util.Map;

/** 404 Not Found. */
public class NotFoundException extends ApiException {
    public NotFoundException(String message, int statusCode, String body, Map<String, Object> responseData) {
        super(message, statusCode, body, responseData);
    }
}
