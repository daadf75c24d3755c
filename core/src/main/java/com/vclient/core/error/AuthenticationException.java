package com.vclient.core.error;

import java.util.Map;

/** 401 Unauthorized: the API key is missing or invalid. */
public class AuthenticationException extends ApiException {
    public AuthenticationException(String message, int statusCode, String body, Map<String, Object> responseData) {
        super(message, statusCode, body, responseData);
    }
}
