package com.vclient.core.error;

import java.util.Map;

/** 403 Forbidden: the API key is valid but lacks permission for the action. */
public class AuthorizationException extends ApiException {
    public AuthorizationException(String message, int statusCode, String body, Map<String, Object> responseData) {
        super(message, statusCode, body, responseData);
    }
}
