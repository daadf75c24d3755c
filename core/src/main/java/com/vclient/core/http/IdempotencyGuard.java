package com.vclient.core.http;

import java.util.Map;

/** Decides whether a failed call may be sent again. Depends on the verb and key presence only. */
public final class IdempotencyGuard {
    private IdempotencyGuard() {}

    /** GET/PUT/DELETE always; POST/PATCH only with an {@code Idempotency-Key} header. */
    public static boolean canRetry(HttpVerb verb, Map<String, String> headers) {
        if (verb.isIdempotent()) return true;
        if (headers == null) return false;
        for (String name : headers.keySet()) {
            if (ApiRequest.IDEMPOTENCY_KEY_HEADER.equalsIgnoreCase(name)) return true;
        }
        return false;
    }

    public static boolean canRetry(ApiRequest request) {
        return canRetry(request.getVerb(), request.getHeaders());
    }
}
