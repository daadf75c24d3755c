package com.vclient.core.http;

public enum HttpVerb {
    GET(true),
    POST(false),
    PUT(true),
    PATCH(false),
    DELETE(true);

    private final boolean idempotent;

    HttpVerb(boolean idempotent) {
        this.idempotent = idempotent;
    }

    /** Safe to repeat without an idempotency key. */
    public boolean isIdempotent() {
        return idempotent;
    }
}
