package com.vclient.core.error;

import java.util.List;
import java.util.Map;

/**
 * A request body failed client-side validation. Raised before any network I/O, so there is no
 * status. Compare {@link ValidationException}, which is the server's 400.
 */
public class RequestValidationException extends ApiException {
    private final List<String> errors;

    public RequestValidationException(List<String> errors, Throwable cause) {
        super("Request validation failed: " + String.join("; ", errors), NO_STATUS, "", Map.of(), cause);
        this.errors = List.copyOf(errors);
    }

    /** One entry per violated constraint, formatted {@code field: problem}. */
    public List<String> getErrors() { return errors; }
}
