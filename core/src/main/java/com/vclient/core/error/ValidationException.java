package com.vclient.core.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 400 Bad Request: the server rejected the payload. {@link #getInvalidParameters()} lists the
 * offending fields from the {@code invalid_parameters} array of the problem body.
 */
public class ValidationException extends ApiException {

    /** One rejected field. */
    public static final class InvalidParameter {
        private final String field;
        private final String message;

        public InvalidParameter(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() { return field; }
        public String getMessage() { return message; }

        @Override public String toString() {
            return (field == null ? "unknown" : field) + ": " + (message == null ? "invalid" : message);
        }
    }

    private final List<InvalidParameter> invalidParameters;

    public ValidationException(String message, int statusCode, String body, Map<String, Object> responseData) {
        super(message, statusCode, body, responseData);
        this.invalidParameters = parse(getResponseData().get("invalid_parameters"));
    }

    public List<InvalidParameter> getInvalidParameters() { return invalidParameters; }

    @Override
    protected String describeExtras() {
        if (invalidParameters.isEmpty()) return null;
        return "Fields: " + invalidParameters.stream().map(InvalidParameter::toString).collect(Collectors.joining("; "));
    }

    private static List<InvalidParameter> parse(Object raw) {
        if (!(raw instanceof List<?> list)) return List.of();
        List<InvalidParameter> out = new ArrayList<>(list.size());
        for (Object o : list) {
            if (o instanceof Map<?, ?> m) {
                Object f = m.get("field");
                Object msg = m.get("message");
                out.add(new InvalidParameter(f == null ? null : String.valueOf(f), msg == null ? null : String.valueOf(msg)));
            }
        }
        return Collections.unmodifiableList(out);
    }
}
