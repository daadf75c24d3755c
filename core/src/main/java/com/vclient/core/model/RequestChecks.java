package com.vclient.core.model;

import java.util.ArrayList;
import java.util.List;

/** Collects field violations for {@link Validatable#validate()} and throws them all at once. */
public final class RequestChecks {
    public static final String SEPARATOR = "; ";

    private final List<String> errors = new ArrayList<>();

    public RequestChecks required(String field, Object value) {
        if (value == null) errors.add(field + ": field required");
        return this;
    }

    /** Length bounds apply only when the value is present; {@code max < 0} means unbounded. */
    public RequestChecks length(String field, String value, int min, int max) {
        if (value == null) return this;
        int n = value.length();
        if (n < min) errors.add(field + ": should have at least " + min + " characters");
        else if (max >= 0 && n > max) errors.add(field + ": should have at most " + max + " characters");
        return this;
    }

    public RequestChecks range(String field, Integer value, int min, int max) {
        if (value == null) return this;
        if (value < min || value > max) errors.add(field + ": must be between " + min + " and " + max);
        return this;
    }

    public RequestChecks oneOf(String field, Object value, List<?> allowed) {
        if (value == null) return this;
        if (!allowed.contains(value)) errors.add(field + ": must be one of " + allowed);
        return this;
    }

    /** @throws IllegalArgumentException listing every violation, {@value #SEPARATOR}-separated */
    public void throwIfAny() {
        if (!errors.isEmpty()) throw new IllegalArgumentException(String.join(SEPARATOR, errors));
    }
}
