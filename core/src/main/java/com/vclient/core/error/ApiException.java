package com.vclient.core.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Base of every fault this client raises, and the catch-all for statuses with no dedicated type.
 * Carries the HTTP status, the raw body and the parsed RFC 9457 problem-details object.
 * {@link #NO_STATUS} marks faults raised without an HTTP response.
 */
public class ApiException extends RuntimeException {
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String body;
    private final Map<String, Object> responseData;

    public ApiException(String message, int statusCode, String body, Map<String, Object> responseData) {
        this(message, statusCode, body, responseData, null);
    }

    protected ApiException(String message, int statusCode, String body, Map<String, Object> responseData, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.body = (body == null) ? "" : body;
        this.responseData = (responseData == null) ? Map.of() : Collections.unmodifiableMap(responseData);
    }

    public int getStatusCode() { return statusCode; }
    public boolean hasStatus() { return statusCode != NO_STATUS; }
    /** Raw response body, empty when there was none. */
    public String getBody() { return body; }
    /** Parsed JSON error object, empty when the body was not a JSON object. */
    public Map<String, Object> getResponseData() { return responseData; }

    /** RFC 9457 {@code title}: short summary of the problem type. */
    public String getTitle() { return stringField("title"); }
    /** RFC 9457 {@code detail}: explanation of this occurrence. */
    public String getDetail() { return stringField("detail"); }
    /** RFC 9457 {@code instance}: URI of this occurrence. */
    public String getInstance() { return stringField("instance"); }

    protected final String stringField(String key) {
        Object v = responseData.get(key);
        return v == null ? null : String.valueOf(v);
    }

    /** {@code [status] title | Detail: ... | Instance: ...} */
    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        String message = getMessage();
        String title = getTitle();
        String detail = getDetail();
        String instance = getInstance();

        if (hasStatus()) {
            String header = "[" + statusCode + "]";
            if (title != null && !title.isEmpty()) header += " " + title;
            else if (message != null && !message.isEmpty()) header += " " + message;
            parts.add(header);
        } else if (message != null && !message.isEmpty()) {
            parts.add(message);
        }
        if (detail != null && !detail.isEmpty() && !detail.equals(message) && !detail.equals(title)) {
            parts.add("Detail: " + detail);
        }
        if (instance != null && !instance.isEmpty()) {
            parts.add("Instance: " + instance);
        }
        String base = parts.isEmpty() ? "Unknown API error" : String.join(" | ", parts);
        String extra = describeExtras();
        return extra == null ? base : base + " | " + extra;
    }

    /** Subclass-specific suffix for {@link #toString()}, or null. */
    protected String describeExtras() {
        return null;
    }
}
