package com.vclient.core.util;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON-line structured logger over java.util.logging.
 * <p>
 * {@link #bind(Object...)} returns a copy carrying extra key/value context, so one request can
 * log every attempt with the same method/path fields:
 * <pre>
 * StructuredLog rlog = SLOG.bind("method", "GET", "path", "/api/v1/health");
 * rlog.debug("request-send");
 * rlog.info("response-received", "status", 200, "elapsedMs", 12);
 * </pre>
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;
    private final List<Object> context;

    private StructuredLog(Logger jul, String comp, List<Object> context) {
        this.jul = jul;
        this.comp = comp;
        this.context = context;
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(Logger.getLogger(cls.getName()), cls.getSimpleName(), List.of());
    }

    /** New logger with {@code kvs} appended to the bound context. The receiver is unchanged. */
    public StructuredLog bind(Object... kvs) {
        if (kvs == null || kvs.length == 0) return this;
        List<Object> merged = new ArrayList<>(context.size() + kvs.length);
        merged.addAll(context);
        merged.addAll(Arrays.asList(kvs));
        return new StructuredLog(jul, comp, Collections.unmodifiableList(merged));
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,    event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,    event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = buildJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String buildJson(Level lvl, String event, Throwable t, Object... kvs) {
        StringBuilder sb = new StringBuilder(160);
        sb.append('{')
          .append(JsonUtil.kv("ts", Instant.now().toString())).append(',')
          .append(JsonUtil.kv("lvl", lvl.getName())).append(',')
          .append(JsonUtil.kv("comp", comp)).append(',')
          .append(JsonUtil.kv("thread", Thread.currentThread().getName())).append(',')
          .append(JsonUtil.kv("event", event));

        appendPairs(sb, context.toArray());
        appendPairs(sb, kvs);

        if (t != null) {
            sb.append(',').append(JsonUtil.kv("error", t.getClass().getSimpleName()))
              .append(',').append(JsonUtil.kv("message", String.valueOf(t.getMessage())));
        }
        sb.append('}');
        return sb.toString();
    }

    // kvs: "key", value, ...
    private static void appendPairs(StringBuilder sb, Object[] kvs) {
        if (kvs == null || kvs.length == 0) return;
        for (int i = 0; i + 1 < kvs.length; i += 2) {
            sb.append(',').append(JsonUtil.kv(String.valueOf(kvs[i]), kvs[i + 1]));
        }
        if (kvs.length % 2 == 1) {
            sb.append(',').append(JsonUtil.kv("_kv_mismatch", true));
        }
    }
}
