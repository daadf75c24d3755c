package com.vclient.core.util;

import com.vclient.core.model.ClientConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Reads {@code vclient.yml} into a {@link ClientConfig}. Missing keys keep the builder defaults.
 *
 * Expected keys:
 * baseUrl: "https://api.example.com"
 * apiKey: "..."            # or ${VALENTINA_API_KEY}-style value resolved from the environment
 * timeoutMs: 30000
 * defaultCompanyId: "..."
 * headers:
 *   User-Agent: "my-app/1.0"
 * retry:
 *   maxRetries: 3
 *   delayMs: 1000
 *   autoRetryRateLimit: true
 *   statuses: [500, 502, 503, 504]
 * idempotency:
 *   autoKeys: false
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "vclient.yml";

    private YamlConfigLoader() {}

    /**
     * @throws IOException              file missing or unreadable
     * @throws IllegalArgumentException a value has the wrong shape, or the result fails
     *                                  {@link ClientConfig.Builder#build()} validation
     */
    public static ClientConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);
            return fromMap(root instanceof Map<?, ?> m ? m : Map.of(), System.getenv());
        }
    }

    static ClientConfig fromMap(Map<?, ?> map, Map<String, String> env) {
        ClientConfig.Builder b = ClientConfig.builder();

        setString(map, "baseUrl", env, b::baseUrl);
        setString(map, "apiKey", env, b::apiKey);
        setLong(map, "timeoutMs", ms -> b.timeout(Duration.ofMillis(ms)));
        setString(map, "defaultCompanyId", env, b::defaultCompanyId);

        Map<String, Object> headers = getMap(map, "headers");
        if (headers != null) {
            Map<String, String> hs = new LinkedHashMap<>();
            headers.forEach((k, v) -> {
                String value = (v == null) ? null : resolveEnv(String.valueOf(v), env);
                if (value != null) hs.put(k, value);
            });
            b.headers(hs);
        }

        Map<String, Object> retry = getMap(map, "retry");
        if (retry != null) {
            setInt(retry, "maxRetries", b::maxRetries);
            setLong(retry, "delayMs", ms -> b.retryDelay(Duration.ofMillis(ms)));
            setBoolean(retry, "autoRetryRateLimit", b::autoRetryRateLimit);
            setIntSet(retry, "statuses", b::retryStatuses);
        }

        Map<String, Object> idem = getMap(map, "idempotency");
        if (idem != null) {
            setBoolean(idem, "autoKeys", b::autoIdempotencyKeys);
        }
        return b.build();
    }

    // ${NAME} expands from the environment (null when unset); anything else is literal
    static String resolveEnv(String value, Map<String, String> env) {
        String s = value.trim();
        if (s.startsWith("${") && s.endsWith("}")) {
            return env.get(s.substring(2, s.length() - 1));
        }
        return value;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Map<String, String> env, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(resolveEnv(String.valueOf(v), env));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parseInt(key, v));
    }

    private static void setLong(Map<?, ?> map, String key, Consumer<Long> setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept((long) parseInt(key, v));
    }

    // [500, 503] or "500,503"
    private static void setIntSet(Map<?, ?> map, String key, Consumer<Set<Integer>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        Set<Integer> out = new LinkedHashSet<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(o instanceof Number n ? n.intValue() : parseInt(key, o));
        } else {
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(parseInt(key, p));
        }
        setter.accept(out);
    }

    private static int parseInt(String key, Object v) {
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + ": not an integer: " + v, e);
        }
    }
}
