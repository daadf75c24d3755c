package com.vclient.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vclient.core.api.IHttpTransport;
import com.vclient.core.model.ApiResponse;
import com.vclient.core.model.ClientConfig;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.UUID;

/** {@link IHttpTransport} on {@link HttpClient}. Thread-safe; one instance per client. */
public final class JdkHttpTransport implements IHttpTransport {
    public static final String API_KEY_HEADER = "X-API-KEY";

    /** Test/mocking hook, same shape as {@link HttpClient#send}. */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final ClientConfig config;
    private final ObjectMapper mapper;
    private final HttpSender sender;
    private volatile boolean closed;

    public JdkHttpTransport(ClientConfig config, ObjectMapper mapper) {
        this(config, mapper, newClient(config));
    }

    private JdkHttpTransport(ClientConfig config, ObjectMapper mapper, HttpClient client) {
        this(config, mapper, req -> client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)));
    }

    /** Test constructor (sender hook injected). */
    public JdkHttpTransport(ClientConfig config, ObjectMapper mapper, HttpSender sender) {
        this.config = Objects.requireNonNull(config, "config");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    private static HttpClient newClient(ClientConfig config) {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.getTimeout())
                .build();
    }

    @Override
    public ApiResponse send(ApiRequest request) throws IOException, InterruptedException {
        if (closed) throw new IllegalStateException("transport is closed");
        HttpRequest req = toHttpRequest(request);

        long start = System.nanoTime();
        HttpResponse<String> resp = sender.send(req);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        HttpHeaders hh = resp.headers();
        return ApiResponse.builder()
                .statusCode(resp.statusCode())
                .headers(hh.map())
                .body(resp.body() == null ? "" : resp.body())
                .elapsedMs(elapsedMs)
                .build();
    }

    HttpRequest toHttpRequest(ApiRequest request) throws IOException {
        Map<String, String> headers = defaultHeaders();
        HttpRequest.BodyPublisher publisher;

        if (request.getFile() != null) {
            String boundary = "vclient-" + UUID.randomUUID();
            putIgnoreCase(headers, "Content-Type", "multipart/form-data; boundary=" + boundary);
            publisher = HttpRequest.BodyPublishers.ofByteArray(multipart(boundary, request.getFile()));
        } else if (request.getFormBody() != null) {
            putIgnoreCase(headers, "Content-Type", "application/x-www-form-urlencoded");
            publisher = HttpRequest.BodyPublishers.ofString(encode(request.getFormBody()), StandardCharsets.UTF_8);
        } else if (request.getJsonBody() != null) {
            publisher = HttpRequest.BodyPublishers.ofString(toJson(request.getJsonBody()), StandardCharsets.UTF_8);
        } else {
            publisher = HttpRequest.BodyPublishers.noBody();
        }

        // per-call headers win over defaults
        request.getHeaders().forEach((k, v) -> putIgnoreCase(headers, k, v));

        HttpRequest.Builder b = HttpRequest.newBuilder(resolve(request))
                .timeout(config.getTimeout())
                .method(request.getVerb().name(), publisher);
        headers.forEach(b::header);
        return b.build();
    }

    URI resolve(ApiRequest request) {
        String path = request.getPath();
        StringBuilder url = new StringBuilder(config.getBaseUrl());
        if (!path.startsWith("/")) url.append('/');
        url.append(path);
        if (!request.getQuery().isEmpty()) {
            url.append(path.contains("?") ? '&' : '?').append(encode(request.getQuery()));
        }
        return URI.create(url.toString());
    }

    private Map<String, String> defaultHeaders() {
        Map<String, String> h = new LinkedHashMap<>();
        h.put("Accept", "application/json");
        h.put("Content-Type", "application/json");
        config.getHeaders().forEach((k, v) -> putIgnoreCase(h, k, v));
        putIgnoreCase(h, API_KEY_HEADER, config.getApiKey());
        return h;
    }

    private static void putIgnoreCase(Map<String, String> headers, String name, String value) {
        headers.keySet().removeIf(k -> k.equalsIgnoreCase(name));
        headers.put(name, value);
    }

    private String toJson(Object body) throws IOException {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize request body: " + e.getOriginalMessage(), e);
        }
    }

    private static String encode(Map<String, String> params) {
        StringJoiner sj = new StringJoiner("&");
        params.forEach((k, v) -> sj.add(URLEncoder.encode(k, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(v, StandardCharsets.UTF_8)));
        return sj.toString();
    }

    private static byte[] multipart(String boundary, FilePayload file) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(file.size() + 256);
        String head = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"file\"; filename=\"" + dispositionName(file.getFilename()) + "\"\r\n"
                + "Content-Type: " + file.getContentType() + "\r\n\r\n";
        out.writeBytes(head.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(file.getContent());
        out.writeBytes(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }

    // quotes and control characters would break out of the part header
    static String dispositionName(String filename) {
        StringBuilder sb = new StringBuilder(filename.length());
        for (int i = 0; i < filename.length(); i++) {
            char c = filename.charAt(i);
            if (c == '"') sb.append("%22");
            else if (c == '\r') sb.append("%0D");
            else if (c == '\n') sb.append("%0A");
            else if (c < 0x20 || c == 0x7f) sb.append('_');
            else sb.append(c);
        }
        return sb.toString();
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() { return closed; }
}
