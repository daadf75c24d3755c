package com.vclient.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vclient.core.model.ApiResponse;
import com.vclient.core.model.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Offset/limit paging over list endpoints ({@code {items, limit, offset, total}} bodies).
 * <p>
 * {@link #iterateAll} is lazy: the next page is requested only after the current one has been
 * fully consumed, so memory stays at one page. {@link #collectAll} loads everything.
 */
public final class PaginationCursor {
    private static final Logger LOG = LoggerFactory.getLogger(PaginationCursor.class);

    public static final int DEFAULT_PAGE_LIMIT = 10;
    public static final int MAX_PAGE_LIMIT = 100;

    private final RequestExecutor executor;
    private final ObjectMapper mapper;

    public PaginationCursor(RequestExecutor executor, ObjectMapper mapper) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * One GET with {@code limit} clamped to [0, 100] and {@code offset} to [0, ∞).
     * Extra {@code params} are sent after limit/offset and may not override them.
     */
    public Page<JsonNode> fetchPage(String path, int limit, int offset, Map<String, ?> params) {
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("limit", Math.min(Math.max(limit, 0), MAX_PAGE_LIMIT));
        query.put("offset", Math.max(offset, 0));
        if (params != null) params.forEach(query::putIfAbsent);

        ApiResponse response = executor.execute(ApiRequest.builder(HttpVerb.GET, path).query(query).build());
        return parsePage(response.getBody());
    }

    /** {@link #fetchPage(String, int, int, Map)} with items converted to {@code type}. */
    public <T> Page<T> fetchPage(String path, Class<T> type, int limit, int offset, Map<String, ?> params) {
        return fetchPage(path, limit, offset, params).map(node -> convert(node, type));
    }

    /** Every item of every page, in order, fetched lazily. Single pass. */
    public Iterator<JsonNode> iterateAll(String path, int limit, Map<String, ?> params) {
        return new PageIterator(path, limit, params);
    }

    public <T> Stream<T> stream(String path, Class<T> type, int limit, Map<String, ?> params) {
        Spliterator<JsonNode> sp = Spliterators.spliteratorUnknownSize(
                iterateAll(path, limit, params), Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(sp, false).map(node -> convert(node, type));
    }

    /** Whole collection in memory. Unbounded; prefer {@link #iterateAll} for large lists. */
    public List<JsonNode> collectAll(String path, int limit, Map<String, ?> params) {
        List<JsonNode> out = new ArrayList<>();
        iterateAll(path, limit, params).forEachRemaining(out::add);
        return out;
    }

    public <T> List<T> collectAll(String path, Class<T> type, int limit, Map<String, ?> params) {
        List<T> out = new ArrayList<>();
        iterateAll(path, limit, params).forEachRemaining(node -> out.add(convert(node, type)));
        return out;
    }

    Page<JsonNode> parsePage(String body) {
        JsonNode root;
        try {
            root = (body == null || body.isBlank()) ? mapper.createObjectNode() : mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("List response is not JSON: " + e.getOriginalMessage(), e);
        }
        List<JsonNode> items = new ArrayList<>();
        JsonNode arr = root.path("items");
        if (arr.isArray()) arr.forEach(items::add);
        return new Page<>(items,
                root.path("limit").asInt(0),
                root.path("offset").asInt(0),
                root.path("total").asInt(0));
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    /** Walks pages from offset 0 until a page reports no more items. */
    private final class PageIterator implements Iterator<JsonNode> {
        private final String path;
        private final int limit;
        private final Map<String, ?> params;

        private Iterator<JsonNode> current = Collections.emptyIterator();
        private int nextOffset = 0;
        private boolean exhausted = false;

        PageIterator(String path, int limit, Map<String, ?> params) {
            this.path = path;
            this.limit = limit;
            this.params = params;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext()) {
                if (exhausted) return false;
                int requested = nextOffset;
                Page<JsonNode> page = fetchPage(path, limit, requested, params);
                current = page.getItems().iterator();
                // a page that cannot advance the offset would be fetched forever
                boolean stuck = page.getItems().isEmpty() || page.nextOffset() <= requested;
                if (!page.hasMore() || stuck) {
                    exhausted = true;
                    if (page.hasMore()) {
                        LOG.warn("Stopped paging {} at offset {}: page cannot advance (items={}, limit={}, total={})",
                                path, requested, page.getItems().size(), page.getLimit(), page.getTotal());
                    }
                } else {
                    nextOffset = page.nextOffset();
                }
            }
            return true;
        }

        @Override
        public JsonNode next() {
            if (!hasNext()) throw new NoSuchElementException();
            return current.next();
        }
    }
}
