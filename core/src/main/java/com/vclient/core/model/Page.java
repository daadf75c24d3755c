package com.vclient.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * One slice of a list endpoint: {@code items} plus the {@code limit/offset/total} the server
 * applied. Immutable.
 */
public final class Page<T> {
    private final List<T> items;
    private final int limit;
    private final int offset;
    private final int total;

    public Page(List<T> items, int limit, int offset, int total) {
        this.items = List.copyOf(Objects.requireNonNull(items, "items"));
        this.limit = limit;
        this.offset = offset;
        this.total = total;
    }

    public List<T> getItems() { return items; }
    public int getLimit() { return limit; }
    public int getOffset() { return offset; }
    public int getTotal() { return total; }

    /** More items exist past this page. */
    public boolean hasMore() {
        return offset + items.size() < total;
    }

    /** Offset of the following page. */
    public int nextOffset() {
        return offset + limit;
    }

    /** Number of pages at this page size; 0 when limit is 0. */
    public int totalPages() {
        if (limit == 0) return 0;
        return (total + limit - 1) / limit;
    }

    /** 1-based page number; 0 when limit is 0. */
    public int currentPage() {
        if (limit == 0) return 0;
        return (offset / limit) + 1;
    }

    /** Same page metadata with every item converted. */
    public <R> Page<R> map(Function<? super T, ? extends R> fn) {
        List<R> out = new ArrayList<>(items.size());
        for (T item : items) out.add(fn.apply(item));
        return new Page<>(out, limit, offset, total);
    }

    @Override
    public String toString() {
        return "Page{items=" + items.size() + ", limit=" + limit + ", offset=" + offset + ", total=" + total + '}';
    }
}
