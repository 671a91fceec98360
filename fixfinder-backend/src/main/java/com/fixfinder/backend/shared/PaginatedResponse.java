package com.fixfinder.backend.shared;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

public class PaginatedResponse<T> {

    private final List<T> items;
    private final long totalItems;
    private final int page;
    private final int limit;

    public PaginatedResponse(List<T> items, long totalItems, int page, int limit) {
        this.items = items;
        this.totalItems = totalItems;
        this.page = page;
        this.limit = limit;
    }

    /** Pages are 1-based on the wire and 0-based in Spring Data. */
    public static <E, T> PaginatedResponse<T> of(Page<E> source, Function<E, T> mapper) {
        return new PaginatedResponse<>(
                source.getContent().stream().map(mapper).toList(),
                source.getTotalElements(),
                source.getNumber() + 1,
                source.getSize()
        );
    }

    public List<T> getItems() {
        return items;
    }

    public long getTotalItems() {
        return totalItems;
    }

    public int getPage() {
        return page;
    }

    public int getLimit() {
        return limit;
    }

    public int getTotalPages() {
        return limit == 0 ? 0 : (int) Math.ceil((double) totalItems / limit);
    }
}
