package com.shinobi.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * Page envelope shared by every list endpoint. {@code total} counts all rows matching the filter,
 * so it stays accurate when {@code page} points past the last page and {@code items} is empty.
 */
public record PageResponse<T>(
        List<T> items,
        long total,
        int page,
        int size,
        int pages,
        boolean hasNext,
        boolean hasPrev
) {

    public static <T> PageResponse<T> of(List<T> items, long total, int page, int size) {
        int pages = (int) ((total + size - 1) / size);
        return new PageResponse<>(items, total, page, size, pages, page < pages, page > 1);
    }

    public static <E, T> PageResponse<T> from(Page<E> result, int page, int size, Function<E, T> mapper) {
        List<T> items = result.getContent().stream()
                .map(mapper)
                .toList();
        return of(items, result.getTotalElements(), page, size);
    }
}
