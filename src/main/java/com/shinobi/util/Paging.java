package com.shinobi.util;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

public final class Paging {

    private static final Sort BY_ID = Sort.by(Sort.Direction.ASC, "id");

    private Paging() {
    }

    /**
     * One-based {@code page} to a zero-based request, ordered by id ascending.
     */
    public static Pageable byId(int page, int size) {
        return PageRequest.of(page - 1, size, BY_ID);
    }

    /**
     * True when the row offset of {@code page} does not fit a JPA query offset; such a page is
     * always past the last row, so only the total is worth querying.
     */
    public static boolean isBeyondOffsetRange(int page, int size) {
        return (long) (page - 1) * size > Integer.MAX_VALUE;
    }

    public static boolean hasSearch(String search) {
        return search != null && !search.isEmpty();
    }
}
