package org.tabbit.runner;

import java.util.List;

/**
 * Offset and limit applied to a filtered listing.
 */
public record ListQuery(int offset, int limit) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public static final ListQuery ALL = new ListQuery(0, MAX_LIMIT);

    public ListQuery {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative, was " + offset);
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ", was " + limit);
        }
    }

    public <T> List<T> apply(List<T> items) {
        if (offset >= items.size()) {
            return List.of();
        }
        return List.copyOf(items.subList(offset, Math.min(items.size(), offset + limit)));
    }
}
