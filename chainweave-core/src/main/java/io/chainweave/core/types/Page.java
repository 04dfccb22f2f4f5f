// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.core.types;

import java.util.List;
import java.util.Objects;

/**
 * One page of an ordered query result.
 *
 * @param items  the entries on this page, at most {@code limit} of them
 * @param offset index of the first entry within the full result
 * @param total  size of the full result
 * @param <T>    entry type
 */
public record Page<T>(List<T> items, int offset, int total) {

    public Page {
        items = List.copyOf(Objects.requireNonNull(items, "items"));
        if (offset < 0 || total < 0) {
            throw new IllegalArgumentException("offset and total must be non-negative");
        }
    }

    /**
     * Cuts the page starting at {@code offset} out of an already ordered list.
     *
     * @throws IllegalArgumentException if {@code offset} is negative or {@code limit} is not positive
     */
    public static <T> Page<T> of(final List<T> ordered, final int offset, final int limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative, got: " + offset);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
        final int total = ordered.size();
        if (offset >= total) {
            return new Page<>(List.of(), offset, total);
        }
        final int end = (int) Math.min((long) offset + limit, total);
        return new Page<>(ordered.subList(offset, end), offset, total);
    }

    public boolean hasMore() {
        return offset + items.size() < total;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
