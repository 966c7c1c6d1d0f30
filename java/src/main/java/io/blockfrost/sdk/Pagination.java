package io.blockfrost.sdk;

import java.util.StringJoiner;

/**
 * Immutable page request: 1-based page number plus optional page size and ordering.
 *
 * <p>
 * Upper bounds on {@code count} are left to the server; a {@code null} count or order means the server default applies.
 * </p>
 */
public record Pagination(int page, Integer count, Order order) {

    public Pagination {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1, got " + page);
        }
        if (count != null && count < 1) {
            throw new IllegalArgumentException("count must be >= 1, got " + count);
        }
    }

    public static Pagination page(int page) {
        return new Pagination(page, null, null);
    }

    public static Pagination of(int page, int count) {
        return new Pagination(page, count, null);
    }

    public Pagination withPage(int newPage) {
        return new Pagination(newPage, count, order);
    }

    public Pagination withOrder(Order newOrder) {
        return new Pagination(page, count, newOrder);
    }

    /**
     * @return query string without the leading {@code ?}, e.g. {@code page=2&count=100&order=desc}.
     */
    public String toQuery() {
        StringJoiner query = new StringJoiner("&");
        query.add("page=" + page);
        if (count != null) {
            query.add("count=" + count);
        }
        if (order != null) {
            query.add("order=" + order.queryValue());
        }
        return query.toString();
    }
}
