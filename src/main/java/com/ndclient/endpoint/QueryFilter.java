package com.ndclient.endpoint;

import jakarta.validation.constraints.PositiveOrZero;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.StringJoiner;
import lombok.Builder;

/**
 * Generic paging, filtering and sorting parameters accepted by the controller's list endpoints.
 * Unset, blank and zero values are left out of the query string.
 *
 * @param filter Lucene style filter, e.g. {@code name:my_fabric AND state:ready}.
 * @param limit  Limit the number of results returned.
 * @param max    Maximum number of results returned.
 * @param offset Number of records to skip.
 * @param sort   Comma separated property list, {@code -} prefix for descending order.
 */
@Builder
public record QueryFilter(String filter,
                          @PositiveOrZero Integer limit,
                          @PositiveOrZero Integer max,
                          @PositiveOrZero Integer offset,
                          String sort) {

    public static QueryFilter none() {
        return QueryFilter.builder().build();
    }

    /**
     * @return The URL-encoded {@code key=value} pairs joined by {@code &}, in the order filter,
     *         limit, max, offset, sort. Empty when no parameter is set.
     */
    public String toQueryString() {
        StringJoiner query = new StringJoiner("&");
        appendText(query, "filter", filter);
        appendNumber(query, "limit", limit);
        appendNumber(query, "max", max);
        appendNumber(query, "offset", offset);
        appendText(query, "sort", sort);
        return query.toString();
    }

    private static void appendText(StringJoiner query, String key, String value) {
        if (value != null && !value.isBlank()) {
            query.add(key + "=" + encode(value.trim()));
        }
    }

    private static void appendNumber(StringJoiner query, String key, Integer value) {
        if (value != null && value != 0) {
            query.add(key + "=" + value);
        }
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
