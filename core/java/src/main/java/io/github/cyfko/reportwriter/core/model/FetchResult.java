package io.github.cyfko.reportwriter.core.model;

import java.util.List;

/**
 * Outcome of one query attempt: the rows of the planned page and the total row count
 * observed alongside them.
 *
 * @param rows rows returned by the data query
 * @param totalCount total number of rows matching the report, {@code >= 0}
 * @param <R> row type
 */
public record FetchResult<R>(List<R> rows, long totalCount) {

    public FetchResult {
        if (totalCount < 0) {
            throw new IllegalArgumentException("Total count cannot be negative. Provided: " + totalCount);
        }
        rows = List.copyOf(rows);
    }

    public static <R> FetchResult<R> empty() {
        return new FetchResult<>(List.of(), 0);
    }
}
