package io.github.cyfko.reportwriter.jpa;

/**
 * How {@link JpaReportQueryExecutor} observes the total row count of a report.
 */
public enum CountMode {
    /**
     * Portable: a {@code SELECT COUNT(*)} query over the fragment runs after each data query.
     */
    COUNT_QUERY,
    /**
     * MySQL 4 and later: the data query is issued as {@code SELECT SQL_CALC_FOUND_ROWS ...} and the
     * total is read with {@code SELECT FOUND_ROWS()} on the same connection.
     */
    FOUND_ROWS
}
