package io.github.cyfko.reportwriter.core.engine;

import io.github.cyfko.reportwriter.core.model.ColumnSpec;
import io.github.cyfko.reportwriter.core.model.PageState;
import io.github.cyfko.reportwriter.core.model.QueryPlan;
import io.github.cyfko.reportwriter.core.model.SortState;

import java.util.List;
import java.util.Objects;

/**
 * Computes the {@code ORDER BY} and {@code LIMIT} clauses of a query attempt.
 * <p>
 * Ordering uses the active column's order fragment, so a column selected as formatted text can
 * still be ordered by its raw value. The limit uses a zero-based offset:
 * {@code LIMIT (index - 1) * pageSize, pageSize}. Projected fields are the query fragments of
 * every column, in declared order, verbatim.
 * </p>
 *
 * <pre>{@code
 * QueryPlan plan = QueryPlanner.plan(
 *     new SortState("date", SortDirection.DESC),
 *     new PageState(3, 10, 5),
 *     columns);
 *
 * plan.orderByClause(); // "ORDER BY l.created DESC"
 * plan.limitClause();   // "LIMIT 20, 10"
 * }</pre>
 */
public final class QueryPlanner {

    private QueryPlanner() {}

    /**
     * @param sortState resolved sort state
     * @param pageState page state of this attempt
     * @param columns declared columns
     * @return the plan; equal inputs always produce equal plans
     * @throws IllegalArgumentException if the active sort key names no declared column
     */
    public static QueryPlan plan(SortState sortState, PageState pageState, List<ColumnSpec> columns) {
        Objects.requireNonNull(sortState, "sortState cannot be null");
        Objects.requireNonNull(pageState, "pageState cannot be null");
        Objects.requireNonNull(columns, "columns cannot be null");

        ColumnSpec active = columns.stream()
                .filter(c -> c.key().equals(sortState.activeKey()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Sort key '" + sortState.activeKey() + "' does not name a declared column"));

        String orderBy = "ORDER BY " + active.orderFragment() + " " + sortState.direction().name();
        String limit = "LIMIT " + pageState.offset() + ", " + pageState.pageSize();
        List<String> fields = columns.stream().map(ColumnSpec::queryFragment).toList();

        return new QueryPlan(orderBy, limit, fields, sortState, pageState);
    }
}
