package io.github.cyfko.reportwriter.core.model;

import java.util.List;
import java.util.Objects;

/**
 * SQL fragments computed for one query attempt.
 * <p>
 * The plan carries no data access: the data-access collaborator assembles
 * {@code SELECT <selectList()> <from/where> <orderByClause> <limitClause>} itself.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * QueryPlan plan = QueryPlanner.plan(sortState, pageState, columns);
 *
 * String sql = "SELECT " + plan.selectList() + " FROM person "
 *         + plan.orderByClause() + " " + plan.limitClause();
 * // SELECT name, age FROM person ORDER BY age DESC LIMIT 20, 10
 * }</pre>
 *
 * @param orderByClause complete {@code ORDER BY} clause
 * @param limitClause complete {@code LIMIT offset, count} clause
 * @param projectedFields select expressions in declared column order
 * @param sortState sort state the plan was computed for
 * @param pageState page state the plan was computed for
 */
public record QueryPlan(
        String orderByClause,
        String limitClause,
        List<String> projectedFields,
        SortState sortState,
        PageState pageState
) {
    public QueryPlan {
        Objects.requireNonNull(orderByClause, "orderByClause is required");
        Objects.requireNonNull(limitClause, "limitClause is required");
        Objects.requireNonNull(sortState, "sortState is required");
        Objects.requireNonNull(pageState, "pageState is required");
        projectedFields = List.copyOf(projectedFields);
    }

    /**
     * @return projected fields joined with {@code ", "}
     */
    public String selectList() {
        return String.join(", ", projectedFields);
    }

    /**
     * @return zero-based row offset of the planned page
     */
    public long offset() {
        return pageState.offset();
    }

    /**
     * @return maximum number of rows the data query returns
     */
    public int limit() {
        return pageState.pageSize();
    }
}
