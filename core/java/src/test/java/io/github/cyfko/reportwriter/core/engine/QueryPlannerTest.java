package io.github.cyfko.reportwriter.core.engine;

import io.github.cyfko.reportwriter.core.model.ColumnSpec;
import io.github.cyfko.reportwriter.core.model.PageState;
import io.github.cyfko.reportwriter.core.model.QueryPlan;
import io.github.cyfko.reportwriter.core.model.SortDirection;
import io.github.cyfko.reportwriter.core.model.SortState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryPlanner Tests")
class QueryPlannerTest {

    private static final List<ColumnSpec> COLUMNS = List.of(
            ColumnSpec.builder("username").query("jp.username").label("Username").build(),
            ColumnSpec.builder("date")
                    .query("DATE_FORMAT(l.created, '%m/%e/%Y') AS date")
                    .order("l.created")
                    .label("Date")
                    .build(),
            ColumnSpec.builder("type").query("IF(l.deleted = 'yes', 'delete', 'add') AS type").build()
    );

    @Test
    @DisplayName("Should order by the order fragment of the active column")
    void shouldOrderByOrderFragment() {
        QueryPlan plan = QueryPlanner.plan(new SortState("date", SortDirection.DESC), new PageState(1, 10, 5), COLUMNS);

        assertEquals("ORDER BY l.created DESC", plan.orderByClause());
    }

    @Test
    @DisplayName("Should order by the query fragment when no order fragment is set")
    void shouldOrderByQueryFragmentByDefault() {
        QueryPlan plan = QueryPlanner.plan(new SortState("username", SortDirection.ASC), new PageState(1, 10, 5), COLUMNS);

        assertEquals("ORDER BY jp.username ASC", plan.orderByClause());
    }

    @Test
    @DisplayName("Should compute a zero-based limit clause")
    void shouldComputeLimitClause() {
        SortState sort = new SortState("username", SortDirection.ASC);

        assertEquals("LIMIT 0, 10", QueryPlanner.plan(sort, new PageState(1, 10, 5), COLUMNS).limitClause());
        assertEquals("LIMIT 20, 10", QueryPlanner.plan(sort, new PageState(3, 10, 5), COLUMNS).limitClause());
        assertEquals("LIMIT 50, 25", QueryPlanner.plan(sort, new PageState(3, 25, 5), COLUMNS).limitClause());
    }

    @Test
    @DisplayName("Should project query fragments verbatim, in declared order")
    void shouldProjectFieldsInDeclaredOrder() {
        QueryPlan plan = QueryPlanner.plan(new SortState("type", SortDirection.ASC), new PageState(2, 10, 5), COLUMNS);

        assertEquals(List.of(
                "jp.username",
                "DATE_FORMAT(l.created, '%m/%e/%Y') AS date",
                "IF(l.deleted = 'yes', 'delete', 'add') AS type"), plan.projectedFields());
        assertEquals("jp.username, DATE_FORMAT(l.created, '%m/%e/%Y') AS date, IF(l.deleted = 'yes', 'delete', 'add') AS type",
                plan.selectList());
    }

    @Test
    @DisplayName("Should be idempotent for identical inputs")
    void shouldBeIdempotent() {
        SortState sort = new SortState("date", SortDirection.DESC);
        PageState page = new PageState(4, 15, 5);

        QueryPlan first = QueryPlanner.plan(sort, page, COLUMNS);
        QueryPlan second = QueryPlanner.plan(sort, page, COLUMNS);

        assertEquals(first, second);
        assertEquals(first.orderByClause(), second.orderByClause());
        assertEquals(first.limitClause(), second.limitClause());
    }

    @Test
    @DisplayName("Should reject a sort key naming no column")
    void shouldRejectUnknownSortKey() {
        assertThrows(IllegalArgumentException.class,
                () -> QueryPlanner.plan(new SortState("missing", SortDirection.ASC), new PageState(1, 10, 5), COLUMNS));
    }
}
