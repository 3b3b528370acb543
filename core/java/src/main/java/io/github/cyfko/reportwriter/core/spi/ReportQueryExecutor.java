package io.github.cyfko.reportwriter.core.spi;

import io.github.cyfko.reportwriter.core.model.FetchResult;
import io.github.cyfko.reportwriter.core.model.QueryPlan;

/**
 * Data-access collaborator of a report.
 * <p>
 * Runs one query attempt for a {@link QueryPlan}: the data query built from the plan's select
 * list, order and limit clauses, plus the total row count of the report. The report engine
 * never touches the data store itself; it only produces plans and consumes the returned count.
 * </p>
 *
 * <p>On an overrun the engine calls {@link #fetch(QueryPlan)} again with a corrected plan, at most
 * twice per request. Implementations must therefore observe a fresh count on every call.</p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * ReportQueryExecutor<Map<String, Object>> executor =
 *     new JpaReportQueryExecutor(entityManager, "FROM person WHERE active = 1", CountMode.COUNT_QUERY);
 *
 * ReportPage<Map<String, Object>> page = reportWriter.fetch(request, executor);
 * }</pre>
 *
 * @param <R> row type
 */
@FunctionalInterface
public interface ReportQueryExecutor<R> {

    /**
     * @param plan SQL fragments of this attempt
     * @return the rows of the planned page and the observed total row count
     */
    FetchResult<R> fetch(QueryPlan plan);
}
