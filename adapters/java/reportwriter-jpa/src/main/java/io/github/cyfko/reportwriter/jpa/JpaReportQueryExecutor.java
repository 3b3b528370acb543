package io.github.cyfko.reportwriter.jpa;

import io.github.cyfko.reportwriter.core.model.FetchResult;
import io.github.cyfko.reportwriter.core.model.QueryPlan;
import io.github.cyfko.reportwriter.core.spi.ReportQueryExecutor;
import io.github.cyfko.reportwriter.core.utils.FieldNames;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link ReportQueryExecutor} running native SQL through a JPA {@link EntityManager}.
 * <p>
 * The data query is {@code SELECT <fields> <sqlFragment> <ORDER BY> <LIMIT>}, where the SQL fragment
 * starts at the {@code FROM} clause and runs through the end of the {@code WHERE} clause
 * ({@code GROUP BY}/{@code HAVING} may follow). The total is observed according to the
 * {@link CountMode}; the portable count wraps the fragment in a derived table, so a grouped
 * fragment counts the rows the grouped query returns. Rows are returned as insertion-ordered
 * maps keyed by the {@linkplain FieldNames#displayName(String) field names} of the projected columns.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * ReportQueryExecutor<Map<String, Object>> executor = new JpaReportQueryExecutor(
 *     entityManager,
 *     "FROM person AS p, addresses AS a WHERE a.person_id = p.id",
 *     CountMode.COUNT_QUERY);
 *
 * ReportPage<Map<String, Object>> page = reportWriter.fetch(request, executor);
 * }</pre>
 *
 * <p>Both queries of an attempt must run on the same connection for {@link CountMode#FOUND_ROWS};
 * call this executor inside a transaction.</p>
 *
 * @param entityManager entity manager used to create native queries
 * @param sqlFragment SQL from the {@code FROM} clause on
 * @param countMode how the total row count is observed
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record JpaReportQueryExecutor(EntityManager entityManager, String sqlFragment, CountMode countMode)
        implements ReportQueryExecutor<Map<String, Object>> {

    private static final Logger logger = Logger.getLogger(JpaReportQueryExecutor.class.getName());

    public JpaReportQueryExecutor {
        Objects.requireNonNull(entityManager, "entityManager must not be null");
        Objects.requireNonNull(sqlFragment, "sqlFragment must not be null");
        Objects.requireNonNull(countMode, "countMode must not be null");
        if (sqlFragment.isBlank()) {
            throw new IllegalArgumentException("sqlFragment must not be blank");
        }
    }

    @Override
    public FetchResult<Map<String, Object>> fetch(QueryPlan plan) {
        long startTime = System.nanoTime();

        String dataSql = dataSql(plan);
        logger.fine(() -> "Report data query: " + dataSql);
        List<?> rawRows = entityManager.createNativeQuery(dataSql).getResultList();

        String countSql = countSql();
        Query countQuery = entityManager.createNativeQuery(countSql);
        long total = ((Number) countQuery.getSingleResult()).longValue();

        List<String> fieldNames = plan.projectedFields().stream().map(FieldNames::displayName).toList();
        List<Map<String, Object>> rows = new ArrayList<>(rawRows.size());
        for (Object raw : rawRows) {
            rows.add(toRow(raw, fieldNames));
        }

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("Report query completed in %dms: %d rows of %d", durationMs, rows.size(), total));

        return new FetchResult<>(rows, total);
    }

    /**
     * @param plan plan of the attempt
     * @return the data query of the attempt
     */
    public String dataSql(QueryPlan plan) {
        String select = countMode == CountMode.FOUND_ROWS ? "SELECT SQL_CALC_FOUND_ROWS " : "SELECT ";
        return select + plan.selectList() + " " + sqlFragment + " " + plan.orderByClause() + " " + plan.limitClause();
    }

    /**
     * @return the query observing the total row count
     */
    public String countSql() {
        return countMode == CountMode.FOUND_ROWS
                ? "SELECT FOUND_ROWS()"
                : "SELECT COUNT(*) FROM (SELECT 1 " + sqlFragment + ") report_count";
    }

    private static Map<String, Object> toRow(Object raw, List<String> fieldNames) {
        Object[] values = raw instanceof Object[] array ? array : new Object[]{raw};
        if (values.length != fieldNames.size()) {
            throw new IllegalStateException(String.format(
                    "Query returned %d values per row for %d projected fields", values.length, fieldNames.size()));
        }
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            row.put(fieldNames.get(i), values[i]);
        }
        return row;
    }
}
