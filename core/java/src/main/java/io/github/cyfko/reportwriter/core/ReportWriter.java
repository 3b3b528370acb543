package io.github.cyfko.reportwriter.core;

import io.github.cyfko.reportwriter.core.api.RequestParameters;
import io.github.cyfko.reportwriter.core.config.PagingConfig;
import io.github.cyfko.reportwriter.core.config.ReportDefinition;
import io.github.cyfko.reportwriter.core.engine.OverrunRecovery;
import io.github.cyfko.reportwriter.core.engine.PageStateResolver;
import io.github.cyfko.reportwriter.core.engine.QueryPlanner;
import io.github.cyfko.reportwriter.core.engine.SortStateResolver;
import io.github.cyfko.reportwriter.core.exception.OverrunExhaustedException;
import io.github.cyfko.reportwriter.core.model.FetchResult;
import io.github.cyfko.reportwriter.core.model.PageList;
import io.github.cyfko.reportwriter.core.model.PageState;
import io.github.cyfko.reportwriter.core.model.QueryPlan;
import io.github.cyfko.reportwriter.core.model.ReportPage;
import io.github.cyfko.reportwriter.core.model.SortHeader;
import io.github.cyfko.reportwriter.core.model.SortState;
import io.github.cyfko.reportwriter.core.render.PageListRenderer;
import io.github.cyfko.reportwriter.core.render.SortHeaderRenderer;
import io.github.cyfko.reportwriter.core.spi.ReportQueryExecutor;
import io.github.cyfko.reportwriter.core.utils.FieldNames;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * High-level facade producing one page of a paginated, sortable report per request.
 * <p>
 * All state is re-derived from the request on every call; nothing is kept between requests,
 * and a {@code ReportWriter} is safe to share across threads.
 * </p>
 *
 * <p><strong>Pipeline:</strong></p>
 * <ol>
 *   <li><strong>Resolve:</strong> sort and page state from the configured request variables</li>
 *   <li><strong>Plan:</strong> {@code ORDER BY} and {@code LIMIT} clauses via {@link QueryPlanner}</li>
 *   <li><strong>Query:</strong> rows and total count via the {@link ReportQueryExecutor}</li>
 *   <li><strong>Reconcile:</strong> on an overrun, re-plan with the corrected page and query again,
 *       at most {@link OverrunRecovery#MAX_ATTEMPTS} attempts in total</li>
 *   <li><strong>Render:</strong> paging bar, sort headers and field names</li>
 * </ol>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * ReportWriter writer = ReportWriter.of(ReportDefinition.builder()
 *     .column("name")
 *     .column("age")
 *     .defaultSort("name")
 *     .build());
 *
 * ReportPage<Map<String, Object>> page = writer.fetch(
 *     RequestParameters.of(Map.of("page", "3", "sort", "age", "order", "desc")),
 *     new JpaReportQueryExecutor(entityManager, "FROM person", CountMode.COUNT_QUERY));
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link io.github.cyfko.reportwriter.core.exception.ReportConfigurationException} - raised while
 *       building the {@link ReportDefinition}, never here</li>
 *   <li>{@link OverrunExhaustedException} - the requested page kept overrunning a shrinking result set</li>
 *   <li>Malformed request parameters are normalized, never raised</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ReportWriter {

    private static final Logger log = Logger.getLogger(ReportWriter.class.getName());

    private final ReportDefinition definition;
    private final List<String> fieldNames;

    private ReportWriter(ReportDefinition definition) {
        this.definition = definition;
        this.fieldNames = FieldNames.of(definition.getColumns());
    }

    /**
     * @param definition validated report definition
     * @return a writer for that definition
     */
    public static ReportWriter of(ReportDefinition definition) {
        return new ReportWriter(Objects.requireNonNull(definition, "definition cannot be null"));
    }

    public ReportDefinition getDefinition() {
        return definition;
    }

    /**
     * Resolves the sort state of a request.
     */
    public SortState resolveSort(RequestParameters request) {
        PagingConfig paging = definition.getPaging();
        return SortStateResolver.resolve(
                request.get(paging.getSortVariable()).orElse(null),
                request.get(paging.getDirectionVariable()).orElse(null),
                definition.getColumns(),
                definition.getDefaultSortKey());
    }

    /**
     * Resolves the page state of a request.
     */
    public PageState resolvePage(RequestParameters request) {
        PagingConfig paging = definition.getPaging();
        return PageStateResolver.resolve(
                request.get(paging.getPageVariable()).orElse(null),
                paging.getResultsPerPage(),
                paging.getPagesInList());
    }

    /**
     * Produces the requested page of the report.
     *
     * @param request incoming request parameters
     * @param executor data-access collaborator
     * @param <R> row type
     * @return rows plus every piece of paging and sorting state needed to render them
     * @throws OverrunExhaustedException if the page still overruns after the last allowed attempt
     */
    public <R> ReportPage<R> fetch(RequestParameters request, ReportQueryExecutor<R> executor) {
        Objects.requireNonNull(request, "request cannot be null");
        Objects.requireNonNull(executor, "executor cannot be null");

        SortState sortState = resolveSort(request);
        PageState requested = resolvePage(request);
        PageState pageState = requested;

        int attempts = 0;
        while (true) {
            QueryPlan plan = QueryPlanner.plan(sortState, pageState, definition.getColumns());
            attempts++;

            final int attempt = attempts;
            log.fine(() -> String.format("Report query attempt %d: %s %s", attempt, plan.orderByClause(), plan.limitClause()));

            FetchResult<R> result = executor.fetch(plan);
            OverrunRecovery.Reconciliation reconciliation = OverrunRecovery.reconcile(result.totalCount(), pageState);

            if (reconciliation.isValid()) {
                return assemble(request, sortState, plan, result, reconciliation, attempts);
            }

            if (!OverrunRecovery.canRetry(attempts)) {
                OverrunExhaustedException failure = new OverrunExhaustedException(
                        requested.requestedIndex(), reconciliation.window(), attempts);
                log.severe(failure::getMessage);
                throw failure;
            }

            PageState corrected = reconciliation.correctedState();
            log.warning(() -> String.format(
                    "Page %d overran the result set (total=%d, pages=%d); retrying with page %d",
                    plan.pageState().requestedIndex(), result.totalCount(),
                    reconciliation.window().pageCount(), corrected.requestedIndex()));
            pageState = corrected;
        }
    }

    private <R> ReportPage<R> assemble(RequestParameters request, SortState sortState, QueryPlan plan,
                                       FetchResult<R> result, OverrunRecovery.Reconciliation reconciliation,
                                       int attempts) {
        PagingConfig paging = definition.getPaging();
        PageList pageList = PageListRenderer.render(reconciliation.window(), paging.getPagesInList(), paging, request);
        List<SortHeader> headers = SortHeaderRenderer.render(definition.getColumns(), sortState, paging, request);
        List<R> rows = reconciliation.window().isEmpty() ? List.of() : result.rows();
        return new ReportPage<>(rows, reconciliation.window(), sortState, plan, pageList, headers, fieldNames, attempts);
    }
}
