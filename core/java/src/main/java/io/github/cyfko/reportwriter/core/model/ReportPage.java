package io.github.cyfko.reportwriter.core.model;

import java.util.List;
import java.util.function.Function;

/**
 * Everything the rendering layer needs to draw one page of a report.
 *
 * @param rows rows of the displayed page
 * @param window reconciled result window
 * @param sortState sort state applied to the rows
 * @param plan plan of the query that produced the rows
 * @param pageList paging bar
 * @param headers one header per column, in declared order
 * @param fieldNames display-safe field names, in declared column order
 * @param attempts number of query attempts performed ({@code 1} without overrun)
 * @param <R> row type
 */
public record ReportPage<R>(
        List<R> rows,
        ResultWindow window,
        SortState sortState,
        QueryPlan plan,
        PageList pageList,
        List<SortHeader> headers,
        List<String> fieldNames,
        int attempts
) {
    public ReportPage {
        rows = List.copyOf(rows);
        headers = List.copyOf(headers);
        fieldNames = List.copyOf(fieldNames);
    }

    /**
     * @return {@code true} if the report matched no row
     */
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Transforms the rows while keeping every piece of paging state.
     *
     * @param mapper row mapper
     * @param <T> target row type
     * @return a new page with mapped rows
     */
    public <T> ReportPage<T> map(Function<R, T> mapper) {
        return new ReportPage<>(rows.stream().map(mapper).toList(), window, sortState, plan, pageList,
                headers, fieldNames, attempts);
    }
}
