package io.github.cyfko.reportwriter.spring.pagination;

import io.github.cyfko.reportwriter.core.model.ReportPage;
import io.github.cyfko.reportwriter.core.model.ResultWindow;

/**
 * Immutable record representing report pagination metadata for REST API responses.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ReportPage<Map<String, Object>> page = reportWriter.fetch(parameters, executor);
 * PaginationInfo info = PaginationInfo.from(page);
 * }</pre>
 *
 * @param currentPage   the current 1-based page index
 * @param totalPages    the total number of pages available
 * @param pageSize      the size of each page
 * @param totalElements the total number of rows across all pages
 * @param hasNext       if there is a next page available
 * @param hasPrevious   if there is a previous page
 * @param sortKey       key of the active sort column
 * @param sortDirection active sort direction token ({@code asc} or {@code desc})
 */
public record PaginationInfo(
        int currentPage,
        int totalPages,
        int pageSize,
        long totalElements,
        boolean hasNext,
        boolean hasPrevious,
        String sortKey,
        String sortDirection
) {

    /**
     * Creates a {@link PaginationInfo} instance based on the provided {@link ReportPage}.
     *
     * @param page a reconciled report page
     * @return a populated {@code PaginationInfo} instance
     */
    public static PaginationInfo from(ReportPage<?> page) {
        ResultWindow window = page.window();
        return new PaginationInfo(
                window.currentIndex(),
                window.pageCount(),
                window.pageSize(),
                window.totalCount(),
                window.hasNext(),
                window.hasPrevious(),
                page.sortState().activeKey(),
                page.sortState().direction().token()
        );
    }
}
