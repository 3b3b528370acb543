package io.github.cyfko.reportwriter.spring.pagination;

import io.github.cyfko.reportwriter.core.model.ReportPage;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable record encapsulating the rows of a report page and its pagination metadata.
 *
 * <h2>Usage</h2>
 * <p>
 * Wraps a {@link ReportPage} for JSON responses when the report is consumed by a client-side
 * renderer instead of a server-side template.
 * </p>
 *
 * <h3>Example</h3>
 * <pre>{@code
 * ReportPage<Map<String, Object>> page = reportWriter.fetch(WebRequestParameters.of(request), executor);
 * PaginatedData<PersonDto> response = PaginatedData.of(page, PersonDto::fromRow);
 * }</pre>
 *
 * @param <T> the type of data contained in the page
 */
public record PaginatedData<T>(
        List<T> data,
        PaginationInfo pagination
) {
    /**
     * Creates a paginated data instance with explicit data and pagination info.
     *
     * @param data       the rows of this page
     * @param pagination the pagination metadata
     */
    public PaginatedData(List<T> data, PaginationInfo pagination) {
        this.data = List.copyOf(data);
        this.pagination = pagination;
    }

    /**
     * Creates a paginated data instance from a report page.
     *
     * @param page the report page to convert
     * @param <T>  the row type
     * @return rows and pagination metadata of {@code page}
     */
    public static <T> PaginatedData<T> of(ReportPage<T> page) {
        return new PaginatedData<>(page.rows(), PaginationInfo.from(page));
    }

    /**
     * Transforms the rows to another type, preserving the pagination metadata.
     *
     * @param <R>    the target element type after mapping
     * @param mapper the mapping function to convert rows
     * @return a new {@code PaginatedData} instance with mapped content and original pagination info
     */
    public <R> PaginatedData<R> map(Function<T, R> mapper) {
        return new PaginatedData<>(data.stream().map(mapper).collect(Collectors.toList()), pagination);
    }

    /**
     * Convenience factory method combining conversion and mapping in one step.
     *
     * @param <U>    the source row type
     * @param <R>    the target element type after mapping
     * @param page   the report page to convert and map
     * @param mapper the function to convert rows from U to R
     * @return a new {@code PaginatedData} with mapped content and pagination info
     */
    public static <U, R> PaginatedData<R> of(ReportPage<U> page, Function<U, R> mapper) {
        return new PaginatedData<>(page.rows().stream().map(mapper).collect(Collectors.toList()), PaginationInfo.from(page));
    }
}
