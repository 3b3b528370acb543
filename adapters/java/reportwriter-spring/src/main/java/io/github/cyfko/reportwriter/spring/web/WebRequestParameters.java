package io.github.cyfko.reportwriter.spring.web;

import io.github.cyfko.reportwriter.core.api.RequestParameters;
import org.springframework.web.context.request.WebRequest;

import java.util.Objects;

/**
 * Binds the parameters of a Spring {@link WebRequest} to {@link RequestParameters}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * @GetMapping("/reports/people")
 * public PaginatedData<Map<String, Object>> people(WebRequest request) {
 *     ReportPage<Map<String, Object>> page = reportWriter.fetch(WebRequestParameters.of(request), executor);
 *     return PaginatedData.of(page);
 * }
 * }</pre>
 */
public final class WebRequestParameters {

    private WebRequestParameters() {}

    /**
     * @param request current web request
     * @return a snapshot of its parameters, first value of each
     */
    public static RequestParameters of(WebRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        return RequestParameters.ofMultiValued(request.getParameterMap());
    }
}
