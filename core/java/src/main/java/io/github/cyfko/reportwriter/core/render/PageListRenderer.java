package io.github.cyfko.reportwriter.core.render;

import io.github.cyfko.reportwriter.core.api.RequestParameters;
import io.github.cyfko.reportwriter.core.config.PagingConfig;
import io.github.cyfko.reportwriter.core.model.PageLink;
import io.github.cyfko.reportwriter.core.model.PageList;
import io.github.cyfko.reportwriter.core.model.ResultWindow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the paging bar of a report page.
 * <p>
 * The bar holds up to {@code windowSize} numbered entries centered on the current page and
 * shifted at either end so that it stays full whenever enough pages exist, preceded by
 * first/previous entries when a previous page exists and followed by next/last entries when a
 * next page exists. No entry ever targets a page outside {@code [1, pageCount]}; an empty result
 * set produces an empty bar.
 * </p>
 *
 * <p>Each link carries the incoming request parameters with the page variable overridden, so
 * the sort and any caller-owned parameter survive paging.</p>
 *
 * <pre>{@code
 * // 12 pages, current page 6, window of 5
 * // « ‹ 4 5 [6] 7 8 › »
 * PageList bar = PageListRenderer.render(ResultWindow.of(120, 10, 6), 5);
 * }</pre>
 */
public final class PageListRenderer {

    private PageListRenderer() {}

    /**
     * Renders the bar with default labels and no extra link parameters.
     *
     * @param window reconciled window
     * @param windowSize maximum number of numbered entries, {@code > 0}
     * @return the paging bar
     */
    public static PageList render(ResultWindow window, int windowSize) {
        return render(window, windowSize, PagingConfig.defaults(), RequestParameters.empty());
    }

    /**
     * @param window reconciled window
     * @param windowSize maximum number of numbered entries, {@code > 0}
     * @param config labels and page variable name
     * @param request incoming parameters to carry along in each link
     * @return the paging bar
     * @throws IllegalArgumentException if {@code windowSize} is not positive
     */
    public static PageList render(ResultWindow window, int windowSize, PagingConfig config, RequestParameters request) {
        Objects.requireNonNull(window, "window cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(request, "request cannot be null");
        if (windowSize <= 0) {
            throw new IllegalArgumentException("Window size must be positive. Provided: " + windowSize);
        }

        int pageCount = window.pageCount();
        if (pageCount == 0) {
            return new PageList(List.of(), false, false, 0, 0);
        }

        int current = Math.max(1, Math.min(window.currentIndex(), pageCount));
        // long arithmetic: current + windowSize may exceed Integer.MAX_VALUE
        long start = (long) current - (windowSize - 1) / 2;
        long end = start + windowSize - 1;
        if (end > pageCount) {
            end = pageCount;
            start = end - windowSize + 1;
        }
        if (start < 1) {
            start = 1;
            end = Math.min(pageCount, windowSize);
        }

        boolean hasPrevious = current > 1;
        boolean hasNext = current < pageCount;
        List<PageLink> links = new ArrayList<>();

        if (hasPrevious) {
            links.add(link(PageLink.Kind.FIRST, config.getFirstLabel(), 1, false, config, request));
            links.add(link(PageLink.Kind.PREVIOUS, config.getPreviousLabel(), current - 1, false, config, request));
        }
        for (long index = start; index <= end; index++) {
            int page = (int) index;
            links.add(link(PageLink.Kind.PAGE, String.valueOf(page), page, page == current, config, request));
        }
        if (hasNext) {
            links.add(link(PageLink.Kind.NEXT, config.getNextLabel(), current + 1, false, config, request));
            links.add(link(PageLink.Kind.LAST, config.getLastLabel(), pageCount, false, config, request));
        }

        return new PageList(links, hasPrevious, hasNext, 1, pageCount);
    }

    private static PageLink link(PageLink.Kind kind, String label, int target, boolean current,
                                 PagingConfig config, RequestParameters request) {
        Map<String, String> parameters = new LinkedHashMap<>(request.asMap());
        parameters.put(config.getPageVariable(), String.valueOf(target));
        return new PageLink(kind, label, target, current, parameters);
    }
}
