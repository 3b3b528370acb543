package io.github.cyfko.reportwriter.core.engine;

import io.github.cyfko.reportwriter.core.model.PageState;

import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Resolves the requested page index.
 * <p>
 * Missing, non-numeric (anything but ASCII digits) or overflowing input yields page 1; values
 * below 1 are clamped to 1.
 * There is no upper clamp: the number of pages is unknown until a total count is observed,
 * see {@link OverrunRecovery}.
 * </p>
 */
public final class PageStateResolver {

    private static final Logger logger = Logger.getLogger(PageStateResolver.class.getName());

    private static final Pattern ASCII_INTEGER = Pattern.compile("[+-]?[0-9]+");

    private PageStateResolver() {}

    /**
     * @param requestedIndexRaw raw page index from the request, may be {@code null}
     * @param pageSize rows per page, {@code > 0}
     * @param windowSize number of page links in the paging bar, {@code > 0}
     * @return the resolved page state
     * @throws IllegalArgumentException if {@code pageSize} or {@code windowSize} is not positive
     */
    public static PageState resolve(String requestedIndexRaw, int pageSize, int windowSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive. Provided: " + pageSize);
        }
        if (windowSize <= 0) {
            throw new IllegalArgumentException("Window size must be positive. Provided: " + windowSize);
        }
        return new PageState(parseIndex(requestedIndexRaw), pageSize, windowSize);
    }

    private static int parseIndex(String raw) {
        if (raw == null || raw.isBlank()) {
            return 1;
        }
        String trimmed = raw.trim();
        if (!ASCII_INTEGER.matcher(trimmed).matches()) {
            logger.fine(() -> String.format("Ignoring page index '%s', using page 1", raw));
            return 1;
        }
        try {
            return Math.max(1, Integer.parseInt(trimmed));
        } catch (NumberFormatException e) {
            logger.fine(() -> String.format("Ignoring page index '%s', using page 1", raw));
            return 1;
        }
    }
}
