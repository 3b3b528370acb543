package io.github.cyfko.reportwriter.core.model;

/**
 * Reconciled view of the requested page against an observed total row count.
 * <p>
 * A window is rebuilt for every observed count and never mutated. It is the single source of
 * truth for whether the data query has to be re-run.
 * </p>
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>{@code pageCount = ceil(totalCount / pageSize)}, {@code 0} when {@code totalCount = 0}</li>
 *   <li>{@code valid} iff {@code totalCount = 0} or {@code 1 <= currentIndex <= max(pageCount, 1)}</li>
 * </ul>
 *
 * @param totalCount observed number of rows ({@code >= 0})
 * @param pageCount number of pages for that total
 * @param currentIndex one-based page index the window was built for
 * @param pageSize rows per page
 * @param valid whether {@code currentIndex} exists against {@code totalCount}
 * @throws IllegalArgumentException if {@code pageCount} or {@code valid} contradicts the rules above
 */
public record ResultWindow(long totalCount, int pageCount, int currentIndex, int pageSize, boolean valid) {

    public ResultWindow {
        if (totalCount < 0) {
            throw new IllegalArgumentException("Total count cannot be negative. Provided: " + totalCount);
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive. Provided: " + pageSize);
        }
        int expectedPages = pageCount(totalCount, pageSize);
        if (pageCount != expectedPages) {
            throw new IllegalArgumentException(String.format(
                    "Page count %d does not match %d rows at %d per page (expected %d)",
                    pageCount, totalCount, pageSize, expectedPages));
        }
        if (valid != isValid(totalCount, pageCount, currentIndex)) {
            throw new IllegalArgumentException(String.format(
                    "Validity %b does not match page %d of %d", valid, currentIndex, pageCount));
        }
    }

    /**
     * Builds the window for an observed total.
     *
     * @param totalCount observed number of rows
     * @param pageSize rows per page
     * @param currentIndex one-based page index to validate
     * @return the reconciled window
     * @throws IllegalArgumentException if {@code totalCount < 0} or {@code pageSize <= 0}
     */
    public static ResultWindow of(long totalCount, int pageSize, int currentIndex) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive. Provided: " + pageSize);
        }
        int pageCount = pageCount(totalCount, pageSize);
        boolean valid = isValid(totalCount, pageCount, currentIndex);
        return new ResultWindow(totalCount, pageCount, currentIndex, pageSize, valid);
    }

    private static boolean isValid(long totalCount, int pageCount, int currentIndex) {
        return totalCount == 0 || (currentIndex >= 1 && currentIndex <= Math.max(pageCount, 1));
    }

    /**
     * @param totalCount number of rows
     * @param pageSize rows per page
     * @return {@code ceil(totalCount / pageSize)}, saturated at {@link Integer#MAX_VALUE}
     */
    public static int pageCount(long totalCount, int pageSize) {
        long pages = totalCount / pageSize + (totalCount % pageSize == 0 ? 0 : 1);
        return (int) Math.min(pages, Integer.MAX_VALUE);
    }

    /**
     * Index the request should move to when this window is not valid: the last existing page,
     * or page 1 when there is none.
     *
     * @return corrected one-based index; {@code currentIndex} itself when the window is valid
     */
    public int correctedIndex() {
        if (valid) {
            return currentIndex;
        }
        return pageCount >= 1 ? Math.min(currentIndex, pageCount) : 1;
    }

    /**
     * @return number of rows expected on the current page, {@code 0} when invalid or empty
     */
    public int rowsOnCurrentPage() {
        if (!valid || totalCount == 0) {
            return 0;
        }
        long remaining = totalCount - (long) (currentIndex - 1) * pageSize;
        return (int) Math.min(pageSize, Math.max(remaining, 0));
    }

    /**
     * @return {@code true} if no row matched
     */
    public boolean isEmpty() {
        return totalCount == 0;
    }

    /**
     * @return {@code true} if a page precedes the current one
     */
    public boolean hasPrevious() {
        return pageCount > 0 && currentIndex > 1;
    }

    /**
     * @return {@code true} if a page follows the current one
     */
    public boolean hasNext() {
        return currentIndex < pageCount;
    }
}
