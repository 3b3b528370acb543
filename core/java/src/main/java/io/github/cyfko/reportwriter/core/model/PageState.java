package io.github.cyfko.reportwriter.core.model;

/**
 * Page state of a single request.
 * <p>
 * {@code requestedIndex} is one-based and comes from untrusted input: it is at least 1 but may
 * still exceed the number of pages, which is only known once a total count is observed.
 * </p>
 *
 * @param requestedIndex one-based page index ({@code >= 1})
 * @param pageSize rows per page ({@code > 0})
 * @param windowSize number of page links shown around the current page ({@code >= 1})
 *
 * @throws IllegalArgumentException if any component is out of range
 */
public record PageState(int requestedIndex, int pageSize, int windowSize) {

    public PageState {
        if (requestedIndex < 1) {
            throw new IllegalArgumentException("Page index must be at least 1. Provided: " + requestedIndex);
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive. Provided: " + pageSize);
        }
        if (windowSize <= 0) {
            throw new IllegalArgumentException("Window size must be positive. Provided: " + windowSize);
        }
    }

    /**
     * @param index corrected one-based index
     * @return a copy of this state targeting {@code index}
     */
    public PageState withIndex(int index) {
        return new PageState(index, pageSize, windowSize);
    }

    /**
     * Zero-based row offset of the requested page.
     * <p>Example: {@code requestedIndex=3, pageSize=20} → {@code offset=40}</p>
     *
     * @return {@code (requestedIndex - 1) * pageSize}, computed as a {@code long}
     */
    public long offset() {
        return (long) (requestedIndex - 1) * pageSize;
    }
}
