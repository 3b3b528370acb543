package io.github.cyfko.reportwriter.core.exception;

import io.github.cyfko.reportwriter.core.model.ResultWindow;

/**
 * Exception thrown when a requested page keeps overrunning the live result set.
 * <p>
 * Every query attempt observes a fresh total row count. When the requested page lies beyond
 * that total, the page is corrected and the data query is re-run. If the page is still out of
 * range once the attempt bound is reached, the result set is shrinking concurrently with the
 * paginated read and the request fails with this exception instead of looping.
 * </p>
 *
 * <p>The exception is never retried by the library; callers should surface it as a distinct,
 * unrecoverable request failure.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class OverrunExhaustedException extends RuntimeException {

    private final int requestedIndex;
    private final ResultWindow lastWindow;
    private final int attempts;

    /**
     * Creates a new exception describing the exhausted reconciliation.
     *
     * @param requestedIndex the page index originally requested
     * @param lastWindow the window reconciled against the last observed count
     * @param attempts number of query attempts performed
     */
    public OverrunExhaustedException(int requestedIndex, ResultWindow lastWindow, int attempts) {
        super(String.format(
                "Unrecoverable paging error: page %d still out of range after %d query attempts " +
                        "(last observed total=%d, pages=%d). Is the result set changing?",
                requestedIndex, attempts, lastWindow.totalCount(), lastWindow.pageCount()));
        this.requestedIndex = requestedIndex;
        this.lastWindow = lastWindow;
        this.attempts = attempts;
    }

    /**
     * @return the page index originally requested by the client
     */
    public int getRequestedIndex() {
        return requestedIndex;
    }

    /**
     * @return the window reconciled against the last observed count
     */
    public ResultWindow getLastWindow() {
        return lastWindow;
    }

    /**
     * @return number of query attempts performed before giving up
     */
    public int getAttempts() {
        return attempts;
    }
}
