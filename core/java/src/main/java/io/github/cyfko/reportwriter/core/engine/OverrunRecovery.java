package io.github.cyfko.reportwriter.core.engine;

import io.github.cyfko.reportwriter.core.model.PageState;
import io.github.cyfko.reportwriter.core.model.ResultWindow;

import java.util.Objects;

/**
 * Reconciles the requested page against a freshly observed total row count.
 * <p>
 * When the requested page no longer exists (an <em>overrun</em>), the reconciliation carries
 * the corrected page state: the last existing page, or page 1 when there is none. The caller
 * re-plans and re-runs the data query with it. At most {@link #MAX_ATTEMPTS} query attempts are
 * made per request; a request still overrunning after that fails with
 * {@link io.github.cyfko.reportwriter.core.exception.OverrunExhaustedException}.
 * </p>
 *
 * <p>An empty result set is always valid: it yields zero rows and no retry.</p>
 */
public final class OverrunRecovery {

    /** Total query attempts allowed per request, the first one included. */
    public static final int MAX_ATTEMPTS = 3;

    private OverrunRecovery() {}

    /**
     * @param observedTotalCount total number of rows observed by the last query attempt
     * @param pageState page state that attempt was planned with
     * @return the window and the retry decision
     * @throws IllegalArgumentException if {@code observedTotalCount} is negative
     */
    public static Reconciliation reconcile(long observedTotalCount, PageState pageState) {
        Objects.requireNonNull(pageState, "pageState cannot be null");

        ResultWindow window = ResultWindow.of(observedTotalCount, pageState.pageSize(), pageState.requestedIndex());
        if (window.valid()) {
            return new Reconciliation(window, Outcome.VALID, pageState);
        }
        return new Reconciliation(window, Outcome.RETRY, pageState.withIndex(window.correctedIndex()));
    }

    /**
     * @param attempts query attempts performed so far
     * @return {@code true} if another attempt is allowed
     */
    public static boolean canRetry(int attempts) {
        return attempts < MAX_ATTEMPTS;
    }

    /**
     * Decision taken for an observed count.
     */
    public enum Outcome {
        /** The requested page exists; its rows can be rendered. */
        VALID,
        /** The requested page overran the result set; re-run with the corrected state. */
        RETRY
    }

    /**
     * @param window window reconciled against the observed count
     * @param outcome retry decision
     * @param correctedState state to re-plan with; the input state when {@link Outcome#VALID}
     */
    public record Reconciliation(ResultWindow window, Outcome outcome, PageState correctedState) {

        public boolean isValid() {
            return outcome == Outcome.VALID;
        }
    }
}
