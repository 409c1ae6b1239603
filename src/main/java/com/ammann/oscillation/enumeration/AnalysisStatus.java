/* (C)2026 */
package com.ammann.oscillation.enumeration;

/**
 * Outcome of one pipeline invocation.
 *
 * <p>Every non-complete status short-circuits only the stages that depend on the missing
 * value: an empty trace halts everything, missing crossings still allow the raw and
 * smoothed series to be displayed, and a missing fit still allows crossings and baseline.
 */
public enum AnalysisStatus
{
    /** Fit and metrics are available. */
    COMPLETE("Analysis complete", false),
    /** The parser found no numeric rows. */
    EMPTY_INPUT("No valid numeric data found", true),
    /** Fewer than two rising crossings through the baseline. */
    INSUFFICIENT_CROSSINGS("Fewer than two zero crossings detected; results are low-confidence", false),
    /** Fewer than two peaks above the baseline. */
    INSUFFICIENT_PEAKS("Signal unstable or insufficient cycles. Increase the period tolerance or check the inversion", false),
    /** All qualifying peaks share the same time, the regression has no solution. */
    DEGENERATE_FIT("Signal unstable or insufficient cycles. Increase the period tolerance or check the inversion", false),
    /** A fit exists but the average period is not positive (non-monotonic time column). */
    UNDEFINED_PERIOD("Average period is not positive; check that the time column increases", false);

    private final String message;
    private final boolean halting;

    AnalysisStatus(String message, boolean halting) {
        this.message = message;
        this.halting = halting;
    }

    public String getMessage() { return message; }

    /**
     * Returns true when no stage after parsing ran.
     */
    public boolean isHalting() { return halting; }

    public boolean hasMetrics() { return this == COMPLETE; }
}
