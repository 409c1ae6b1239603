/* (C)2026 */
package com.ammann.oscillation.model;

import com.ammann.oscillation.enumeration.PeriodLockMode;

/**
 * Tunable inputs of one pipeline invocation. Together with the trace identity this is the
 * complete key of an analysis result.
 *
 * @param smoothingWindow    moving-average window in samples
 * @param periodTolerancePct allowed period deviation in percent of the reference period
 * @param invert             negate every voltage before smoothing
 * @param lockMode           reference period policy of the crossing detector
 */
public record AnalysisParameters(
        int smoothingWindow,
        double periodTolerancePct,
        boolean invert,
        PeriodLockMode lockMode) {

    public AnalysisParameters {
        if (lockMode == null) {
            lockMode = PeriodLockMode.FIRST_PERIOD;
        }
    }

    public AnalysisParameters(int smoothingWindow, double periodTolerancePct, boolean invert) {
        this(smoothingWindow, periodTolerancePct, invert, PeriodLockMode.FIRST_PERIOD);
    }

    public static AnalysisParameters defaults() {
        return new AnalysisParameters(10, 10.0, false);
    }
}
