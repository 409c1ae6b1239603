/* (C)2026 */
package com.ammann.oscillation.model;

import com.ammann.oscillation.enumeration.AnalysisStatus;

import java.util.List;

/**
 * Everything one pipeline invocation produced.
 *
 * <p>Fields belonging to stages that did not run are {@code null}: {@code view},
 * {@code baseline} and {@code chart} for an empty trace, {@code fit} when the envelope
 * could not be fitted, {@code metrics} unless the status is {@link AnalysisStatus#COMPLETE}.
 *
 * @param status            outcome of the invocation
 * @param parameters        parameters the invocation ran with
 * @param sampleCount       number of parsed samples
 * @param rawCrossingCount  rising crossings before period locking
 * @param baseline          un-normalized baseline in volts
 * @param averagePeriodUs   mean period over the valid crossings, 0 when undefined
 * @param peaks             un-normalized peaks
 * @param view              zero-referenced series, peaks and valid crossings
 * @param fit               envelope fit, offset equal to the un-normalized baseline
 * @param metrics           derived physical quantities
 * @param chart             fit curve and axis framing for display
 * @param processingTimeNanos wall time of the invocation
 */
public record AnalysisResult(
        AnalysisStatus status,
        AnalysisParameters parameters,
        int sampleCount,
        int rawCrossingCount,
        Double baseline,
        double averagePeriodUs,
        List<Peak> peaks,
        NormalizedView view,
        FitParams fit,
        Metrics metrics,
        ChartData chart,
        long processingTimeNanos) {

    public AnalysisResult {
        peaks = peaks == null ? List.of() : List.copyOf(peaks);
    }

    /**
     * Creates the result of an invocation that stopped after parsing.
     */
    public static AnalysisResult emptyInput(AnalysisParameters parameters, long processingTimeNanos) {
        return new AnalysisResult(AnalysisStatus.EMPTY_INPUT, parameters, 0, 0, null, 0.0,
                List.of(), null, null, null, null, processingTimeNanos);
    }

    public int validCrossingCount() {
        return view == null ? 0 : view.crossings().size();
    }

    public boolean growingEnvelope() {
        return fit != null && fit.isGrowing();
    }
}
