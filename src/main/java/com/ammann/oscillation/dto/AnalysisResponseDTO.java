/* (C)2026 */
package com.ammann.oscillation.dto;

import com.ammann.oscillation.enumeration.AnalysisStatus;
import com.ammann.oscillation.model.AnalysisResult;
import com.ammann.oscillation.model.NormalizedView;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

/**
 * Complete analysis of one trace as returned to API clients.
 *
 * <p>Series, peaks and crossings are in the normalized frame: time is measured from the first
 * valid zero crossing and voltage from the baseline. The un-normalized baseline and average
 * period are included for absolute-coordinate rendering. Fields belonging to stages that did
 * not run are omitted.
 */
@Schema(description = "Damped oscillation analysis of one trace")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResponseDTO(
        @Schema(description = "Outcome of the analysis")
        AnalysisStatus status,

        @Schema(description = "Human-readable description of the outcome")
        String message,

        @Schema(description = "Parameters the analysis ran with")
        AnalysisParametersDTO parameters,

        @Schema(description = "Number of parsed samples")
        Integer sampleCount,

        @Schema(description = "Rising zero crossings before period locking")
        Integer rawCrossingCount,

        @Schema(description = "Zero crossings that survived period locking")
        Integer validCrossingCount,

        @Schema(description = "Baseline (DC level) in volts, un-normalized")
        Double baseline,

        @Schema(description = "Average period over the valid crossings in microseconds, un-normalized")
        Double averagePeriodUs,

        @Schema(description = "Time subtracted during normalization in microseconds")
        Double timeOffsetUs,

        @Schema(description = "Voltage subtracted during normalization in volts")
        Double voltageOffset,

        @Schema(description = "Normalized sample times in microseconds")
        double[] timeUs,

        @Schema(description = "Normalized unsmoothed voltages")
        double[] rawVoltage,

        @Schema(description = "Normalized smoothed voltages")
        double[] smoothedVoltage,

        @Schema(description = "Cycle peaks")
        List<PeakDTO> peaks,

        @Schema(description = "Valid zero crossings")
        List<CrossingDTO> crossings,

        @Schema(description = "Exponential envelope fit")
        FitParamsDTO fit,

        @Schema(description = "Derived physical parameters")
        MetricsDTO metrics,

        @Schema(description = "True when the fitted envelope grows instead of decaying")
        Boolean growingEnvelope,

        @Schema(description = "Fit curve and chart framing")
        ChartDataDTO chart,

        @Schema(description = "Processing time in nanoseconds")
        Long processingTimeNs
) {
    /**
     * Converts a pipeline result to its API representation.
     *
     * @param result        pipeline result
     * @param includeSeries whether to include the per-sample normalized series
     * @return DTO ready for JSON serialization
     */
    public static AnalysisResponseDTO from(AnalysisResult result, boolean includeSeries) {
        NormalizedView view = result.view();
        boolean withSeries = includeSeries && view != null;

        return new AnalysisResponseDTO(
                result.status(),
                result.status().getMessage(),
                AnalysisParametersDTO.from(result.parameters()),
                result.sampleCount(),
                result.rawCrossingCount(),
                result.validCrossingCount(),
                result.baseline(),
                result.averagePeriodUs(),
                view != null ? view.timeOffsetUs() : null,
                view != null ? view.voltageOffset() : null,
                withSeries ? view.timeUs() : null,
                withSeries ? view.rawVoltage() : null,
                withSeries ? view.smoothedVoltage() : null,
                view != null ? view.peaks().stream().map(PeakDTO::from).toList() : null,
                view != null ? view.crossings().stream().map(CrossingDTO::from).toList() : null,
                FitParamsDTO.from(result.fit()),
                MetricsDTO.from(result.metrics()),
                result.fit() != null ? result.growingEnvelope() : null,
                ChartDataDTO.from(result.chart()),
                result.processingTimeNanos()
        );
    }
}
