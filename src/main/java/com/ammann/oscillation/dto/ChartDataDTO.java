/* (C)2026 */
package com.ammann.oscillation.dto;

import com.ammann.oscillation.model.ChartData;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Fit curve and axis framing sufficient to redraw the analysis chart")
public record ChartDataDTO(
        @Schema(description = "Sampled fit-curve times in microseconds (normalized)")
        double[] fitTimeUs,

        @Schema(description = "Fit-curve voltages relative to the baseline")
        double[] fitVoltage,

        @Schema(description = "Time axis lower bound in microseconds")
        double timeMinUs,

        @Schema(description = "Time axis upper bound in microseconds")
        double timeMaxUs,

        @Schema(description = "Voltage axis lower bound, padded by 10 percent of the span")
        double voltageMin,

        @Schema(description = "Voltage axis upper bound, padded by 10 percent of the span")
        double voltageMax,

        @Schema(description = "Time of the last valid crossing, where period locking stopped")
        double cutoffTimeUs
) {
    public static ChartDataDTO from(ChartData chart) {
        return chart == null ? null : new ChartDataDTO(
                chart.fitTimeUs(),
                chart.fitVoltage(),
                chart.timeMinUs(),
                chart.timeMaxUs(),
                chart.voltageMin(),
                chart.voltageMax(),
                chart.cutoffTimeUs());
    }
}
