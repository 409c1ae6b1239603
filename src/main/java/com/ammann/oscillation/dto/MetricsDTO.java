/* (C)2026 */
package com.ammann.oscillation.dto;

import com.ammann.oscillation.model.Metrics;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Physical parameters of the damped oscillation")
public record MetricsDTO(
        @Schema(description = "Oscillation frequency in kHz")
        double frequencyKhz,

        @Schema(description = "Damping coefficient in 1/s")
        double dampingCoefficientPerSecond,

        @Schema(description = "Logarithmic decrement (dimensionless)")
        double logDecrement,

        @Schema(description = "Average period in microseconds")
        double periodUs,

        @Schema(description = "Number of cycles whose peaks entered the fit")
        int validCycleCount
) {
    public static MetricsDTO from(Metrics metrics) {
        return metrics == null ? null : new MetricsDTO(
                metrics.frequencyKhz(),
                metrics.dampingCoefficientPerSecond(),
                metrics.logDecrement(),
                metrics.periodUs(),
                metrics.validCycleCount());
    }
}
