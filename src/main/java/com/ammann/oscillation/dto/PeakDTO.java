/* (C)2026 */
package com.ammann.oscillation.dto;

import com.ammann.oscillation.model.Peak;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Cycle peak in the normalized frame")
public record PeakDTO(
        @Schema(description = "Time relative to the first valid zero crossing in microseconds")
        double timeUs,

        @Schema(description = "Smoothed voltage relative to the baseline in volts")
        double voltage
) {
    public static PeakDTO from(Peak peak) {
        return new PeakDTO(peak.timeUs(), peak.voltage());
    }
}
