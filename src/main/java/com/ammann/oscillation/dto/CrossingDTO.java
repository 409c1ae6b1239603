/* (C)2026 */
package com.ammann.oscillation.dto;

import com.ammann.oscillation.model.Crossing;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Validated rising zero crossing in the normalized frame")
public record CrossingDTO(
        @Schema(description = "Interpolated crossing time relative to the first valid crossing in microseconds")
        double timeUs,

        @Schema(description = "Index of the sample immediately preceding the crossing")
        int sampleIndex
) {
    public static CrossingDTO from(Crossing crossing) {
        return new CrossingDTO(crossing.timeUs(), crossing.sampleIndex());
    }
}
