/* (C)2026 */
package com.ammann.oscillation.dto;

import com.ammann.oscillation.enumeration.PeriodLockMode;
import com.ammann.oscillation.model.AnalysisParameters;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Parameters an analysis ran with")
public record AnalysisParametersDTO(
        @Schema(description = "Moving-average window in samples")
        int smoothingWindow,

        @Schema(description = "Allowed period deviation in percent")
        double periodTolerancePct,

        @Schema(description = "Whether polarity was inverted before smoothing")
        boolean inverted,

        @Schema(description = "Reference period policy of the crossing detector")
        PeriodLockMode lockMode
) {
    public static AnalysisParametersDTO from(AnalysisParameters parameters) {
        return new AnalysisParametersDTO(
                parameters.smoothingWindow(),
                parameters.periodTolerancePct(),
                parameters.invert(),
                parameters.lockMode());
    }
}
