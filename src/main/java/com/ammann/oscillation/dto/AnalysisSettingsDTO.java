/* (C)2026 */
package com.ammann.oscillation.dto;

import com.ammann.oscillation.config.AnalysisSettings;
import com.ammann.oscillation.enumeration.PeriodLockMode;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

@Schema(description = "Defaults and accepted ranges of the tunable analysis parameters")
public record AnalysisSettingsDTO(
        int defaultSmoothingWindow,
        int minSmoothingWindow,
        int maxSmoothingWindow,
        double defaultPeriodTolerancePct,
        double minPeriodTolerancePct,
        double maxPeriodTolerancePct,
        List<PeriodLockMode> lockModes,
        int maxBatchTraces
) {
    public static AnalysisSettingsDTO from(AnalysisSettings settings) {
        return new AnalysisSettingsDTO(
                settings.getDefaultSmoothingWindow(),
                settings.getMinSmoothingWindow(),
                settings.getMaxSmoothingWindow(),
                settings.getDefaultPeriodTolerancePct(),
                settings.getMinPeriodTolerancePct(),
                settings.getMaxPeriodTolerancePct(),
                List.of(PeriodLockMode.values()),
                settings.getMaxBatchTraces());
    }
}
