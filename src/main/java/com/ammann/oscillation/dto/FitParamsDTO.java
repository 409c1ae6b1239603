/* (C)2026 */
package com.ammann.oscillation.dto;

import com.ammann.oscillation.model.FitParams;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Envelope fit {@code y(t) = A * exp(beta * t) + C}, with t in microseconds since the
 * first valid crossing.
 */
@Schema(description = "Exponential envelope fit y(t) = A*exp(beta*t) + C")
public record FitParamsDTO(
        @Schema(description = "Envelope amplitude above the baseline at the first valid crossing, in volts")
        double amplitude,

        @Schema(description = "Exponential rate per microsecond, negative for a decaying envelope")
        double betaPerMicrosecond,

        @Schema(description = "Baseline offset in volts (un-normalized)")
        double offset
) {
    public static FitParamsDTO from(FitParams fit) {
        return fit == null ? null : new FitParamsDTO(fit.amplitude(), fit.beta(), fit.offset());
    }
}
