/* (C)2026 */
package com.ammann.oscillation.model;

import java.util.List;

/**
 * Zero-referenced view of one analysis: time starts at the first valid crossing,
 * voltage is measured relative to the baseline.
 *
 * <p>The normalized baseline is 0 by construction and is not stored.
 */
public record NormalizedView(
        double[] timeUs,
        double[] rawVoltage,
        double[] smoothedVoltage,
        List<Peak> peaks,
        List<Crossing> crossings,
        double timeOffsetUs,
        double voltageOffset) {

    public NormalizedView {
        peaks = List.copyOf(peaks);
        crossings = List.copyOf(crossings);
    }

    public double lastTimeUs() {
        return timeUs.length == 0 ? 0.0 : timeUs[timeUs.length - 1];
    }
}
