/* (C)2026 */
package com.ammann.oscillation.model;

/**
 * Sample-aligned series produced by the preprocessor.
 *
 * <p>The arrays are owned by one pipeline invocation and must not be modified by later stages.
 *
 * @param timeUs          sample times in microseconds
 * @param rawVoltage      voltages after optional inversion, before smoothing
 * @param smoothedVoltage moving-average smoothed voltages
 * @param inverted        whether polarity inversion was applied
 */
public record PreprocessedSignal(
        double[] timeUs,
        double[] rawVoltage,
        double[] smoothedVoltage,
        boolean inverted) {

    public int size() {
        return timeUs.length;
    }
}
