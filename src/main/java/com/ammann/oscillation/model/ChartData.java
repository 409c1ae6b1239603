/* (C)2026 */
package com.ammann.oscillation.model;

/**
 * Plain numeric arrays sufficient to redraw the analysis chart deterministically,
 * in the normalized frame.
 *
 * @param fitTimeUs    sampled fit-curve times, empty when no fit is available
 * @param fitVoltage   fit-curve values at {@code fitTimeUs}
 * @param timeMinUs    lower bound of the time axis
 * @param timeMaxUs    upper bound of the time axis
 * @param voltageMin   lower bound of the voltage axis, padded
 * @param voltageMax   upper bound of the voltage axis, padded
 * @param cutoffTimeUs time of the last valid crossing, where period locking stopped
 */
public record ChartData(
        double[] fitTimeUs,
        double[] fitVoltage,
        double timeMinUs,
        double timeMaxUs,
        double voltageMin,
        double voltageMax,
        double cutoffTimeUs) {
}
