/* (C)2026 */
package com.ammann.oscillation.model;

/**
 * A rising crossing of the smoothed signal through the baseline.
 *
 * @param timeUs      linearly interpolated crossing time in microseconds
 * @param sampleIndex index of the smoothed sample immediately preceding the crossing
 */
public record Crossing(double timeUs, int sampleIndex) {

    /**
     * Returns a copy shifted along the time axis, keeping the sample index.
     */
    public Crossing shiftedBy(double offsetUs) {
        return new Crossing(timeUs - offsetUs, sampleIndex);
    }
}
