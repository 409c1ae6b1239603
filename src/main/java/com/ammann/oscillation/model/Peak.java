/* (C)2026 */
package com.ammann.oscillation.model;

/**
 * Maximum of the smoothed signal within one validated cycle.
 *
 * @param timeUs  time of the maximum sample in microseconds
 * @param voltage smoothed voltage at that sample
 */
public record Peak(double timeUs, double voltage) {

    public Peak shiftedBy(double timeOffsetUs, double voltageOffset) {
        return new Peak(timeUs - timeOffsetUs, voltage - voltageOffset);
    }
}
