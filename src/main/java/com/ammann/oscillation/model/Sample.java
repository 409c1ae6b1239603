/* (C)2026 */
package com.ammann.oscillation.model;

/**
 * One parsed oscilloscope reading.
 *
 * @param timeSeconds sample time as written in the source file, in seconds
 * @param voltage     sample voltage in volts (mean of min/max for envelope rows)
 */
public record Sample(double timeSeconds, double voltage) {
}
