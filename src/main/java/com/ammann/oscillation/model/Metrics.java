/* (C)2026 */
package com.ammann.oscillation.model;

/**
 * Physical quantities derived from the envelope fit and the average period.
 *
 * @param frequencyKhz                oscillation frequency in kHz
 * @param dampingCoefficientPerSecond damping coefficient in 1/s
 * @param logDecrement                logarithmic decrement (dimensionless)
 * @param periodUs                    average period in microseconds
 * @param validCycleCount             number of peaks that entered the analysis
 */
public record Metrics(
        double frequencyKhz,
        double dampingCoefficientPerSecond,
        double logDecrement,
        double periodUs,
        int validCycleCount) {
}
