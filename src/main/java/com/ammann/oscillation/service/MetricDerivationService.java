/* (C)2026 */
package com.ammann.oscillation.service;

import com.ammann.oscillation.model.FitParams;
import com.ammann.oscillation.model.Metrics;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Optional;

/**
 * Converts an envelope fit and the average period into physical quantities.
 *
 * <ul>
 *   <li>frequency {@code f = 1 / T}</li>
 *   <li>logarithmic decrement {@code lambda = |beta| * T}, beta per microsecond and T in microseconds</li>
 *   <li>damping coefficient {@code lambda / T} in 1/s, i.e. |beta| rescaled to seconds</li>
 * </ul>
 */
@ApplicationScoped
public class MetricDerivationService
{

    private static final double MICROS_TO_SECONDS = 1e-6;

    /**
     * @param fit           envelope fit, may be null
     * @param avgPeriodUs   average period in microseconds
     * @param peakCount     number of peaks, reported as valid cycle count
     * @return metrics, or empty without a fit or with a non-positive period
     */
    public Optional<Metrics> deriveMetrics(FitParams fit, double avgPeriodUs, int peakCount)
    {
        if (fit == null || !(avgPeriodUs > 0)) {
            return Optional.empty();
        }

        double periodSeconds = avgPeriodUs * MICROS_TO_SECONDS;
        double frequencyHz = 1 / periodSeconds;
        double logDecrement = Math.abs(fit.beta()) * avgPeriodUs;
        double dampingCoefficient = logDecrement / periodSeconds;

        return Optional.of(new Metrics(
                frequencyHz / 1000,
                dampingCoefficient,
                logDecrement,
                avgPeriodUs,
                peakCount));
    }
}
