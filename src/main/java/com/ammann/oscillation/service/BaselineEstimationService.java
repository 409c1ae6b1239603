/* (C)2026 */
package com.ammann.oscillation.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.OptionalDouble;

/**
 * Estimates the steady-state (DC) level of a decaying oscillation from the tail of the
 * smoothed series.
 *
 * <p>Strongly damped signals start with a large transient, so the mean of the whole series is
 * biased. The tail, once the oscillation has settled, is used instead: the last 20 % of the
 * samples, but never fewer than 10 (or all of them for shorter series).
 */
@ApplicationScoped
public class BaselineEstimationService
{

    private static final Logger LOG = Logger.getLogger(BaselineEstimationService.class);

    static final double TAIL_FRACTION = 0.20;
    static final int MIN_TAIL_SAMPLES = 10;

    /**
     * @param smoothed smoothed voltage series
     * @return the tail mean, or empty when the series has no samples
     */
    public OptionalDouble estimateBaseline(double[] smoothed)
    {
        if (smoothed.length == 0) {
            return OptionalDouble.empty();
        }

        int tailCount = Math.min(tailSampleCount(smoothed.length), smoothed.length);
        double sum = 0.0;
        for (int i = smoothed.length - tailCount; i < smoothed.length; i++) {
            sum += smoothed[i];
        }
        double baseline = sum / tailCount;

        LOG.debugf("Baseline %.6f V from last %d of %d samples", baseline, tailCount, smoothed.length);
        return OptionalDouble.of(baseline);
    }

    static int tailSampleCount(int sampleCount)
    {
        return Math.max((int) Math.floor(sampleCount * TAIL_FRACTION), MIN_TAIL_SAMPLES);
    }
}
