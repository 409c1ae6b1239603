/* (C)2026 */
package com.ammann.oscillation.service;

import com.ammann.oscillation.model.Crossing;
import com.ammann.oscillation.model.NormalizedView;
import com.ammann.oscillation.model.Peak;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

/**
 * Rebases an analysis to a zero-referenced frame: the first valid crossing becomes t = 0 and
 * the baseline becomes 0 V.
 */
@ApplicationScoped
public class NormalizationService
{

    /**
     * Shifts all series, peaks and crossings by the time and voltage offsets. Without valid
     * crossings the first sample time is used as time offset so the axis stays defined.
     */
    public NormalizedView normalize(
            double[] timeUs,
            double[] rawVoltage,
            double[] smoothed,
            List<Peak> peaks,
            List<Crossing> validCrossings,
            double baseline)
    {
        double timeOffset = timeOffset(timeUs, validCrossings);

        return new NormalizedView(
                shift(timeUs, timeOffset),
                shift(rawVoltage, baseline),
                shift(smoothed, baseline),
                peaks.stream().map(p -> p.shiftedBy(timeOffset, baseline)).toList(),
                validCrossings.stream().map(c -> c.shiftedBy(timeOffset)).toList(),
                timeOffset,
                baseline);
    }

    double timeOffset(double[] timeUs, List<Crossing> validCrossings)
    {
        if (!validCrossings.isEmpty()) {
            return validCrossings.get(0).timeUs();
        }
        return timeUs.length > 0 ? timeUs[0] : 0.0;
    }

    private static double[] shift(double[] values, double offset)
    {
        double[] shifted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            shifted[i] = values[i] - offset;
        }
        return shifted;
    }
}
