/* (C)2026 */
package com.ammann.oscillation.service;

import com.ammann.oscillation.model.PreprocessedSignal;
import com.ammann.oscillation.model.Trace;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Converts a trace to the microsecond time axis, applies optional polarity inversion and
 * smooths the voltages with a centered moving average.
 */
@ApplicationScoped
public class SignalPreprocessingService
{

    private static final Logger LOG = Logger.getLogger(SignalPreprocessingService.class);

    /**
     * Prepares a trace for crossing detection.
     *
     * @param trace  parsed samples
     * @param invert negate every voltage before smoothing
     * @param window moving-average window in samples
     * @return time, raw and smoothed series of equal length
     */
    public PreprocessedSignal preprocess(Trace trace, boolean invert, int window)
    {
        double[] timeUs = trace.timesMicros();
        double[] raw = trace.voltages();

        if (invert) {
            for (int i = 0; i < raw.length; i++) {
                raw[i] = -raw[i];
            }
        }

        double[] smoothed = smooth(raw, window);

        LOG.debugf("Preprocessed %d samples (window=%d, inverted=%b)", Integer.valueOf(raw.length), Integer.valueOf(window), Boolean.valueOf(invert));
        return new PreprocessedSignal(timeUs, raw, smoothed, invert);
    }

    /**
     * Centered moving average. Sample {@code i} is the mean of samples
     * {@code [i - window/2, i + window/2]} clamped to the series bounds, so the
     * averaging span shrinks at the edges. A window of 1 or less returns an unchanged copy.
     *
     * @param values input series
     * @param window window size in samples
     * @return smoothed series of the same length
     */
    public double[] smooth(double[] values, int window)
    {
        if (window <= 1) {
            return values.clone();
        }

        int half = window / 2;
        double[] smoothed = new double[values.length];

        for (int i = 0; i < values.length; i++) {
            int start = Math.max(0, i - half);
            int end = Math.min(values.length, i + half + 1);
            double sum = 0.0;
            for (int j = start; j < end; j++) {
                sum += values[j];
            }
            smoothed[i] = sum / (end - start);
        }

        return smoothed;
    }
}
