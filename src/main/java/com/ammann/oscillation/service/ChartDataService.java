/* (C)2026 */
package com.ammann.oscillation.service;

import com.ammann.oscillation.model.ChartData;
import com.ammann.oscillation.model.FitParams;
import com.ammann.oscillation.model.NormalizedView;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Builds the numeric data a chart or report renderer needs to redraw an analysis:
 * the sampled envelope curve, axis ranges and the period-lock cutoff marker.
 *
 * <p>Everything is expressed in the normalized frame, where the envelope reduces to
 * {@code A * exp(beta * t)}.
 */
@ApplicationScoped
public class ChartDataService
{

    static final int DEFAULT_CURVE_SEGMENTS = 200;
    private static final double RANGE_PADDING = 0.1;

    @ConfigProperty(name = "oscillation.analysis.fit-curve.points", defaultValue = "200")
    int curveSegments = DEFAULT_CURVE_SEGMENTS;

    /**
     * @param view normalized analysis, never null
     * @param fit  envelope fit, null when unavailable
     */
    public ChartData build(NormalizedView view, FitParams fit)
    {
        double[] fitTime = new double[0];
        double[] fitVoltage = new double[0];

        if (fit != null && !view.peaks().isEmpty()) {
            fitTime = sampleTimes(view.peaks().get(0).timeUs(), view.lastTimeUs());
            fitVoltage = new double[fitTime.length];
            for (int i = 0; i < fitTime.length; i++) {
                fitVoltage[i] = fit.amplitude() * Math.exp(fit.beta() * fitTime[i]);
            }
        }

        double yMin = Double.POSITIVE_INFINITY;
        double yMax = Double.NEGATIVE_INFINITY;
        for (double v : view.smoothedVoltage()) {
            yMin = Math.min(yMin, v);
            yMax = Math.max(yMax, v);
        }
        for (double v : fitVoltage) {
            yMin = Math.min(yMin, v);
            yMax = Math.max(yMax, v);
        }
        if (yMin > yMax) {
            yMin = 0.0;
            yMax = 0.0;
        }
        double padding = (yMax - yMin) * RANGE_PADDING;
        if (padding == 0.0) {
            padding = 1.0;
        }

        double timeMax = 0.0;
        for (double t : view.timeUs()) {
            timeMax = Math.max(timeMax, t);
        }

        double cutoff = view.crossings().isEmpty()
                ? (view.timeUs().length > 0 ? view.timeUs()[0] : 0.0)
                : view.crossings().get(view.crossings().size() - 1).timeUs();

        return new ChartData(fitTime, fitVoltage, 0.0, timeMax, yMin - padding, yMax + padding, cutoff);
    }

    /**
     * Equally spaced times from {@code start} to {@code end}, both inclusive. A single point
     * is returned when the interval is empty.
     */
    double[] sampleTimes(double start, double end)
    {
        int segments = Math.max(1, curveSegments);
        if (!(end > start)) {
            return new double[] {start};
        }

        double step = (end - start) / segments;
        double[] times = new double[segments + 1];
        for (int i = 0; i < segments; i++) {
            times[i] = start + i * step;
        }
        times[segments] = end;
        return times;
    }
}
