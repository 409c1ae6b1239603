/* (C)2026 */
package com.ammann.oscillation.service;

import com.ammann.oscillation.model.FitParams;
import com.ammann.oscillation.model.Peak;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Fits the exponential envelope {@code y = A * exp(beta * t) + C} to a peak sequence.
 *
 * <p>C is fixed to the baseline, which turns the model into a straight line
 * {@code ln(y - C) = ln(A) + beta * t} solved by ordinary least squares. Peaks at or below C
 * have no logarithm and are left out. The sign of beta is not enforced: a positive value
 * means a growing envelope and is returned as computed.
 */
@ApplicationScoped
public class EnvelopeFitService
{

    private static final Logger LOG = Logger.getLogger(EnvelopeFitService.class);

    static final int MIN_PEAKS = 2;

    /**
     * @param peaks    peak times (microseconds) and voltages
     * @param baseline fixed offset C
     * @return the fit, or empty when fewer than two peaks lie above the baseline or all of
     *         them share the same time
     */
    public Optional<FitParams> fitEnvelope(List<Peak> peaks, double baseline)
    {
        if (peaks.size() < MIN_PEAKS) {
            return Optional.empty();
        }

        double sumT = 0.0;
        double sumLnY = 0.0;
        double sumTLnY = 0.0;
        double sumT2 = 0.0;
        int count = 0;

        for (Peak peak : peaks) {
            if (peak.voltage() > baseline) {
                double t = peak.timeUs();
                double lnY = Math.log(peak.voltage() - baseline);
                sumT += t;
                sumLnY += lnY;
                sumTLnY += t * lnY;
                sumT2 += t * t;
                count++;
            }
        }

        if (count < MIN_PEAKS) {
            LOG.debugf("Envelope fit unavailable: %d of %d peaks above baseline", count, peaks.size());
            return Optional.empty();
        }

        double denominator = count * sumT2 - sumT * sumT;
        if (denominator == 0.0) {
            LOG.debug("Envelope fit unavailable: all qualifying peaks share the same time");
            return Optional.empty();
        }

        double beta = (count * sumTLnY - sumT * sumLnY) / denominator;
        double lnA = (sumLnY - beta * sumT) / count;
        double amplitude = Math.exp(lnA);

        LOG.debugf("Envelope fit over %d peaks: A=%.6f, beta=%.6e 1/us, C=%.6f", count, amplitude, beta, baseline);
        return Optional.of(new FitParams(amplitude, beta, baseline));
    }

    /**
     * Number of peaks strictly above the baseline, i.e. the peaks a fit can use.
     */
    public int countQualifyingPeaks(List<Peak> peaks, double baseline)
    {
        return (int) peaks.stream().filter(p -> p.voltage() > baseline).count();
    }
}
