/* (C)2026 */
package com.ammann.oscillation.service;

import com.ammann.oscillation.model.Crossing;
import com.ammann.oscillation.model.Peak;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds one peak per validated cycle.
 */
@ApplicationScoped
public class PeakExtractionService
{

    private static final Logger LOG = Logger.getLogger(PeakExtractionService.class);

    /**
     * For each pair of consecutive valid crossings, takes the maximum smoothed sample between
     * their sample indices (inclusive). The first of several equal maxima wins. A peak is kept
     * only if it lies strictly above the baseline.
     *
     * @return peaks in time order, at most {@code validCrossings.size() - 1}
     */
    public List<Peak> extractPeaks(double[] timeUs, double[] smoothed, List<Crossing> validCrossings, double baseline)
    {
        if (validCrossings.size() < 2) {
            return List.of();
        }

        List<Peak> peaks = new ArrayList<>(validCrossings.size() - 1);

        for (int i = 0; i < validCrossings.size() - 1; i++) {
            int startIdx = validCrossings.get(i).sampleIndex();
            int endIdx = validCrossings.get(i + 1).sampleIndex();

            double maxValue = Double.NEGATIVE_INFINITY;
            int maxIdx = -1;
            for (int j = startIdx; j <= endIdx; j++) {
                if (smoothed[j] > maxValue) {
                    maxValue = smoothed[j];
                    maxIdx = j;
                }
            }

            if (maxIdx != -1 && maxValue > baseline) {
                peaks.add(new Peak(timeUs[maxIdx], maxValue));
            }
        }

        LOG.debugf("Extracted %d peaks from %d valid cycles", peaks.size(), validCrossings.size() - 1);
        return peaks;
    }
}
