/* (C)2026 */
package com.ammann.oscillation.service;

import com.ammann.oscillation.enumeration.PeriodLockMode;
import com.ammann.oscillation.model.Crossing;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects rising crossings of the smoothed signal through the baseline and validates the
 * run of crossings whose periods stay within tolerance of a reference period.
 *
 * <p>Period locking stops at the first crossing outside the tolerance; later crossings are
 * discarded even if they would match again. A deviation equal to the allowed deviation is
 * still accepted.
 */
@ApplicationScoped
public class ZeroCrossingService
{

    private static final Logger LOG = Logger.getLogger(ZeroCrossingService.class);

    /**
     * Detects and validates crossings using the first measured period as reference.
     *
     * @param timeUs       sample times in microseconds
     * @param smoothed     smoothed voltages
     * @param baseline     crossing level
     * @param tolerancePct allowed period deviation in percent of the reference period
     * @return the validated crossings, empty when fewer than two crossings exist
     */
    public List<Crossing> detectCrossings(double[] timeUs, double[] smoothed, double baseline, double tolerancePct)
    {
        return lockPeriod(findRisingCrossings(timeUs, smoothed, baseline), tolerancePct, PeriodLockMode.FIRST_PERIOD);
    }

    /**
     * Finds every rising crossing, i.e. every {@code i} with
     * {@code smoothed[i] <= baseline < smoothed[i + 1]}, with the crossing time linearly
     * interpolated between the two samples.
     */
    public List<Crossing> findRisingCrossings(double[] timeUs, double[] smoothed, double baseline)
    {
        List<Crossing> crossings = new ArrayList<>();

        for (int i = 0; i < smoothed.length - 1; i++) {
            double y1 = smoothed[i];
            double y2 = smoothed[i + 1];
            if (y1 <= baseline && y2 > baseline) {
                double fraction = (baseline - y1) / (y2 - y1);
                double t = timeUs[i] + fraction * (timeUs[i + 1] - timeUs[i]);
                crossings.add(new Crossing(t, i));
            }
        }

        LOG.debugf("Found %d rising crossings through %.6f V", Integer.valueOf(crossings.size()), Double.valueOf(baseline));
        return crossings;
    }

    /**
     * Keeps the longest prefix of {@code raw} whose successive periods match the reference.
     *
     * <p>The first two crossings are always accepted and define the first period. Each
     * further crossing is accepted while {@code |period - reference| <= reference * tolerancePct / 100},
     * where period is measured from the last accepted crossing.
     *
     * @param raw          detected crossings in time order
     * @param tolerancePct allowed deviation in percent
     * @param mode         how the reference period is chosen
     * @return validated prefix of {@code raw}
     */
    public List<Crossing> lockPeriod(List<Crossing> raw, double tolerancePct, PeriodLockMode mode)
    {
        if (raw.size() < 2) {
            return List.of();
        }

        double tolerance = tolerancePct / 100.0;
        List<Crossing> valid = new ArrayList<>();
        valid.add(raw.get(0));
        valid.add(raw.get(1));

        double firstPeriod = raw.get(1).timeUs() - raw.get(0).timeUs();
        double acceptedPeriodSum = firstPeriod;

        for (int i = 2; i < raw.size(); i++) {
            Crossing last = valid.get(valid.size() - 1);
            Crossing current = raw.get(i);
            double period = current.timeUs() - last.timeUs();

            double reference = mode == PeriodLockMode.RUNNING_AVERAGE
                    ? acceptedPeriodSum / (valid.size() - 1)
                    : firstPeriod;

            if (Math.abs(period - reference) > reference * tolerance) {
                LOG.debugf("Period lock broken at crossing %d: period %.3f us vs reference %.3f us",
                        Integer.valueOf(i), Double.valueOf(period), Double.valueOf(reference));
                break;
            }

            valid.add(current);
            acceptedPeriodSum += period;
        }

        return valid;
    }

    /**
     * Mean of the successive differences between valid crossings, 0 when fewer than two.
     */
    public double averagePeriodUs(List<Crossing> valid)
    {
        if (valid.size() < 2) {
            return 0.0;
        }

        double sum = 0.0;
        for (int i = 0; i < valid.size() - 1; i++) {
            sum += valid.get(i + 1).timeUs() - valid.get(i).timeUs();
        }
        return sum / (valid.size() - 1);
    }
}
