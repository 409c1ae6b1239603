/* (C)2026 */
package com.ammann.oscillation.config;

import com.ammann.oscillation.enumeration.PeriodLockMode;
import com.ammann.oscillation.exception.ValidationException;
import com.ammann.oscillation.model.AnalysisParameters;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Defaults and accepted ranges of the tunable analysis parameters.
 *
 * <p>Clients may omit any parameter; omitted values fall back to the configured defaults.
 * Supplied values outside the configured range are rejected.
 */
@ApplicationScoped
public class AnalysisSettings {

    @ConfigProperty(name = "oscillation.analysis.smoothing-window.default", defaultValue = "10")
    int defaultSmoothingWindow = 10;

    @ConfigProperty(name = "oscillation.analysis.smoothing-window.min", defaultValue = "1")
    int minSmoothingWindow = 1;

    @ConfigProperty(name = "oscillation.analysis.smoothing-window.max", defaultValue = "50")
    int maxSmoothingWindow = 50;

    @ConfigProperty(name = "oscillation.analysis.period-tolerance.default", defaultValue = "10")
    double defaultPeriodTolerancePct = 10.0;

    @ConfigProperty(name = "oscillation.analysis.period-tolerance.min", defaultValue = "5")
    double minPeriodTolerancePct = 5.0;

    @ConfigProperty(name = "oscillation.analysis.period-tolerance.max", defaultValue = "50")
    double maxPeriodTolerancePct = 50.0;

    @ConfigProperty(name = "oscillation.analysis.batch.max-traces", defaultValue = "20")
    int maxBatchTraces = 20;

    @ConfigProperty(name = "oscillation.analysis.preview.max-rows", defaultValue = "1000")
    int maxPreviewRows = 1000;

    /**
     * Combines client-supplied values with the configured defaults.
     *
     * @param smoothingWindow    window in samples, or null for the default
     * @param periodTolerancePct tolerance in percent, or null for the default
     * @param invert             polarity inversion, or null for false
     * @param lockMode           lock mode name, or null for {@link PeriodLockMode#FIRST_PERIOD}
     * @return validated parameters
     * @throws ValidationException if a supplied value is outside its range or unknown
     */
    public AnalysisParameters resolve(Integer smoothingWindow, Double periodTolerancePct, Boolean invert, String lockMode) {
        int window = smoothingWindow != null ? smoothingWindow : defaultSmoothingWindow;
        double tolerance = periodTolerancePct != null ? periodTolerancePct : defaultPeriodTolerancePct;

        if (window < minSmoothingWindow || window > maxSmoothingWindow) {
            throw ValidationException.invalidParameter("smoothingWindow", window,
                    String.format("integer between %d and %d", minSmoothingWindow, maxSmoothingWindow));
        }
        if (!(tolerance >= minPeriodTolerancePct && tolerance <= maxPeriodTolerancePct)) {
            throw ValidationException.invalidParameter("periodTolerance", tolerance,
                    String.format("percentage between %.0f and %.0f", minPeriodTolerancePct, maxPeriodTolerancePct));
        }

        return new AnalysisParameters(window, tolerance, Boolean.TRUE.equals(invert), parseLockMode(lockMode));
    }

    private static PeriodLockMode parseLockMode(String lockMode) {
        if (lockMode == null || lockMode.isBlank()) {
            return PeriodLockMode.FIRST_PERIOD;
        }
        try {
            return PeriodLockMode.fromName(lockMode);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter("lockMode", lockMode, "FIRST_PERIOD or RUNNING_AVERAGE");
        }
    }

    public int getDefaultSmoothingWindow() { return defaultSmoothingWindow; }

    public int getMinSmoothingWindow() { return minSmoothingWindow; }

    public int getMaxSmoothingWindow() { return maxSmoothingWindow; }

    public double getDefaultPeriodTolerancePct() { return defaultPeriodTolerancePct; }

    public double getMinPeriodTolerancePct() { return minPeriodTolerancePct; }

    public double getMaxPeriodTolerancePct() { return maxPeriodTolerancePct; }

    public int getMaxBatchTraces() { return maxBatchTraces; }

    public int getMaxPreviewRows() { return maxPreviewRows; }
}
