/* (C)2026 */
package com.ammann.oscillation.health;

import com.ammann.oscillation.enumeration.AnalysisStatus;
import com.ammann.oscillation.model.AnalysisParameters;
import com.ammann.oscillation.model.AnalysisResult;
import com.ammann.oscillation.model.Sample;
import com.ammann.oscillation.model.Trace;
import com.ammann.oscillation.service.OscillationAnalysisService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Readiness check that runs the analysis pipeline over a built-in calibration signal.
 *
 * <p>The calibration trace is a 10 kHz sine decaying with 2000 1/s around a 0.5 V offset,
 * sampled every microsecond for 2 ms. The service is ready when the analysis completes and
 * the recovered frequency is within 1 % of the generated one.
 */
@Readiness
@ApplicationScoped
public class AnalysisPipelineHealthCheck implements HealthCheck
{
    private static final Logger LOG = Logger.getLogger(AnalysisPipelineHealthCheck.class);

    static final double CALIBRATION_FREQUENCY_KHZ = 10.0;
    static final double CALIBRATION_DAMPING_PER_SECOND = 2000.0;
    private static final double MAX_FREQUENCY_DEVIATION = 0.01;
    private static final Trace CALIBRATION_TRACE = calibrationTrace();

    @Inject
    OscillationAnalysisService analysisService;

    @Override
    public HealthCheckResponse call()
    {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("analysis-pipeline");

        try {
            AnalysisResult result = analysisService.calibrate(CALIBRATION_TRACE, new AnalysisParameters(1, 10.0, false));
            builder.withData("status", result.status().name());

            if (result.status() != AnalysisStatus.COMPLETE) {
                return builder.down().build();
            }

            double frequencyKhz = result.metrics().frequencyKhz();
            builder.withData("frequencyKhz", String.format("%.4f", frequencyKhz))
                    .withData("logDecrement", String.format("%.4f", result.metrics().logDecrement()));

            double deviation = Math.abs(frequencyKhz - CALIBRATION_FREQUENCY_KHZ) / CALIBRATION_FREQUENCY_KHZ;
            return deviation <= MAX_FREQUENCY_DEVIATION ? builder.up().build() : builder.down().build();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Calibration analysis failed");
            return builder.down().withData("error", e.getClass().getSimpleName()).build();
        }
    }

    static Trace calibrationTrace()
    {
        double omega = 2 * Math.PI * CALIBRATION_FREQUENCY_KHZ * 1000;
        List<Sample> samples = new ArrayList<>(2000);
        for (int i = 0; i < 2000; i++) {
            double t = i * 1e-6;
            double v = 0.5 + 2.0 * Math.exp(-CALIBRATION_DAMPING_PER_SECOND * t) * Math.sin(omega * t);
            samples.add(new Sample(t, v));
        }
        return new Trace(samples);
    }
}
