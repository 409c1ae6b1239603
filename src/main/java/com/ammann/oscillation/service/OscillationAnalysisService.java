/* (C)2026 */
package com.ammann.oscillation.service;

import com.ammann.oscillation.enumeration.AnalysisStatus;
import com.ammann.oscillation.model.AnalysisParameters;
import com.ammann.oscillation.model.AnalysisResult;
import com.ammann.oscillation.model.ChartData;
import com.ammann.oscillation.model.Crossing;
import com.ammann.oscillation.model.FitParams;
import com.ammann.oscillation.model.Metrics;
import com.ammann.oscillation.model.NormalizedView;
import com.ammann.oscillation.model.Peak;
import com.ammann.oscillation.model.PreprocessedSignal;
import com.ammann.oscillation.model.Trace;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Runs the damped-oscillation pipeline over one complete trace.
 *
 * <p>Stages run strictly in order: preprocessing, baseline estimation, crossing detection with
 * period locking, peak extraction, normalization, envelope fit and metric derivation. Each
 * invocation recomputes everything from the trace and the parameters and shares no state with
 * other invocations, so one instance may serve concurrent callers. Missing intermediate values
 * stop only the stages that depend on them; the outcome is reported through
 * {@link AnalysisStatus} rather than exceptions.
 *
 * <p>The envelope is fitted on normalized peak times against un-normalized peak voltages,
 * so the fit offset C equals the un-normalized baseline while A is the amplitude at the
 * first valid crossing.
 */
@ApplicationScoped
public class OscillationAnalysisService
{

    private static final Logger LOG = Logger.getLogger(OscillationAnalysisService.class);

    private final TraceParserService parser;
    private final SignalPreprocessingService preprocessor;
    private final BaselineEstimationService baselineEstimator;
    private final ZeroCrossingService crossingDetector;
    private final PeakExtractionService peakExtractor;
    private final NormalizationService normalizer;
    private final EnvelopeFitService envelopeFitter;
    private final MetricDerivationService metricDeriver;
    private final ChartDataService chartDataService;

    @Inject MeterRegistry meterRegistry;

    @Inject
    public OscillationAnalysisService(TraceParserService parser,
                                      SignalPreprocessingService preprocessor,
                                      BaselineEstimationService baselineEstimator,
                                      ZeroCrossingService crossingDetector,
                                      PeakExtractionService peakExtractor,
                                      NormalizationService normalizer,
                                      EnvelopeFitService envelopeFitter,
                                      MetricDerivationService metricDeriver,
                                      ChartDataService chartDataService)
    {
        this.parser = parser;
        this.preprocessor = preprocessor;
        this.baselineEstimator = baselineEstimator;
        this.crossingDetector = crossingDetector;
        this.peakExtractor = peakExtractor;
        this.normalizer = normalizer;
        this.envelopeFitter = envelopeFitter;
        this.metricDeriver = metricDeriver;
        this.chartDataService = chartDataService;
    }

    /**
     * Parses and analyses raw file content.
     *
     * @param content    oscilloscope export
     * @param parameters tunable parameters
     * @return analysis result, {@link AnalysisStatus#EMPTY_INPUT} when nothing could be parsed
     */
    public AnalysisResult analyze(String content, AnalysisParameters parameters)
    {
        return analyze(parser.parse(content), parameters);
    }

    /**
     * Analyses an already parsed trace.
     *
     * @param trace      parsed samples
     * @param parameters tunable parameters
     * @return analysis result
     */
    public AnalysisResult analyze(Trace trace, AnalysisParameters parameters)
    {
        long startNanos = System.nanoTime();
        AnalysisResult result = runPipeline(trace, parameters, startNanos);
        recordMetrics(result);
        return result;
    }

    /**
     * Analyses a trace without recording it in the analysis counter and timer. Used for
     * internal self-checks so that the meters only reflect client traffic.
     */
    public AnalysisResult calibrate(Trace trace, AnalysisParameters parameters)
    {
        return runPipeline(trace, parameters, System.nanoTime());
    }

    private AnalysisResult runPipeline(Trace trace, AnalysisParameters parameters, long startNanos)
    {
        if (trace.isEmpty()) {
            LOG.warn("Cannot analyse empty trace");
            return AnalysisResult.emptyInput(parameters, System.nanoTime() - startNanos);
        }

        PreprocessedSignal signal = preprocessor.preprocess(trace, parameters.invert(), parameters.smoothingWindow());
        double[] timeUs = signal.timeUs();
        double[] smoothed = signal.smoothedVoltage();

        OptionalDouble estimate = baselineEstimator.estimateBaseline(smoothed);
        if (estimate.isEmpty()) {
            return AnalysisResult.emptyInput(parameters, System.nanoTime() - startNanos);
        }
        double baseline = estimate.getAsDouble();

        List<Crossing> rawCrossings = crossingDetector.findRisingCrossings(timeUs, smoothed, baseline);
        List<Crossing> validCrossings = crossingDetector.lockPeriod(
                rawCrossings, parameters.periodTolerancePct(), parameters.lockMode());
        double averagePeriodUs = crossingDetector.averagePeriodUs(validCrossings);

        List<Peak> peaks = peakExtractor.extractPeaks(timeUs, smoothed, validCrossings, baseline);

        NormalizedView view = normalizer.normalize(
                timeUs, signal.rawVoltage(), smoothed, peaks, validCrossings, baseline);

        FitParams fit = null;
        Metrics metrics = null;
        AnalysisStatus status;

        if (validCrossings.size() < 2) {
            status = AnalysisStatus.INSUFFICIENT_CROSSINGS;
        } else if (envelopeFitter.countQualifyingPeaks(peaks, baseline) < 2) {
            status = AnalysisStatus.INSUFFICIENT_PEAKS;
        } else {
            List<Peak> fitPeaks = peaks.stream()
                    .map(p -> new Peak(p.timeUs() - view.timeOffsetUs(), p.voltage()))
                    .toList();
            fit = envelopeFitter.fitEnvelope(fitPeaks, baseline).orElse(null);
            if (fit == null) {
                status = AnalysisStatus.DEGENERATE_FIT;
            } else {
                metrics = metricDeriver.deriveMetrics(fit, averagePeriodUs, peaks.size()).orElse(null);
                status = metrics != null ? AnalysisStatus.COMPLETE : AnalysisStatus.UNDEFINED_PERIOD;
            }
        }

        if (fit != null && fit.isGrowing()) {
            LOG.warnf("Envelope grows (beta=%.6e 1/us); data may not be a decaying oscillation", fit.beta());
        }

        ChartData chart = chartDataService.build(view, fit);
        long elapsed = System.nanoTime() - startNanos;

        if (metrics != null) {
            LOG.infof("Analysed %d samples: f=%.4f kHz, lambda=%.4f, %d cycles in %.2fms",
                    trace.size(), metrics.frequencyKhz(), metrics.logDecrement(),
                    metrics.validCycleCount(), elapsed / 1_000_000.0);
        } else {
            LOG.infof("Analysed %d samples: status=%s (%d raw crossings, %d valid, %d peaks)",
                    trace.size(), status, rawCrossings.size(), validCrossings.size(), peaks.size());
        }

        return new AnalysisResult(
                status,
                parameters,
                trace.size(),
                rawCrossings.size(),
                baseline,
                averagePeriodUs,
                peaks,
                view,
                fit,
                metrics,
                chart,
                elapsed);
    }

    private void recordMetrics(AnalysisResult result)
    {
        if (meterRegistry == null) {
            return;
        }

        Counter.builder("oscillation_analysis_total")
                .description("Number of trace analyses by outcome")
                .tag("status", result.status().name())
                .register(meterRegistry)
                .increment();

        Timer.builder("oscillation_analysis_duration")
                .description("Wall time of one trace analysis")
                .register(meterRegistry)
                .record(Duration.ofNanos(result.processingTimeNanos()));
    }
}
