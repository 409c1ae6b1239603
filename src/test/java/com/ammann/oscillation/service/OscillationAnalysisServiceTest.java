/* (C)2026 */
package com.ammann.oscillation.service;

import com.ammann.oscillation.enumeration.AnalysisStatus;
import com.ammann.oscillation.enumeration.PeriodLockMode;
import com.ammann.oscillation.model.AnalysisParameters;
import com.ammann.oscillation.model.AnalysisResult;
import com.ammann.oscillation.model.Sample;
import com.ammann.oscillation.model.Trace;
import com.ammann.oscillation.support.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OscillationAnalysisServiceTest
{

    private final OscillationAnalysisService service = TestDataFactory.analysisService();

    @Test
    @DisplayName("recovers frequency and damping of a clean damped sine")
    void recoversCleanDampedSine()
    {
        AnalysisResult result = service.analyze(TestDataFactory.dampedSine(), new AnalysisParameters(1, 10.0, false));

        assertThat(result.status()).isEqualTo(AnalysisStatus.COMPLETE);
        assertThat(result.sampleCount()).isEqualTo(2000);
        assertThat(result.baseline()).isCloseTo(0.5, within(0.01));
        assertThat(result.metrics().frequencyKhz()).isCloseTo(10.0, withinPercentage(1));
        assertThat(result.metrics().dampingCoefficientPerSecond()).isCloseTo(2000.0, withinPercentage(5));
        assertThat(result.metrics().logDecrement()).isCloseTo(0.2, within(0.01));
        assertThat(result.metrics().validCycleCount()).isGreaterThanOrEqualTo(15);
        assertThat(result.fit().amplitude()).isCloseTo(2.0, withinPercentage(5));
        assertThat(result.fit().offset()).isEqualTo(result.baseline());
        assertThat(result.growingEnvelope()).isFalse();
    }

    @Test
    void parsesExportAndAnalysesWithDefaultParameters()
    {
        String export = TestDataFactory.toExport(TestDataFactory.dampedSine());

        AnalysisResult result = service.analyze(export, AnalysisParameters.defaults());

        assertThat(result.status()).isEqualTo(AnalysisStatus.COMPLETE);
        assertThat(result.metrics().frequencyKhz()).isCloseTo(10.0, withinPercentage(1));
        assertThat(result.metrics().dampingCoefficientPerSecond()).isCloseTo(2000.0, withinPercentage(5));
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 42L})
    void toleratesNoiseWithSmoothing(long seed)
    {
        Trace trace = TestDataFactory.dampedSine(0.5, 2.0, 2000.0, 10_000.0, 2000, 0.02, seed);

        AnalysisResult result = service.analyze(trace, new AnalysisParameters(9, 10.0, false));

        assertThat(result.status()).isEqualTo(AnalysisStatus.COMPLETE);
        assertThat(result.metrics().frequencyKhz()).isCloseTo(10.0, withinPercentage(2));
        assertThat(result.metrics().dampingCoefficientPerSecond()).isCloseTo(2000.0, withinPercentage(10));
        assertThat(result.metrics().validCycleCount()).isGreaterThanOrEqualTo(5);
    }

    @Test
    void normalizedViewStartsAtFirstValidCrossing()
    {
        AnalysisResult result = service.analyze(TestDataFactory.dampedSine(), AnalysisParameters.defaults());

        assertThat(result.view().crossings()).isNotEmpty();
        assertThat(result.view().crossings().get(0).timeUs()).isZero();
        assertThat(result.view().voltageOffset()).isEqualTo(result.baseline());
        assertThat(result.view().peaks()).hasSameSizeAs(result.peaks());
        assertThat(result.view().peaks()).allSatisfy(p -> assertThat(p.voltage()).isPositive());
        assertThat(result.rawCrossingCount()).isGreaterThanOrEqualTo(result.validCrossingCount());
        assertThat(result.chart().cutoffTimeUs())
                .isEqualTo(result.view().crossings().get(result.view().crossings().size() - 1).timeUs());
        assertThat(result.chart().fitTimeUs()).hasSize(ChartDataService.DEFAULT_CURVE_SEGMENTS + 1);
    }

    @Test
    void repeatedInvocationsAreIdentical()
    {
        Trace trace = TestDataFactory.dampedSine(0.5, 2.0, 2000.0, 10_000.0, 2000, 0.02, 3L);
        AnalysisParameters params = new AnalysisParameters(5, 15.0, false, PeriodLockMode.RUNNING_AVERAGE);

        AnalysisResult first = service.analyze(trace, params);
        AnalysisResult second = service.analyze(trace, params);

        assertThat(second.status()).isEqualTo(first.status());
        assertThat(second.metrics()).isEqualTo(first.metrics());
        assertThat(second.fit()).isEqualTo(first.fit());
        assertThat(second.peaks()).isEqualTo(first.peaks());
        assertThat(second.view().smoothedVoltage()).containsExactly(first.view().smoothedVoltage());
        assertThat(second.chart().fitVoltage()).containsExactly(first.chart().fitVoltage());
    }

    @Test
    void invertingEqualsAnalysingNegatedTrace()
    {
        Trace trace = TestDataFactory.dampedSine();

        AnalysisResult inverted = service.analyze(trace, new AnalysisParameters(10, 10.0, true));
        AnalysisResult negated = service.analyze(TestDataFactory.negated(trace), new AnalysisParameters(10, 10.0, false));

        assertThat(inverted.status()).isEqualTo(AnalysisStatus.COMPLETE);
        assertThat(inverted.metrics()).isEqualTo(negated.metrics());
        assertThat(inverted.baseline()).isEqualTo(negated.baseline());
        assertThat(inverted.peaks()).isEqualTo(negated.peaks());
    }

    @Test
    void flagsGrowingEnvelope()
    {
        Trace growing = TestDataFactory.dampedSine(0.0, 1.0, -500.0, 10_000.0, 2000, 0.0, 0L);

        AnalysisResult result = service.analyze(growing, new AnalysisParameters(1, 10.0, false));

        assertThat(result.status()).isEqualTo(AnalysisStatus.COMPLETE);
        assertThat(result.fit().beta()).isPositive();
        assertThat(result.growingEnvelope()).isTrue();
        assertThat(result.metrics().logDecrement()).isPositive();
    }

    @Test
    void reportsEmptyInputWhenNothingParses()
    {
        AnalysisResult result = service.analyze("\"Time\"\t\"Channel A\"\nfoo bar\n", AnalysisParameters.defaults());

        assertThat(result.status()).isEqualTo(AnalysisStatus.EMPTY_INPUT);
        assertThat(result.status().isHalting()).isTrue();
        assertThat(result.baseline()).isNull();
        assertThat(result.view()).isNull();
        assertThat(result.chart()).isNull();
        assertThat(result.metrics()).isNull();
    }

    @Test
    void reportsInsufficientCrossingsButKeepsSeries()
    {
        List<Sample> ramp = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            ramp.add(new Sample(i * 1e-6, i / 50.0));
        }

        AnalysisResult result = service.analyze(new Trace(ramp), new AnalysisParameters(1, 10.0, false));

        assertThat(result.status()).isEqualTo(AnalysisStatus.INSUFFICIENT_CROSSINGS);
        assertThat(result.rawCrossingCount()).isEqualTo(1);
        assertThat(result.validCrossingCount()).isZero();
        assertThat(result.baseline()).isNotNull();
        assertThat(result.view().smoothedVoltage()).hasSize(50);
        assertThat(result.chart()).isNotNull();
        assertThat(result.fit()).isNull();
        assertThat(result.metrics()).isNull();
    }

    @Test
    void reportsInsufficientPeaksWhenPeriodLockStopsAfterOneCycle()
    {
        double[] voltage = new double[40];
        Arrays.fill(voltage, -1.0);
        voltage[1] = 1.0;
        voltage[5] = 1.0;
        voltage[20] = 1.0;
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < voltage.length; i++) {
            samples.add(new Sample(i * 1e-6, voltage[i]));
        }

        AnalysisResult result = service.analyze(new Trace(samples), new AnalysisParameters(1, 10.0, false));

        assertThat(result.status()).isEqualTo(AnalysisStatus.INSUFFICIENT_PEAKS);
        assertThat(result.rawCrossingCount()).isEqualTo(3);
        assertThat(result.validCrossingCount()).isEqualTo(2);
        assertThat(result.peaks()).hasSize(1);
        assertThat(result.fit()).isNull();
        assertThat(result.chart().fitTimeUs()).isEmpty();
    }

    @Test
    void countsAnalysesByStatus()
    {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        service.meterRegistry = registry;

        service.analyze(TestDataFactory.dampedSine(), AnalysisParameters.defaults());
        service.analyze(TestDataFactory.dampedSine(), AnalysisParameters.defaults());
        service.analyze("", AnalysisParameters.defaults());

        assertThat(registry.get("oscillation_analysis_total").tag("status", "COMPLETE").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("oscillation_analysis_total").tag("status", "EMPTY_INPUT").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("oscillation_analysis_duration").timer().count()).isEqualTo(3L);
    }

    @Test
    void calibrationRunsAreNotCounted()
    {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        service.meterRegistry = registry;

        AnalysisResult result = service.calibrate(TestDataFactory.dampedSine(), AnalysisParameters.defaults());

        assertThat(result.status()).isEqualTo(AnalysisStatus.COMPLETE);
        assertThat(registry.find("oscillation_analysis_total").counter()).isNull();
        assertThat(registry.find("oscillation_analysis_duration").timer()).isNull();
    }
}
