/* (C)2026 */
package com.ammann.oscillation.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.oscillation.config.AnalysisSettings;
import com.ammann.oscillation.dto.AnalysisResponseDTO;
import com.ammann.oscillation.dto.AnalysisSettingsDTO;
import com.ammann.oscillation.dto.BatchAnalysisRequestDTO;
import com.ammann.oscillation.dto.BatchAnalysisResponseDTO;
import com.ammann.oscillation.dto.TracePreviewDTO;
import com.ammann.oscillation.enumeration.AnalysisStatus;
import com.ammann.oscillation.enumeration.PeriodLockMode;
import com.ammann.oscillation.exception.EmptyTraceException;
import com.ammann.oscillation.exception.TraceReadException;
import com.ammann.oscillation.exception.ValidationException;
import com.ammann.oscillation.properties.ApiProperties;
import com.ammann.oscillation.service.BatchAnalysisService;
import com.ammann.oscillation.service.OscillationAnalysisService;
import com.ammann.oscillation.service.TraceParserService;
import com.ammann.oscillation.support.TestDataFactory;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.ws.rs.core.Response;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

@QuarkusTest
class AnalysisResourceTest {

    private static final String CLEAN = TestDataFactory.toExport(TestDataFactory.dampedSine());

    @Inject OscillationAnalysisService analysisService;
    @Inject BatchAnalysisService batchAnalysisService;
    @Inject TraceParserService parser;
    @Inject AnalysisSettings settings;
    @Inject Validator validator;

    // =========================================================================
    // Annotations / path
    // =========================================================================

    @Test
    void resource_classHasCorrectPath() {
        var path = AnalysisResource.class.getAnnotation(jakarta.ws.rs.Path.class);
        assertThat(path).isNotNull();
        assertThat(path.value()).isEqualTo(ApiProperties.BASE_URL_V1 + ApiProperties.Analysis.BASE);
    }

    // =========================================================================
    // Single trace analysis
    // =========================================================================

    @Test
    void analyzeText_completeTrace_returnsMetrics() {
        Response response = buildResource().analyzeText(CLEAN, null, null, null, null, true);

        assertThat(response.getStatus()).isEqualTo(200);
        AnalysisResponseDTO body = (AnalysisResponseDTO) response.getEntity();
        assertThat(body.status()).isEqualTo(AnalysisStatus.COMPLETE);
        assertThat(body.metrics().frequencyKhz()).isBetween(9.9, 10.1);
        assertThat(body.parameters().smoothingWindow()).isEqualTo(10);
        assertThat(body.smoothedVoltage()).hasSize(2000);
        assertThat(body.growingEnvelope()).isFalse();
        assertThat(body.chart().fitTimeUs()).hasSize(201);
    }

    @Test
    void analyzeText_withoutSeries_omitsPerSampleArrays() {
        Response response = buildResource().analyzeText(CLEAN, 5, 20.0, false, "RUNNING_AVERAGE", false);

        AnalysisResponseDTO body = (AnalysisResponseDTO) response.getEntity();
        assertThat(body.timeUs()).isNull();
        assertThat(body.smoothedVoltage()).isNull();
        assertThat(body.peaks()).isNotEmpty();
        assertThat(body.parameters().lockMode()).isEqualTo(PeriodLockMode.RUNNING_AVERAGE);
    }

    @Test
    void analyzeText_partialResult_isStill200() {
        Response response = buildResource().analyzeText("0 0\n1e-6 1\n2e-6 2\n", null, null, null, null, true);

        assertThat(response.getStatus()).isEqualTo(200);
        AnalysisResponseDTO body = (AnalysisResponseDTO) response.getEntity();
        assertThat(body.status()).isEqualTo(AnalysisStatus.INSUFFICIENT_CROSSINGS);
        assertThat(body.metrics()).isNull();
        assertThat(body.fit()).isNull();
        assertThat(body.baseline()).isNotNull();
    }

    @Test
    void analyzeText_noNumericRows_throwsEmptyTrace() {
        assertThatThrownBy(() -> buildResource().analyzeText("\"Time\"\n", null, null, null, null, true))
                .isInstanceOf(EmptyTraceException.class);
    }

    @Test
    void analyzeText_windowOutOfRange_throwsValidation() {
        assertThatThrownBy(() -> buildResource().analyzeText(CLEAN, 51, null, null, null, true))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> buildResource().analyzeText(CLEAN, null, 60.0, null, null, true))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void analyzeUpload_decodesWithCharset() {
        var body = new ByteArrayInputStream(CLEAN.getBytes(StandardCharsets.UTF_16LE));

        Response response = buildResource().analyzeUpload(body, "UTF-16LE", null, null, null, null, false);

        assertThat(((AnalysisResponseDTO) response.getEntity()).status()).isEqualTo(AnalysisStatus.COMPLETE);
    }

    @Test
    void analyzeUpload_invalidBytes_throwsTraceRead() {
        var body = new ByteArrayInputStream(new byte[] {'0', ' ', (byte) 0xFF, (byte) 0xFE});

        assertThatThrownBy(() -> buildResource().analyzeUpload(body, "UTF-8", null, null, null, null, true))
                .isInstanceOf(TraceReadException.class);
    }

    @Test
    void analyzeUpload_unknownCharset_throwsValidation() {
        var body = new ByteArrayInputStream(CLEAN.getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> buildResource().analyzeUpload(body, "no-such-charset", null, null, null, null, true))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("charset");
    }

    // =========================================================================
    // Batch
    // =========================================================================

    @Test
    void analyzeBatch_returnsItemsInOrder() {
        var request = new BatchAnalysisRequestDTO(
                List.of(new BatchAnalysisRequestDTO.TraceDTO("a.txt", CLEAN),
                        new BatchAnalysisRequestDTO.TraceDTO("b.txt", "0 0\n1e-6 1\n")),
                null, null, null, null);

        Response response = buildResource().analyzeBatch(request);

        BatchAnalysisResponseDTO body = (BatchAnalysisResponseDTO) response.getEntity();
        assertThat(body.traceCount()).isEqualTo(2);
        assertThat(body.completeCount()).isEqualTo(1);
        assertThat(body.items()).extracting(BatchAnalysisResponseDTO.Item::name).containsExactly("a.txt", "b.txt");
    }

    @Test
    void analyzeBatch_tooManyTraces_throwsValidation() {
        List<BatchAnalysisRequestDTO.TraceDTO> traces = new ArrayList<>(
                Collections.nCopies(settings.getMaxBatchTraces() + 1, new BatchAnalysisRequestDTO.TraceDTO("x", "0 0")));
        var request = new BatchAnalysisRequestDTO(traces, null, null, null, null);

        assertThatThrownBy(() -> buildResource().analyzeBatch(request)).isInstanceOf(ValidationException.class);
    }

    @Test
    void batchRequest_nullTraceEntry_failsValidation() {
        var request = new BatchAnalysisRequestDTO(
                Arrays.asList(new BatchAnalysisRequestDTO.TraceDTO("a.txt", CLEAN), null),
                null, null, null, null);

        Set<ConstraintViolation<BatchAnalysisRequestDTO>> violations = validator.validate(request);

        assertThat(violations).isNotEmpty();
        assertThat(violations)
                .anySatisfy(v -> assertThat(v.getPropertyPath().toString()).startsWith("traces"));
    }

    @Test
    void batchRequest_wellFormed_passesValidation() {
        var request = new BatchAnalysisRequestDTO(
                List.of(new BatchAnalysisRequestDTO.TraceDTO("a.txt", CLEAN)), 5, null, null, null);

        assertThat(validator.validate(request)).isEmpty();
    }

    // =========================================================================
    // Preview and settings
    // =========================================================================

    @Test
    void previewTrace_returnsLeadingRows() {
        Response response = buildResource().previewTrace(CLEAN, 3);

        TracePreviewDTO body = (TracePreviewDTO) response.getEntity();
        assertThat(body.sampleCount()).isEqualTo(2000);
        assertThat(body.rows()).hasSize(3);
        assertThat(body.rows().get(2).index()).isEqualTo(2);
        assertThat(body.rows().get(2).timeSeconds()).isEqualTo(2e-6);
    }

    @Test
    void previewTrace_rejectsRowCountOutOfRange() {
        assertThatThrownBy(() -> buildResource().previewTrace(CLEAN, 0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> buildResource().previewTrace("", 5)).isInstanceOf(EmptyTraceException.class);
    }

    @Test
    void getSettings_reportsConfiguredRanges() {
        AnalysisSettingsDTO body = (AnalysisSettingsDTO) buildResource().getSettings().getEntity();

        assertThat(body.defaultSmoothingWindow()).isEqualTo(10);
        assertThat(body.maxSmoothingWindow()).isEqualTo(50);
        assertThat(body.minPeriodTolerancePct()).isEqualTo(5.0);
        assertThat(body.lockModes()).containsExactly(PeriodLockMode.FIRST_PERIOD, PeriodLockMode.RUNNING_AVERAGE);
    }

    private AnalysisResource buildResource() {
        AnalysisResource resource = new AnalysisResource();
        resource.analysisService = analysisService;
        resource.batchAnalysisService = batchAnalysisService;
        resource.parser = parser;
        resource.settings = settings;
        return resource;
    }
}
