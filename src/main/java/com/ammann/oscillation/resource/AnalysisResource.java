/* (C)2026 */
package com.ammann.oscillation.resource;

import com.ammann.oscillation.config.AnalysisSettings;
import com.ammann.oscillation.dto.AnalysisResponseDTO;
import com.ammann.oscillation.dto.AnalysisSettingsDTO;
import com.ammann.oscillation.dto.BatchAnalysisRequestDTO;
import com.ammann.oscillation.dto.BatchAnalysisResponseDTO;
import com.ammann.oscillation.dto.TracePreviewDTO;
import com.ammann.oscillation.exception.EmptyTraceException;
import com.ammann.oscillation.exception.ValidationException;
import com.ammann.oscillation.model.AnalysisParameters;
import com.ammann.oscillation.model.AnalysisResult;
import com.ammann.oscillation.model.Trace;
import com.ammann.oscillation.properties.ApiProperties;
import com.ammann.oscillation.service.BatchAnalysisService;
import com.ammann.oscillation.service.OscillationAnalysisService;
import com.ammann.oscillation.service.TraceParserService;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.List;

/**
 * REST resource for damped-oscillation analysis of oscilloscope traces.
 *
 * <p>Traces are uploaded as plain text (time and voltage columns, optionally min/max
 * envelope columns). Each request runs the full pipeline once; nothing is stored between
 * requests. Conditions such as too few zero crossings are reported through the status of a
 * 200 response; only a trace without any numeric rows is rejected.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Analysis.BASE)
@Tag(name = "Oscillation Analysis API", description = "Frequency and damping of damped oscillations")
@Produces(MediaType.APPLICATION_JSON)
public class AnalysisResource {

    private static final Logger LOG = Logger.getLogger(AnalysisResource.class);

    @Inject
    OscillationAnalysisService analysisService;

    @Inject
    BatchAnalysisService batchAnalysisService;

    @Inject
    TraceParserService parser;

    @Inject
    AnalysisSettings settings;

    @POST
    @Consumes(MediaType.TEXT_PLAIN)
    @Operation(
            summary = "Analyse a trace",
            description = "Parses a time/voltage export and computes frequency, logarithmic decrement and damping coefficient"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Analysis completed (see status for partial results)",
                    content = @Content(schema = @Schema(implementation = AnalysisResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid parameters"),
            @APIResponse(responseCode = "422", description = "No valid numeric data found")
    })
    public Response analyzeText(
            String content,
            @Parameter(description = "Moving-average window in samples (1-50, default 10)")
            @QueryParam("smoothingWindow") Integer smoothingWindow,
            @Parameter(description = "Allowed period deviation in percent (5-50, default 10)")
            @QueryParam("periodTolerance") Double periodTolerance,
            @Parameter(description = "Invert polarity before smoothing")
            @QueryParam("invert") Boolean invert,
            @Parameter(description = "FIRST_PERIOD (default) or RUNNING_AVERAGE")
            @QueryParam("lockMode") String lockMode,
            @Parameter(description = "Include the per-sample normalized series")
            @QueryParam("includeSeries") @DefaultValue("true") boolean includeSeries) {

        AnalysisParameters parameters = settings.resolve(smoothingWindow, periodTolerance, invert, lockMode);
        LOG.debugf("Analysis request: %d characters, %s", content != null ? content.length() : 0, parameters);

        return respond(parser.parse(content), parameters, includeSeries);
    }

    @POST
    @Consumes(MediaType.APPLICATION_OCTET_STREAM)
    @Operation(
            summary = "Analyse an uploaded trace file",
            description = "Same as the text variant, decoding the raw bytes with the given charset"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Analysis completed (see status for partial results)",
                    content = @Content(schema = @Schema(implementation = AnalysisResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid parameters or undecodable file"),
            @APIResponse(responseCode = "422", description = "No valid numeric data found")
    })
    public Response analyzeUpload(
            InputStream body,
            @Parameter(description = "Character set of the file (default UTF-8)")
            @QueryParam("charset") @DefaultValue("UTF-8") String charset,
            @QueryParam("smoothingWindow") Integer smoothingWindow,
            @QueryParam("periodTolerance") Double periodTolerance,
            @QueryParam("invert") Boolean invert,
            @QueryParam("lockMode") String lockMode,
            @QueryParam("includeSeries") @DefaultValue("true") boolean includeSeries) {

        AnalysisParameters parameters = settings.resolve(smoothingWindow, periodTolerance, invert, lockMode);
        Trace trace = parser.parse(body, toCharset(charset));

        return respond(trace, parameters, includeSeries);
    }

    @POST
    @Path(ApiProperties.Analysis.BATCH)
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Analyse several traces",
            description = "Analyses every trace independently with shared parameters; results keep the request order"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Batch analysed",
                    content = @Content(schema = @Schema(implementation = BatchAnalysisResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid parameters or batch size")
    })
    public Response analyzeBatch(@Valid @NotNull BatchAnalysisRequestDTO request) {
        if (request.traces().size() > settings.getMaxBatchTraces()) {
            throw ValidationException.invalidParameter("traces", request.traces().size(),
                    "at most " + settings.getMaxBatchTraces() + " traces");
        }

        AnalysisParameters parameters = settings.resolve(
                request.smoothingWindow(), request.periodTolerance(), request.invert(), request.lockMode());

        List<BatchAnalysisService.NamedTrace> traces = request.traces().stream()
                .map(t -> new BatchAnalysisService.NamedTrace(t.name(), t.content()))
                .toList();

        var response = BatchAnalysisResponseDTO.from(batchAnalysisService.analyzeAll(traces, parameters));
        LOG.infof("Batch analysis: %d of %d traces complete", response.completeCount(), response.traceCount());
        return Response.ok(response).build();
    }

    @POST
    @Path(ApiProperties.Analysis.PREVIEW)
    @Consumes(MediaType.TEXT_PLAIN)
    @Operation(
            summary = "Preview parsed samples",
            description = "Returns the first parsed rows of a trace in original units and the total sample count"
    )
    public Response previewTrace(
            String content,
            @Parameter(description = "Number of leading rows (default 10)")
            @QueryParam("rows") @DefaultValue("10") int rows) {

        if (rows < 1 || rows > settings.getMaxPreviewRows()) {
            throw ValidationException.invalidParameter("rows", rows,
                    "between 1 and " + settings.getMaxPreviewRows());
        }

        Trace trace = parser.parse(content);
        if (trace.isEmpty()) {
            throw new EmptyTraceException();
        }
        return Response.ok(TracePreviewDTO.of(trace, rows)).build();
    }

    @GET
    @Path(ApiProperties.Analysis.SETTINGS)
    @Operation(
            summary = "Parameter defaults",
            description = "Returns the default values and accepted ranges of the analysis parameters"
    )
    public Response getSettings() {
        return Response.ok(AnalysisSettingsDTO.from(settings)).build();
    }

    private Response respond(Trace trace, AnalysisParameters parameters, boolean includeSeries) {
        AnalysisResult result = analysisService.analyze(trace, parameters);
        if (result.status().isHalting()) {
            throw new EmptyTraceException();
        }
        return Response.ok(AnalysisResponseDTO.from(result, includeSeries)).build();
    }

    private static Charset toCharset(String name) {
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw ValidationException.invalidParameter("charset", name, "a supported character set");
        }
    }
}
