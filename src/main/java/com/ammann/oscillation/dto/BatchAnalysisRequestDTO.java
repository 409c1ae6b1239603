/* (C)2026 */
package com.ammann.oscillation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

/**
 * Several traces analysed with one set of parameters. Omitted parameters fall back to the
 * configured defaults.
 */
@Schema(description = "Batch of traces analysed with shared parameters")
public record BatchAnalysisRequestDTO(
        @Schema(description = "Traces to analyse", required = true)
        @NotEmpty
        List<@NotNull @Valid TraceDTO> traces,

        @Schema(description = "Moving-average window in samples")
        Integer smoothingWindow,

        @Schema(description = "Allowed period deviation in percent")
        Double periodTolerance,

        @Schema(description = "Invert polarity before smoothing")
        Boolean invert,

        @Schema(description = "FIRST_PERIOD or RUNNING_AVERAGE")
        String lockMode
) {
    @Schema(description = "Named trace file content")
    public record TraceDTO(
            @Schema(description = "Client-side label, e.g. the file name") String name,
            @Schema(description = "Oscilloscope export text", required = true) @NotNull String content) {}
}
