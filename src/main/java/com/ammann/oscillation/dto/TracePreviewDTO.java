/* (C)2026 */
package com.ammann.oscillation.dto;

import com.ammann.oscillation.model.Sample;
import com.ammann.oscillation.model.Trace;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.ArrayList;
import java.util.List;

@Schema(description = "First rows of a parsed trace in original units")
public record TracePreviewDTO(
        @Schema(description = "Total number of parsed samples")
        int sampleCount,

        @Schema(description = "Leading samples in file order")
        List<Row> rows
) {
    @Schema(description = "One parsed sample")
    public record Row(
            @Schema(description = "Zero-based sample index") int index,
            @Schema(description = "Time in seconds as written in the file") double timeSeconds,
            @Schema(description = "Voltage in volts") double voltage) {}

    /**
     * Creates a preview of the first {@code rows} samples of the trace.
     */
    public static TracePreviewDTO of(Trace trace, int rows) {
        int count = Math.min(rows, trace.size());
        List<Row> preview = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Sample sample = trace.samples().get(i);
            preview.add(new Row(i, sample.timeSeconds(), sample.voltage()));
        }
        return new TracePreviewDTO(trace.size(), preview);
    }
}
