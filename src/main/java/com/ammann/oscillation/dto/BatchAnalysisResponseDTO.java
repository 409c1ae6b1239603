/* (C)2026 */
package com.ammann.oscillation.dto;

import com.ammann.oscillation.enumeration.AnalysisStatus;
import com.ammann.oscillation.service.BatchAnalysisService;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

@Schema(description = "Results of a batch analysis in request order")
public record BatchAnalysisResponseDTO(
        @Schema(description = "Number of traces in the request")
        int traceCount,

        @Schema(description = "Number of traces with fit and metrics")
        long completeCount,

        @Schema(description = "Per-trace results")
        List<Item> items
) {
    @Schema(description = "Summary of one trace analysis")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Item(
            @Schema(description = "Trace label from the request") String name,
            @Schema(description = "Outcome, absent when the analysis failed") AnalysisStatus status,
            @Schema(description = "Outcome description") String message,
            @Schema(description = "Number of parsed samples") Integer sampleCount,
            @Schema(description = "Un-normalized baseline in volts") Double baseline,
            @Schema(description = "Envelope fit") FitParamsDTO fit,
            @Schema(description = "Derived physical parameters") MetricsDTO metrics,
            @Schema(description = "Error that prevented the analysis") String error) {

        static Item from(BatchAnalysisService.BatchItem item) {
            if (!item.succeeded()) {
                return new Item(item.name(), null, null, null, null, null, null, item.error());
            }
            var result = item.result();
            return new Item(
                    item.name(),
                    result.status(),
                    result.status().getMessage(),
                    result.sampleCount(),
                    result.baseline(),
                    FitParamsDTO.from(result.fit()),
                    MetricsDTO.from(result.metrics()),
                    null);
        }
    }

    public static BatchAnalysisResponseDTO from(List<BatchAnalysisService.BatchItem> items) {
        List<Item> converted = items.stream().map(Item::from).toList();
        long complete = converted.stream().filter(i -> i.status() != null && i.status().hasMetrics()).count();
        return new BatchAnalysisResponseDTO(items.size(), complete, converted);
    }
}
