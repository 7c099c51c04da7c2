/* (C)2026 */
package com.ammann.glycemia.dto;

import com.ammann.glycemia.service.GlycemicVariabilityService;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

@Schema(description = "Glycemic variability indices calculated over one glucose series")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GlycemicIndexReportDTO(
        @Schema(description = "Index name to value in registration order; null when the index is undefined for the input")
        @JsonInclude(content = JsonInclude.Include.ALWAYS)
        Map<String, Double> indices,

        @Schema(description = "Number of rows in the series")
        Long sampleCount,

        @Schema(description = "Number of missing readings")
        Long missingCount,

        @Schema(description = "Unit of the readings")
        String unit,

        @Schema(description = "Minutes between consecutive readings")
        Double intervalMinutes,

        @Schema(description = "Processing time in nanoseconds")
        Long processingTimeNs
) {
    /**
     * Converts a service result to its JSON form, mapping undefined results to {@code null}.
     *
     * @param result service calculation result
     * @return DTO ready for JSON serialization
     */
    public static GlycemicIndexReportDTO from(GlycemicVariabilityService.AnalysisResult result) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, OptionalDouble> entry : result.indices().entrySet()) {
            OptionalDouble value = entry.getValue();
            values.put(entry.getKey(), value.isPresent() ? value.getAsDouble() : null);
        }
        return new GlycemicIndexReportDTO(
                values,
                (long) result.sampleCount(),
                (long) result.missingCount(),
                result.config().unit().getLabel(),
                result.config().intervalMinutes(),
                result.processingTimeNanos()
        );
    }
}
