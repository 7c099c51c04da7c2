/* (C)2026 */
package com.ammann.glycemia.dto;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.enumeration.GlucoseUnit;
import com.ammann.glycemia.index.IndexArguments;
import com.ammann.glycemia.model.GlucoseSeries;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

/**
 * Request payload for a batch index calculation. Every configuration field is optional
 * and falls back to the server default.
 */
@Schema(description = "Glucose readings and calculation parameters for a batch of glycemic indices")
public record IndexCalculationRequestDTO(
        @Schema(description = "Glucose readings in time order; null marks a missing reading", required = true)
        List<Double> glucose,

        @Schema(description = "Unit of the readings: 'mg' (mg/dL) or 'mmol' (mmol/L)")
        String unit,

        @Schema(description = "Minutes between consecutive readings")
        Double intervalMinutes,

        @Schema(description = "Moving-average window in samples used by MAGE")
        Number smoothingWindowSize,

        @Schema(description = "Episodes must last strictly longer than this many minutes")
        Number eventDurationThresholdMinutes,

        @Schema(description = "Hypoglycemia threshold in the given unit")
        Number hypoThreshold,

        @Schema(description = "Hyperglycemia threshold in the given unit")
        Number hyperThreshold,

        @Schema(description = "CONGA lag in hours")
        Number congaHours,

        @Schema(description = "Index names to evaluate; the server default batch when omitted")
        List<String> indices
) {
    public GlucoseSeries toSeries() {
        return GlucoseSeries.fromReadings(glucose);
    }

    /**
     * Merges the request overrides into {@code defaults}. When the unit is overridden and
     * no threshold is given, the thresholds default to the new unit's defaults.
     *
     * @param defaults server default configuration
     * @return validated configuration for this request
     */
    public CalculationConfig toConfig(CalculationConfig defaults) {
        GlucoseUnit resolvedUnit = unit != null ? GlucoseUnit.fromLabel(unit) : defaults.unit();
        boolean unitChanged = resolvedUnit != defaults.unit();

        return new CalculationConfig(
                resolvedUnit,
                intervalMinutes != null ? intervalMinutes : defaults.intervalMinutes(),
                smoothingWindowSize != null
                        ? IndexArguments.requireWholeNumber("smoothingWindowSize", smoothingWindowSize)
                        : defaults.smoothingWindowSize(),
                eventDurationThresholdMinutes != null
                        ? eventDurationThresholdMinutes.doubleValue()
                        : defaults.eventDurationThresholdMinutes(),
                hypoThreshold != null
                        ? IndexArguments.requireWholeNumber("hypoThreshold", hypoThreshold)
                        : unitChanged ? CalculationConfig.defaultHypoThreshold(resolvedUnit) : defaults.hypoThreshold(),
                hyperThreshold != null
                        ? IndexArguments.requireWholeNumber("hyperThreshold", hyperThreshold)
                        : unitChanged ? CalculationConfig.defaultHyperThreshold(resolvedUnit) : defaults.hyperThreshold(),
                congaHours != null
                        ? IndexArguments.requireWholeNumber("congaHours", congaHours)
                        : defaults.congaHours()
        );
    }
}
