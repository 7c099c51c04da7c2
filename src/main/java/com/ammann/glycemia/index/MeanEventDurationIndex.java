/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.event.Excursion;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/**
 * Mean duration in minutes of the qualifying hypo- or hyperglycemic episodes.
 *
 * <p>Undefined (empty) when no episode qualifies.
 */
public class MeanEventDurationIndex extends AbstractThresholdIndex
{
    public MeanEventDurationIndex(GlucoseSeries series, CalculationConfig config, Excursion excursion)
    {
        super(series, config, excursion);
    }

    @Override
    protected OptionalDouble calculateValidated(int threshold)
    {
        return meanDuration(threshold, config.eventDurationThresholdMinutes());
    }

    /**
     * @param threshold          glucose threshold, must be positive
     * @param minDurationMinutes minimum episode duration in minutes, must not be negative
     */
    public OptionalDouble calculate(int threshold, int minDurationMinutes)
    {
        IndexArguments.requirePositive("threshold", threshold);
        IndexArguments.requireNonNegative("minDurationMinutes", minDurationMinutes);
        return meanDuration(threshold, minDurationMinutes);
    }

    private OptionalDouble meanDuration(int threshold, double minDurationMinutes)
    {
        return segmenter.segment(excursion, threshold, minDurationMinutes).meanDurationMinutes();
    }
}
