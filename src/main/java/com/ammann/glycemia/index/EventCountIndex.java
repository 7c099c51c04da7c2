/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.event.Excursion;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/**
 * Number of hypo- or hyperglycemic episodes lasting strictly longer than the minimum
 * duration. An episode still open at the end of the series is not counted.
 */
public class EventCountIndex extends AbstractThresholdIndex
{
    public EventCountIndex(GlucoseSeries series, CalculationConfig config, Excursion excursion)
    {
        super(series, config, excursion);
    }

    @Override
    protected OptionalDouble calculateValidated(int threshold)
    {
        return countEvents(threshold, config.eventDurationThresholdMinutes());
    }

    /**
     * @param threshold          glucose threshold, must be positive
     * @param minDurationMinutes minimum episode duration in minutes, must not be negative
     */
    public OptionalDouble calculate(int threshold, int minDurationMinutes)
    {
        IndexArguments.requirePositive("threshold", threshold);
        IndexArguments.requireNonNegative("minDurationMinutes", minDurationMinutes);
        return countEvents(threshold, minDurationMinutes);
    }

    private OptionalDouble countEvents(int threshold, double minDurationMinutes)
    {
        return OptionalDouble.of(segmenter.countEvents(excursion, threshold, minDurationMinutes));
    }
}
