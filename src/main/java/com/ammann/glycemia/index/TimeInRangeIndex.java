/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.event.EventSegmenter;
import com.ammann.glycemia.exception.ValidationException;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/**
 * Minutes of valid readings inside the inclusive band {@code [low, high]}. The default band
 * runs from the configured hypoglycemia to the configured hyperglycemia threshold.
 */
public class TimeInRangeIndex extends AbstractGlycemicIndex
{
    private final EventSegmenter segmenter;

    public TimeInRangeIndex(GlucoseSeries series, CalculationConfig config)
    {
        super(series, config);
        this.segmenter = new EventSegmenter(series, config.intervalMinutes());
    }

    @Override
    public OptionalDouble calculate()
    {
        return calculate(config.hypoThreshold(), config.hyperThreshold());
    }

    public OptionalDouble calculate(int low, int high)
    {
        IndexArguments.requirePositive("low", low);
        IndexArguments.requirePositive("high", high);
        if (low > high) {
            throw ValidationException.invalidParameter("low", low, "a value not above high (" + high + ")");
        }
        return result(segmenter.timeWithin(low, high));
    }
}
