/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.event.EventSegmenter;
import com.ammann.glycemia.event.Excursion;
import com.ammann.glycemia.exception.ValidationException;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/**
 * Base class for indices that compare readings against a threshold.
 *
 * <p>The threshold is a call-time argument, validated on every call. The no-argument
 * {@link #calculate()} uses the configured hypo- or hyperglycemia threshold.
 */
public abstract class AbstractThresholdIndex extends AbstractGlycemicIndex
{
    protected final Excursion excursion;
    protected final EventSegmenter segmenter;

    protected AbstractThresholdIndex(GlucoseSeries series, CalculationConfig config, Excursion excursion)
    {
        super(series, config);
        if (excursion == null) {
            throw ValidationException.invalidParameter("excursion", null, "BELOW or ABOVE");
        }
        this.excursion = excursion;
        this.segmenter = new EventSegmenter(series, config.intervalMinutes());
    }

    @Override
    public OptionalDouble calculate()
    {
        return calculate(excursion.defaultThreshold(config));
    }

    /**
     * @param threshold glucose threshold in the configured unit, must be positive
     */
    public OptionalDouble calculate(int threshold)
    {
        IndexArguments.requirePositive("threshold", threshold);
        return calculateValidated(threshold);
    }

    /** Computes the index for an already validated threshold. */
    protected abstract OptionalDouble calculateValidated(int threshold);
}
