/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.event.Excursion;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/**
 * Minutes spent below (time in hypo) or above (time in hyper) a threshold: the number of
 * readings beyond it times the sampling interval. No minimum episode duration applies.
 */
public class TimeBeyondThresholdIndex extends AbstractThresholdIndex
{
    public TimeBeyondThresholdIndex(GlucoseSeries series, CalculationConfig config, Excursion excursion)
    {
        super(series, config, excursion);
    }

    @Override
    protected OptionalDouble calculateValidated(int threshold)
    {
        return result(segmenter.timeBeyond(excursion, threshold));
    }
}
