/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/** Median of the valid readings; the mean of the two middle values for an even count. */
public class MedianIndex extends AbstractGlycemicIndex
{
    public MedianIndex(GlucoseSeries series, CalculationConfig config)
    {
        super(series, config);
    }

    @Override
    public OptionalDouble calculate()
    {
        return MaskedStatistics.median(series.values());
    }
}
