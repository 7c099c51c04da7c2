/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/** Mean of the valid readings. */
public class MeanIndex extends AbstractGlycemicIndex
{
    public MeanIndex(GlucoseSeries series, CalculationConfig config)
    {
        super(series, config);
    }

    @Override
    public OptionalDouble calculate()
    {
        return MaskedStatistics.mean(series.values());
    }
}
