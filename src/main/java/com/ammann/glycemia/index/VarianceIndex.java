/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/** Population variance of the valid readings. */
public class VarianceIndex extends AbstractGlycemicIndex
{
    public VarianceIndex(GlucoseSeries series, CalculationConfig config)
    {
        super(series, config);
    }

    @Override
    public OptionalDouble calculate()
    {
        return MaskedStatistics.variance(series.values());
    }
}
