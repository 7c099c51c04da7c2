/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/** Population standard deviation of the valid readings. */
public class StandardDeviationIndex extends AbstractGlycemicIndex
{
    public StandardDeviationIndex(GlucoseSeries series, CalculationConfig config)
    {
        super(series, config);
    }

    @Override
    public OptionalDouble calculate()
    {
        return MaskedStatistics.standardDeviation(series.values());
    }
}
