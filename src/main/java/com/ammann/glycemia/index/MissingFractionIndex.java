/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/** Fraction of rows whose reading is missing, in [0, 1]. */
public class MissingFractionIndex extends AbstractGlycemicIndex
{
    public MissingFractionIndex(GlucoseSeries series, CalculationConfig config)
    {
        super(series, config);
    }

    @Override
    public OptionalDouble calculate()
    {
        return OptionalDouble.of((double) series.missingCount() / series.size());
    }
}
