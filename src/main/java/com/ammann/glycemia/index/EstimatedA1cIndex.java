/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/**
 * Estimated HbA1c in percent, {@code (mean + 2.52) / 1.583} with the mean in mmol/L.
 */
public class EstimatedA1cIndex extends AbstractGlycemicIndex
{
    public EstimatedA1cIndex(GlucoseSeries series, CalculationConfig config)
    {
        super(series, config);
    }

    @Override
    public OptionalDouble calculate()
    {
        OptionalDouble mean = MaskedStatistics.mean(
                MaskedStatistics.map(series.values(), config.unit()::toMmolPerL));
        if (mean.isEmpty()) {
            return mean;
        }
        return result((mean.getAsDouble() + 2.52) / 1.583);
    }
}
