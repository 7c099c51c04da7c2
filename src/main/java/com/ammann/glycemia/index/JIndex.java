/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/**
 * J-index, {@code 0.001 * (mean + sd)^2} over readings expressed in mg/dL.
 */
public class JIndex extends AbstractGlycemicIndex
{
    public JIndex(GlucoseSeries series, CalculationConfig config)
    {
        super(series, config);
    }

    @Override
    public OptionalDouble calculate()
    {
        double[] mgPerDl = MaskedStatistics.map(series.values(), config.unit()::toMgPerDl);
        OptionalDouble mean = MaskedStatistics.mean(mgPerDl);
        OptionalDouble sd = MaskedStatistics.standardDeviation(mgPerDl);
        if (mean.isEmpty() || sd.isEmpty()) {
            return OptionalDouble.empty();
        }
        double sum = mean.getAsDouble() + sd.getAsDouble();
        return result(0.001 * sum * sum);
    }
}
