/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/**
 * Coefficient of variation, computed as {@code variance / mean} of the valid readings.
 *
 * <p>Note that this divides the variance, not the standard deviation, by the mean.
 * Undefined when every reading is missing or the mean is zero.
 */
public class CoefficientOfVariationIndex extends AbstractGlycemicIndex
{
    public CoefficientOfVariationIndex(GlucoseSeries series, CalculationConfig config)
    {
        super(series, config);
    }

    @Override
    public OptionalDouble calculate()
    {
        double[] values = series.values();
        OptionalDouble mean = MaskedStatistics.mean(values);
        OptionalDouble variance = MaskedStatistics.variance(values);
        if (mean.isEmpty() || variance.isEmpty()) {
            return OptionalDouble.empty();
        }
        return result(variance.getAsDouble() / mean.getAsDouble());
    }
}
