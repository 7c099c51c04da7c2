/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/**
 * Logarithmic deviation from the 100 mg/dL reference: mean of
 * {@code 1000 * log10(glucose / 100)} with glucose in mg/dL.
 *
 * <p>Readings at or below zero produce non-finite terms and are masked.
 */
public class M100Index extends AbstractGlycemicIndex
{
    private static final double REFERENCE_MG_DL = 100.0;

    public M100Index(GlucoseSeries series, CalculationConfig config)
    {
        super(series, config);
    }

    @Override
    public OptionalDouble calculate()
    {
        double[] terms = MaskedStatistics.map(series.values(),
                glucose -> 1000.0 * Math.log10(config.unit().toMgPerDl(glucose) / REFERENCE_MG_DL));
        OptionalDouble mean = MaskedStatistics.mean(terms);
        return mean.isPresent() ? result(mean.getAsDouble()) : mean;
    }
}
