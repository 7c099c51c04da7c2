/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/**
 * Mean of daily differences (MODD): mean absolute difference between readings taken
 * 24 hours apart.
 *
 * <p>The lag is {@code round(1440 / interval)} samples, rounding half up. Pairs with a
 * missing reading are skipped. Undefined if the series is shorter than one day plus one
 * sample.
 */
public class ModdIndex extends AbstractGlycemicIndex
{
    static final double DAY_MINUTES = 24 * 60;

    public ModdIndex(GlucoseSeries series, CalculationConfig config)
    {
        super(series, config);
    }

    @Override
    public OptionalDouble calculate()
    {
        int lag = lagSamples("dayWindow", DAY_MINUTES);
        double[] differences = MaskedStatistics.lagDifferences(series.values(), lag);
        OptionalDouble mean = MaskedStatistics.mean(MaskedStatistics.map(differences, Math::abs));
        return mean.isPresent() ? result(mean.getAsDouble()) : mean;
    }
}
