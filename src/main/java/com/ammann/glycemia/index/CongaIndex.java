/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/**
 * Continuous overall net glycemic action (CONGA-n): population variance of the
 * differences between readings {@code n} hours apart.
 *
 * <p>The lag is {@code round(n * 60 / interval)} samples, rounding half up. Pairs with a
 * missing reading are skipped.
 */
public class CongaIndex extends AbstractGlycemicIndex
{
    public CongaIndex(GlucoseSeries series, CalculationConfig config)
    {
        super(series, config);
    }

    /** CONGA over the configured default number of hours. */
    @Override
    public OptionalDouble calculate()
    {
        return calculate(config.congaHours());
    }

    /**
     * @param hours lag in hours, must be positive
     */
    public OptionalDouble calculate(int hours)
    {
        IndexArguments.requirePositive("hours", hours);

        int lag = lagSamples("hours", hours * 60.0);
        double[] differences = MaskedStatistics.lagDifferences(series.values(), lag);
        OptionalDouble variance = MaskedStatistics.variance(differences);
        return variance.isPresent() ? result(variance.getAsDouble()) : variance;
    }
}
