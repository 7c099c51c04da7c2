/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/**
 * Glycemic Risk Assessment Diabetes Equation: mean of the per-sample score
 * {@code 425 * (log10(log10(g) + 0.16))^2} with {@code g} in mmol/L.
 *
 * <p>mg/dL readings are divided by 18 before scoring, so both unit systems yield the
 * same value for the same physical series. Scores that are not finite (readings close to
 * or below zero) are masked.
 */
public class GradeIndex extends AbstractGlycemicIndex
{
    public GradeIndex(GlucoseSeries series, CalculationConfig config)
    {
        super(series, config);
    }

    /** GRADE score of a single reading in mmol/L; NaN outside the formula's domain. */
    static double score(double mmolPerL)
    {
        double inner = Math.log10(Math.log10(mmolPerL) + 0.16);
        return 425.0 * inner * inner;
    }

    /** Per-sample scores of the series, in row order. */
    static double[] scores(GlucoseSeries series, CalculationConfig config)
    {
        return MaskedStatistics.map(series.values(),
                glucose -> score(config.unit().toMmolPerL(glucose)));
    }

    @Override
    public OptionalDouble calculate()
    {
        OptionalDouble mean = MaskedStatistics.mean(scores(series, config));
        return mean.isPresent() ? result(mean.getAsDouble()) : mean;
    }
}
