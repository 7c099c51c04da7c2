/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/**
 * Low (LBGI) and high (HBGI) blood glucose risk indices.
 *
 * <p>Each reading in mg/dL is transformed by
 * {@code f = 1.509 * (log10(g)^1.084 - 5.381)} and {@code r = 10 * f^2}. The low index
 * averages {@code r} with contributions where {@code f > 0} set to zero; the high index
 * zeroes contributions where {@code f < 0}. Readings at or below zero, or in (0, 1) where
 * the fractional power is undefined, are masked.
 */
public class BloodGlucoseRiskIndex extends AbstractGlycemicIndex
{
    /** Which side of the symmetry point contributes risk. */
    public enum Side
    {
        LOW,
        HIGH
    }

    private final Side side;

    public BloodGlucoseRiskIndex(GlucoseSeries series, CalculationConfig config, Side side)
    {
        super(series, config);
        this.side = side;
    }

    public static BloodGlucoseRiskIndex low(GlucoseSeries series, CalculationConfig config)
    {
        return new BloodGlucoseRiskIndex(series, config, Side.LOW);
    }

    public static BloodGlucoseRiskIndex high(GlucoseSeries series, CalculationConfig config)
    {
        return new BloodGlucoseRiskIndex(series, config, Side.HIGH);
    }

    static double riskFunction(double mgPerDl)
    {
        return 1.509 * (Math.pow(Math.log10(mgPerDl), 1.084) - 5.381);
    }

    @Override
    public OptionalDouble calculate()
    {
        double[] risks = MaskedStatistics.map(series.values(), glucose -> {
            double f = riskFunction(config.unit().toMgPerDl(glucose));
            if (!Double.isFinite(f)) {
                return Double.NaN;
            }
            boolean contributes = side == Side.LOW ? f <= 0 : f >= 0;
            return contributes ? 10.0 * f * f : 0.0;
        });
        OptionalDouble mean = MaskedStatistics.mean(risks);
        return mean.isPresent() ? result(mean.getAsDouble()) : mean;
    }

    public Side getSide()
    {
        return side;
    }
}
