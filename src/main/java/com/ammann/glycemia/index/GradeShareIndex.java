/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.enumeration.GlucoseUnit;
import com.ammann.glycemia.event.Excursion;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/**
 * Share of the total GRADE score contributed by readings beyond a fixed cut-off:
 * below 90 mg/dL (5.0 mmol/L) for GRADE hypo, above 140 mg/dL (7.8 mmol/L) for GRADE hyper.
 *
 * <p>The result is a fraction in [0, 1]. It is undefined when the finite GRADE scores sum
 * to zero or no score is finite.
 */
public class GradeShareIndex extends AbstractGlycemicIndex
{
    static final double HYPO_CUTOFF_MG_DL = 90.0;
    static final double HYPER_CUTOFF_MG_DL = 140.0;

    private final Excursion excursion;
    private final double cutoffMmolPerL;

    public GradeShareIndex(GlucoseSeries series, CalculationConfig config, Excursion excursion, double cutoffMgPerDl)
    {
        super(series, config);
        this.excursion = excursion;
        this.cutoffMmolPerL = cutoffMgPerDl / GlucoseUnit.MG_PER_MMOL;
    }

    public static GradeShareIndex hypo(GlucoseSeries series, CalculationConfig config)
    {
        return new GradeShareIndex(series, config, Excursion.BELOW, HYPO_CUTOFF_MG_DL);
    }

    public static GradeShareIndex hyper(GlucoseSeries series, CalculationConfig config)
    {
        return new GradeShareIndex(series, config, Excursion.ABOVE, HYPER_CUTOFF_MG_DL);
    }

    @Override
    public OptionalDouble calculate()
    {
        double[] scores = GradeIndex.scores(series, config);
        if (MaskedStatistics.finiteCount(scores) == 0) {
            return OptionalDouble.empty();
        }

        double total = 0.0;
        double beyond = 0.0;
        for (int i = 0; i < scores.length; i++) {
            if (!Double.isFinite(scores[i])) {
                continue;
            }
            total += scores[i];
            if (excursion.isBeyond(config.unit().toMmolPerL(series.get(i)), cutoffMmolPerL)) {
                beyond += scores[i];
            }
        }

        if (total == 0.0) {
            return OptionalDouble.empty();
        }
        return result(beyond / total);
    }
}
