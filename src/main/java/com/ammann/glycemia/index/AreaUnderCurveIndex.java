/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/**
 * Time-averaged area under the glucose curve.
 *
 * <p>Missing readings are replaced with zero, the area is integrated with the trapezoid
 * rule over the sampling interval, and the area is then divided by the interval and by
 * the number of rows. The result is therefore in glucose units, not glucose x minutes.
 * A single-row series has zero area.
 */
public class AreaUnderCurveIndex extends AbstractGlycemicIndex
{
    public AreaUnderCurveIndex(GlucoseSeries series, CalculationConfig config)
    {
        super(series, config);
    }

    @Override
    public OptionalDouble calculate()
    {
        double[] values = series.values();
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                values[i] = 0.0;
            }
        }

        double interval = config.intervalMinutes();
        double area = 0.0;
        for (int i = 1; i < values.length; i++) {
            area += (values[i - 1] + values[i]) / 2.0 * interval;
        }
        return result(area / interval / values.length);
    }
}
