/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.event.Excursion;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/**
 * Number of readings strictly below (hypoglycemia) or strictly above (hyperglycemia)
 * a threshold. Missing readings are never counted.
 */
public class ThresholdCountIndex extends AbstractThresholdIndex
{
    public ThresholdCountIndex(GlucoseSeries series, CalculationConfig config, Excursion excursion)
    {
        super(series, config, excursion);
    }

    @Override
    protected OptionalDouble calculateValidated(int threshold)
    {
        int count = 0;
        for (int i = 0; i < series.size(); i++) {
            if (excursion.isBeyond(series.get(i), threshold)) {
                count++;
            }
        }
        return OptionalDouble.of(count);
    }
}
