/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.OptionalDouble;

/** Total number of rows, missing readings included. */
public class RecordCountIndex extends AbstractGlycemicIndex
{
    public RecordCountIndex(GlucoseSeries series, CalculationConfig config)
    {
        super(series, config);
    }

    @Override
    public OptionalDouble calculate()
    {
        return OptionalDouble.of(series.size());
    }
}
