/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;

/**
 * Constructs an index bound to a series and configuration.
 */
@FunctionalInterface
public interface IndexFactory
{
    GlycemicIndex create(GlucoseSeries series, CalculationConfig config);
}
