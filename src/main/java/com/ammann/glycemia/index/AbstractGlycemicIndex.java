/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.exception.ValidationException;
import com.ammann.glycemia.model.GlucoseSeries;
import org.jboss.logging.Logger;

import java.util.OptionalDouble;

/**
 * Base class holding the series and configuration an index is bound to.
 *
 * <p>Both are validated on construction; subclasses only read them.
 */
public abstract class AbstractGlycemicIndex implements GlycemicIndex
{
    private static final Logger LOG = Logger.getLogger(AbstractGlycemicIndex.class);

    protected final GlucoseSeries series;
    protected final CalculationConfig config;

    protected AbstractGlycemicIndex(GlucoseSeries series, CalculationConfig config)
    {
        if (series == null) {
            throw ValidationException.invalidParameter("series", null, "a GlucoseSeries");
        }
        if (config == null) {
            throw ValidationException.invalidParameter("config", null, "a CalculationConfig");
        }
        this.series = series;
        this.config = config;
    }

    /**
     * Wraps a computed value, mapping NaN and infinities to the undefined result.
     */
    protected OptionalDouble result(double value)
    {
        if (!Double.isFinite(value)) {
            LOG.debugf("%s is undefined for %s", getClass().getSimpleName(), series);
            return OptionalDouble.empty();
        }
        LOG.debugf("%s calculated: %.4f", getClass().getSimpleName(), value);
        return OptionalDouble.of(value);
    }

    /**
     * Converts a time window to a whole number of samples, rounding half up.
     *
     * @param parameterName name reported if the window is shorter than half an interval
     * @param windowMinutes window length in minutes
     * @return lag in samples, at least 1
     */
    protected int lagSamples(String parameterName, double windowMinutes)
    {
        long lag = (long) Math.floor(windowMinutes / config.intervalMinutes() + 0.5);
        if (lag < 1 || lag > Integer.MAX_VALUE) {
            throw ValidationException.invalidParameter(parameterName, windowMinutes + " min",
                    String.format("a window of at least half the sampling interval (%.2f min)",
                            config.intervalMinutes()));
        }
        return (int) lag;
    }
}
