/* (C)2026 */
package com.ammann.glycemia.config;

import com.ammann.glycemia.enumeration.GlucoseUnit;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * CDI producer for the application-wide default {@link CalculationConfig}.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>glycemia.calc.unit</li>
 *   <li>glycemia.calc.interval-minutes</li>
 *   <li>glycemia.calc.smoothing-window-size</li>
 *   <li>glycemia.calc.event-duration-threshold-minutes</li>
 *   <li>glycemia.calc.hypo-threshold / glycemia.calc.hyper-threshold (unit default when absent)</li>
 *   <li>glycemia.calc.conga-hours</li>
 * </ul>
 *
 * <p>Requests may override any of these values per analysis run.
 */
@ApplicationScoped
public class CalculationConfigProducer {

    private static final Logger LOG = Logger.getLogger(CalculationConfigProducer.class);

    @ConfigProperty(name = "glycemia.calc.unit", defaultValue = "mg")
    String unit;

    @ConfigProperty(name = "glycemia.calc.interval-minutes", defaultValue = "5")
    double intervalMinutes;

    @ConfigProperty(name = "glycemia.calc.smoothing-window-size", defaultValue = "9")
    int smoothingWindowSize;

    @ConfigProperty(name = "glycemia.calc.event-duration-threshold-minutes", defaultValue = "15")
    double eventDurationThresholdMinutes;

    @ConfigProperty(name = "glycemia.calc.hypo-threshold", defaultValue = "0")
    int hypoThreshold;

    @ConfigProperty(name = "glycemia.calc.hyper-threshold", defaultValue = "0")
    int hyperThreshold;

    @ConfigProperty(name = "glycemia.calc.conga-hours", defaultValue = "1")
    int congaHours;

    /**
     * Produces the default calculation configuration. A threshold of 0 selects the
     * unit's default threshold.
     *
     * @return validated configuration
     */
    @Produces
    @Singleton
    public CalculationConfig defaultCalculationConfig() {
        GlucoseUnit glucoseUnit = GlucoseUnit.fromLabel(unit);
        CalculationConfig config = new CalculationConfig(
                glucoseUnit,
                intervalMinutes,
                smoothingWindowSize,
                eventDurationThresholdMinutes,
                hypoThreshold > 0 ? hypoThreshold : CalculationConfig.defaultHypoThreshold(glucoseUnit),
                hyperThreshold > 0 ? hyperThreshold : CalculationConfig.defaultHyperThreshold(glucoseUnit),
                congaHours);

        LOG.infof("Default calculation config: unit=%s, interval=%.1f min, window=%d, minEventDuration=%.1f min",
                glucoseUnit.getLabel(), intervalMinutes, smoothingWindowSize, eventDurationThresholdMinutes);
        return config;
    }
}
