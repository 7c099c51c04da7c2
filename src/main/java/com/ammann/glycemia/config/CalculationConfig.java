/* (C)2026 */
package com.ammann.glycemia.config;

import com.ammann.glycemia.enumeration.GlucoseUnit;
import com.ammann.glycemia.exception.ValidationException;

/**
 * Immutable parameter bundle shared by every index of one analysis run.
 *
 * <p>All fields are validated once in the canonical constructor. The threshold and
 * CONGA defaults are only used when a parameterized index is evaluated without explicit
 * arguments, e.g. in batch mode.
 *
 * @param unit                          unit of the glucose readings
 * @param intervalMinutes               nominal minutes between consecutive readings
 * @param smoothingWindowSize           moving-average window in samples (MAGE)
 * @param eventDurationThresholdMinutes an episode must last strictly longer than this to count
 * @param hypoThreshold                 default hypoglycemia threshold, in {@code unit}
 * @param hyperThreshold                default hyperglycemia threshold, in {@code unit}
 * @param congaHours                    default CONGA lag in hours
 */
public record CalculationConfig(
        GlucoseUnit unit,
        double intervalMinutes,
        int smoothingWindowSize,
        double eventDurationThresholdMinutes,
        int hypoThreshold,
        int hyperThreshold,
        int congaHours
) {
    public static final int DEFAULT_SMOOTHING_WINDOW_SIZE = 9;
    public static final double DEFAULT_EVENT_DURATION_THRESHOLD_MINUTES = 15.0;
    public static final int DEFAULT_CONGA_HOURS = 1;

    public CalculationConfig {
        if (unit == null) {
            throw ValidationException.invalidParameter("unit", null, "one of 'mg', 'mmol'");
        }
        if (!(intervalMinutes > 0) || Double.isInfinite(intervalMinutes)) {
            throw ValidationException.invalidParameter("intervalMinutes", intervalMinutes, "positive number");
        }
        if (smoothingWindowSize <= 0) {
            throw ValidationException.invalidParameter("smoothingWindowSize", smoothingWindowSize, "positive integer");
        }
        if (!(eventDurationThresholdMinutes >= 0) || Double.isInfinite(eventDurationThresholdMinutes)) {
            throw ValidationException.invalidParameter(
                    "eventDurationThresholdMinutes", eventDurationThresholdMinutes, "non-negative number");
        }
        if (hypoThreshold <= 0) {
            throw ValidationException.invalidParameter("hypoThreshold", hypoThreshold, "positive integer");
        }
        if (hyperThreshold <= 0) {
            throw ValidationException.invalidParameter("hyperThreshold", hyperThreshold, "positive integer");
        }
        if (congaHours <= 0) {
            throw ValidationException.invalidParameter("congaHours", congaHours, "positive integer");
        }
    }

    /**
     * Creates a configuration with default window, duration and thresholds for the unit.
     *
     * @param unit            unit of the readings
     * @param intervalMinutes sampling interval in minutes
     * @return validated configuration
     */
    public static CalculationConfig defaults(GlucoseUnit unit, double intervalMinutes) {
        if (unit == null) {
            throw ValidationException.invalidParameter("unit", null, "one of 'mg', 'mmol'");
        }
        return new CalculationConfig(
                unit,
                intervalMinutes,
                DEFAULT_SMOOTHING_WINDOW_SIZE,
                DEFAULT_EVENT_DURATION_THRESHOLD_MINUTES,
                defaultHypoThreshold(unit),
                defaultHyperThreshold(unit),
                DEFAULT_CONGA_HOURS);
    }

    /** 70 mg/dL, or 4 mmol/L. */
    public static int defaultHypoThreshold(GlucoseUnit unit) {
        return unit == GlucoseUnit.MMOL ? 4 : 70;
    }

    /** 180 mg/dL, or 10 mmol/L. */
    public static int defaultHyperThreshold(GlucoseUnit unit) {
        return unit == GlucoseUnit.MMOL ? 10 : 180;
    }

    /** Number of samples covering the event duration threshold; may be fractional. */
    public double eventDurationThresholdSamples() {
        return eventDurationThresholdMinutes / intervalMinutes;
    }

    public CalculationConfig withUnit(GlucoseUnit newUnit) {
        return new CalculationConfig(newUnit, intervalMinutes, smoothingWindowSize,
                eventDurationThresholdMinutes, hypoThreshold, hyperThreshold, congaHours);
    }

    public CalculationConfig withEventDurationThresholdMinutes(double minutes) {
        return new CalculationConfig(unit, intervalMinutes, smoothingWindowSize,
                minutes, hypoThreshold, hyperThreshold, congaHours);
    }

    public CalculationConfig withSmoothingWindowSize(int windowSize) {
        return new CalculationConfig(unit, intervalMinutes, windowSize,
                eventDurationThresholdMinutes, hypoThreshold, hyperThreshold, congaHours);
    }
}
