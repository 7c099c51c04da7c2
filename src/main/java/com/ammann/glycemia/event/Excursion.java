/* (C)2026 */
package com.ammann.glycemia.event;

import com.ammann.glycemia.config.CalculationConfig;

/**
 * Direction of an out-of-range excursion relative to a threshold.
 *
 * <p>Both comparisons are strict: a reading equal to the threshold is in range. A
 * missing reading ({@code NaN}) is never beyond a threshold.
 */
public enum Excursion
{
    /** Hypoglycemia: {@code glucose < threshold}. */
    BELOW("hypo") {
        @Override
        public boolean isBeyond(double glucose, double threshold) {
            return glucose < threshold;
        }

        @Override
        public int defaultThreshold(CalculationConfig config) {
            return config.hypoThreshold();
        }
    },
    /** Hyperglycemia: {@code glucose > threshold}. */
    ABOVE("hyper") {
        @Override
        public boolean isBeyond(double glucose, double threshold) {
            return glucose > threshold;
        }

        @Override
        public int defaultThreshold(CalculationConfig config) {
            return config.hyperThreshold();
        }
    };

    private final String label;

    Excursion(String label) {
        this.label = label;
    }

    public abstract boolean isBeyond(double glucose, double threshold);

    /** Threshold used when none is passed explicitly. */
    public abstract int defaultThreshold(CalculationConfig config);

    public String getLabel() { return label; }
}
