/* (C)2026 */
package com.ammann.glycemia.index;

import java.util.Arrays;
import java.util.OptionalDouble;
import java.util.function.DoubleUnaryOperator;

/**
 * Reductions over the finite elements of an array.
 *
 * <p>Every formula follows the same policy: compute element-wise, mask non-finite
 * results (missing readings, {@code log10} of zero or negative values), then reduce over
 * the remaining elements only. A reduction over zero finite elements is undefined and
 * returns an empty result.
 */
public final class MaskedStatistics
{
    private MaskedStatistics() {}

    /** Applies {@code transform} to every element; non-finite inputs stay non-finite. */
    public static double[] map(double[] values, DoubleUnaryOperator transform)
    {
        double[] mapped = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            mapped[i] = Double.isFinite(values[i]) ? transform.applyAsDouble(values[i]) : Double.NaN;
        }
        return mapped;
    }

    public static double[] finiteValues(double[] values)
    {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    public static int finiteCount(double[] values)
    {
        int count = 0;
        for (double value : values) {
            if (Double.isFinite(value)) {
                count++;
            }
        }
        return count;
    }

    /** Sum of finite elements; 0 when there are none. */
    public static double sum(double[] values)
    {
        double sum = 0.0;
        for (double value : values) {
            if (Double.isFinite(value)) {
                sum += value;
            }
        }
        return sum;
    }

    public static OptionalDouble mean(double[] values)
    {
        int count = finiteCount(values);
        if (count == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(sum(values) / count);
    }

    public static OptionalDouble median(double[] values)
    {
        double[] sorted = finiteValues(values);
        if (sorted.length == 0) {
            return OptionalDouble.empty();
        }
        Arrays.sort(sorted);
        int middle = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return OptionalDouble.of(sorted[middle]);
        }
        return OptionalDouble.of((sorted[middle - 1] + sorted[middle]) / 2.0);
    }

    /** Population variance (divisor n). */
    public static OptionalDouble variance(double[] values)
    {
        OptionalDouble mean = mean(values);
        if (mean.isEmpty()) {
            return OptionalDouble.empty();
        }
        double center = mean.getAsDouble();
        double squares = 0.0;
        int count = 0;
        for (double value : values) {
            if (Double.isFinite(value)) {
                squares += (value - center) * (value - center);
                count++;
            }
        }
        return OptionalDouble.of(squares / count);
    }

    /** Population standard deviation (divisor n). */
    public static OptionalDouble standardDeviation(double[] values)
    {
        OptionalDouble variance = variance(values);
        return variance.isPresent() ? OptionalDouble.of(Math.sqrt(variance.getAsDouble())) : variance;
    }

    /**
     * Differences {@code values[i + lag] - values[i]}. A pair with a missing element yields
     * NaN, which later reductions mask. Returns an empty array when {@code lag >= length}.
     */
    public static double[] lagDifferences(double[] values, int lag)
    {
        if (lag >= values.length) {
            return new double[0];
        }
        double[] differences = new double[values.length - lag];
        for (int i = 0; i < differences.length; i++) {
            differences[i] = values[i + lag] - values[i];
        }
        return differences;
    }
}
