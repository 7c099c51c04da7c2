/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.exception.ValidationException;

/**
 * Validation of per-call index arguments. Every check runs before any computation and
 * reports the offending parameter by name.
 */
public final class IndexArguments
{
    private IndexArguments() {}

    public static int requirePositive(String name, int value)
    {
        if (value <= 0) {
            throw ValidationException.invalidParameter(name, value, "positive integer");
        }
        return value;
    }

    public static int requireNonNegative(String name, int value)
    {
        if (value < 0) {
            throw ValidationException.invalidParameter(name, value, "non-negative integer");
        }
        return value;
    }

    /**
     * Converts an untyped numeric argument (e.g. from JSON) to an {@code int}, rejecting
     * null, non-finite and fractional values.
     *
     * @param name  parameter name used in the error message
     * @param value numeric argument
     * @return the value as an int
     */
    public static int requireWholeNumber(String name, Number value)
    {
        if (value == null) {
            throw ValidationException.invalidParameter(name, null, "integer");
        }
        double asDouble = value.doubleValue();
        if (!Double.isFinite(asDouble)
                || asDouble != Math.rint(asDouble)
                || asDouble > Integer.MAX_VALUE
                || asDouble < Integer.MIN_VALUE) {
            throw ValidationException.invalidParameter(name, value, "integer");
        }
        return (int) asDouble;
    }
}
