/* (C)2026 */
package com.ammann.glycemia.model;

import com.ammann.glycemia.exception.ValidationException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Read-only, time-ordered sequence of glucose readings spaced at the configured interval.
 *
 * <p>Missing readings are stored as {@link Double#NaN}. The series always holds at
 * least one row; it may consist of missing readings only. The backing array is copied
 * on construction and never exposed, so a series can be shared across threads.
 */
public final class GlucoseSeries
{
    /** Name of the required glucose column in tabular input. */
    public static final String GLUCOSE_COLUMN = "glucose";

    private final double[] readings;

    private GlucoseSeries(double[] readings)
    {
        this.readings = readings;
    }

    /**
     * Creates a series from raw readings; {@code NaN} marks a missing reading.
     *
     * @throws ValidationException if {@code readings} is null or empty, or holds an infinite reading
     */
    public static GlucoseSeries of(double... readings)
    {
        if (readings == null) {
            throw ValidationException.invalidParameter("series", null, "non-null sequence of readings");
        }
        if (readings.length == 0) {
            throw ValidationException.insufficientData("glucose readings", 1, 0);
        }
        for (double reading : readings) {
            if (Double.isInfinite(reading)) {
                throw ValidationException.invalidParameter("glucose", reading, "finite reading or missing");
            }
        }
        return new GlucoseSeries(readings.clone());
    }

    /**
     * Creates a series from a list of readings; {@code null} elements are missing readings.
     */
    public static GlucoseSeries fromReadings(List<? extends Number> readings)
    {
        if (readings == null) {
            throw ValidationException.invalidParameter("series", null, "non-null sequence of readings");
        }
        return of(toArray(readings));
    }

    /**
     * Creates a series from a column-oriented table. Only the {@value #GLUCOSE_COLUMN}
     * column is read; other columns (timestamps etc.) are ignored.
     *
     * @param table column name to column values
     * @return series over the glucose column
     * @throws ValidationException if the table is null or lacks the glucose column
     */
    public static GlucoseSeries fromTable(Map<String, ? extends List<? extends Number>> table)
    {
        if (table == null) {
            throw ValidationException.invalidParameter("table", null, "column-oriented table");
        }
        List<? extends Number> column = table.get(GLUCOSE_COLUMN);
        if (column == null) {
            throw ValidationException.invalidParameter("table", table.keySet(),
                    "a '" + GLUCOSE_COLUMN + "' column");
        }
        return of(toArray(column));
    }

    private static double[] toArray(List<? extends Number> values)
    {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            Number value = values.get(i);
            array[i] = value == null ? Double.NaN : value.doubleValue();
        }
        return array;
    }

    public int size()
    {
        return readings.length;
    }

    /** Reading at position {@code index}; {@code NaN} when missing. */
    public double get(int index)
    {
        return readings[index];
    }

    public boolean isMissing(int index)
    {
        return Double.isNaN(readings[index]);
    }

    /** Copy of all readings, missing ones included as {@code NaN}. */
    public double[] values()
    {
        return readings.clone();
    }

    /** Copy of the non-missing readings in their original order. */
    public double[] validValues()
    {
        return Arrays.stream(readings).filter(value -> !Double.isNaN(value)).toArray();
    }

    public int missingCount()
    {
        int missing = 0;
        for (double reading : readings) {
            if (Double.isNaN(reading)) {
                missing++;
            }
        }
        return missing;
    }

    public boolean isAllMissing()
    {
        return missingCount() == readings.length;
    }

    @Override
    public String toString()
    {
        return "GlucoseSeries[size=" + readings.length + ", missing=" + missingCount() + "]";
    }
}
