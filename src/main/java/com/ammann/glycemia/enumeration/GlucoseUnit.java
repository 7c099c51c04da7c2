/* (C)2026 */
package com.ammann.glycemia.enumeration;

import com.ammann.glycemia.exception.ValidationException;

/**
 * Unit system in which glucose readings are expressed.
 *
 * <p>Unit-dependent formulas convert between the two systems with the fixed factor
 * {@link #MG_PER_MMOL} (mg/dL = mmol/L x 18).
 */
public enum GlucoseUnit
{
    /** Milligrams per decilitre. */
    MG("mg"),
    /** Millimoles per litre. */
    MMOL("mmol");

    public static final double MG_PER_MMOL = 18.0;

    private final String label;

    GlucoseUnit(String label) {
        this.label = label;
    }

    /**
     * Resolves a unit from its configuration label ({@code "mg"} or {@code "mmol"}).
     *
     * @param label configuration label, matched exactly
     * @return matching unit
     * @throws ValidationException if the label is unknown
     */
    public static GlucoseUnit fromLabel(String label) {
        if (label != null) {
            for (GlucoseUnit unit : values()) {
                if (unit.label.equals(label)) {
                    return unit;
                }
            }
        }
        throw ValidationException.invalidParameter("unit", label, "one of 'mg', 'mmol'");
    }

    /** Converts a reading in this unit to mg/dL. */
    public double toMgPerDl(double value) {
        return this == MMOL ? value * MG_PER_MMOL : value;
    }

    /** Converts a reading in this unit to mmol/L. */
    public double toMmolPerL(double value) {
        return this == MG ? value / MG_PER_MMOL : value;
    }

    public String getLabel() { return label; }
}
