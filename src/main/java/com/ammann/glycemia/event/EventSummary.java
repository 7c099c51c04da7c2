/* (C)2026 */
package com.ammann.glycemia.event;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Qualifying episodes found by one segmentation pass.
 *
 * @param excursion       direction that was scanned for
 * @param threshold       threshold the readings were compared against
 * @param durationsMinutes duration of each qualifying episode, in series order
 */
public record EventSummary(
        Excursion excursion,
        int threshold,
        List<Double> durationsMinutes
) {
    public EventSummary {
        durationsMinutes = List.copyOf(durationsMinutes);
    }

    public int count() {
        return durationsMinutes.size();
    }

    /** Mean episode duration in minutes; empty when no episode qualified. */
    public OptionalDouble meanDurationMinutes() {
        return durationsMinutes.stream().mapToDouble(Double::doubleValue).average();
    }

    public double totalDurationMinutes() {
        return durationsMinutes.stream().mapToDouble(Double::doubleValue).sum();
    }
}
