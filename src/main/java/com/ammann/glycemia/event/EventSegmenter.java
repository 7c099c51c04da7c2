/* (C)2026 */
package com.ammann.glycemia.event;

import com.ammann.glycemia.exception.ValidationException;
import com.ammann.glycemia.model.GlucoseSeries;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects hypo- and hyperglycemic episodes in a glucose series.
 *
 * <p>An episode is a maximal run of consecutive readings beyond a threshold. A single
 * left-to-right pass counts the current run; when a reading ends the run, the run
 * qualifies if its length in samples is strictly greater than
 * {@code minDurationMinutes / intervalMinutes}. The comparison is made against the
 * fractional sample count, not a rounded one. A run still open when the series ends is
 * discarded, never evaluated. A missing reading ends a run like an in-range reading does.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public class EventSegmenter
{
    private static final Logger LOG = Logger.getLogger(EventSegmenter.class);

    private final GlucoseSeries series;
    private final double intervalMinutes;

    public EventSegmenter(GlucoseSeries series, double intervalMinutes)
    {
        if (series == null) {
            throw ValidationException.invalidParameter("series", null, "a GlucoseSeries");
        }
        if (!(intervalMinutes > 0) || Double.isInfinite(intervalMinutes)) {
            throw ValidationException.invalidParameter("intervalMinutes", intervalMinutes, "positive number");
        }
        this.series = series;
        this.intervalMinutes = intervalMinutes;
    }

    /**
     * Finds the qualifying episodes beyond {@code threshold}.
     *
     * @param excursion          direction of the episodes
     * @param threshold          glucose threshold, in the series' unit
     * @param minDurationMinutes an episode must last strictly longer than this
     * @return qualifying episodes in series order
     */
    public EventSummary segment(Excursion excursion, int threshold, double minDurationMinutes)
    {
        if (excursion == null) {
            throw ValidationException.invalidParameter("excursion", null, "BELOW or ABOVE");
        }
        if (!(minDurationMinutes >= 0) || Double.isInfinite(minDurationMinutes)) {
            throw ValidationException.invalidParameter("minDurationMinutes", minDurationMinutes, "non-negative number");
        }

        double minSamples = minDurationMinutes / intervalMinutes;
        List<Double> durations = new ArrayList<>();
        int run = 0;

        for (int i = 0; i < series.size(); i++) {
            if (excursion.isBeyond(series.get(i), threshold)) {
                run++;
                continue;
            }
            if (run > minSamples) {
                durations.add(run * intervalMinutes);
            }
            run = 0;
        }

        if (run > 0) {
            LOG.debugf("Discarding %s run of %d samples still open at end of series", excursion.getLabel(), run);
        }

        LOG.debugf("Found %d %s episodes (threshold=%d, min duration=%.1f min)",
                durations.size(), excursion.getLabel(), threshold, minDurationMinutes);

        return new EventSummary(excursion, threshold, durations);
    }

    public int countEvents(Excursion excursion, int threshold, double minDurationMinutes)
    {
        return segment(excursion, threshold, minDurationMinutes).count();
    }

    /**
     * Total minutes beyond {@code threshold}, counting every reading beyond it regardless of
     * episode length.
     */
    public double timeBeyond(Excursion excursion, int threshold)
    {
        if (excursion == null) {
            throw ValidationException.invalidParameter("excursion", null, "BELOW or ABOVE");
        }
        int samples = 0;
        for (int i = 0; i < series.size(); i++) {
            if (excursion.isBeyond(series.get(i), threshold)) {
                samples++;
            }
        }
        return samples * intervalMinutes;
    }

    /**
     * Total minutes of valid readings inside the inclusive band {@code [low, high]}.
     */
    public double timeWithin(int low, int high)
    {
        if (low > high) {
            throw ValidationException.invalidParameter("low", low, "a value not above high (" + high + ")");
        }
        int samples = 0;
        for (int i = 0; i < series.size(); i++) {
            double glucose = series.get(i);
            if (!Excursion.BELOW.isBeyond(glucose, low)
                    && !Excursion.ABOVE.isBeyond(glucose, high)
                    && !Double.isNaN(glucose)) {
                samples++;
            }
        }
        return samples * intervalMinutes;
    }
}
