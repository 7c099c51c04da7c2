/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Mean amplitude of glycemic excursions (MAGE).
 *
 * <p>Steps:
 * <ol>
 *   <li>Replace missing readings with the mean of the valid readings.</li>
 *   <li>Smooth with a centered moving average of {@code smoothingWindowSize} samples,
 *       keeping only fully covered positions ({@code n - window + 1} values).</li>
 *   <li>Locate turning points of the smoothed curve: the first value, every local peak
 *       and nadir (a plateau counts once), and the last value.</li>
 *   <li>Take the amplitude between each pair of consecutive turning points and average
 *       the amplitudes strictly greater than one population standard deviation of the
 *       valid readings. Rising and falling excursions both count.</li>
 * </ol>
 *
 * <p>Undefined when every reading is missing, when the window is longer than the series,
 * or when no excursion exceeds one standard deviation.
 */
public class MageIndex extends AbstractGlycemicIndex
{
    private static final Logger LOG = Logger.getLogger(MageIndex.class);

    public MageIndex(GlucoseSeries series, CalculationConfig config)
    {
        super(series, config);
    }

    @Override
    public OptionalDouble calculate()
    {
        double[] values = series.values();
        OptionalDouble mean = MaskedStatistics.mean(values);
        OptionalDouble sd = MaskedStatistics.standardDeviation(values);
        if (mean.isEmpty() || sd.isEmpty()) {
            return OptionalDouble.empty();
        }

        int window = config.smoothingWindowSize();
        if (window > values.length) {
            LOG.warnf("MAGE: smoothing window of %d samples exceeds series length %d",
                    window, values.length);
            return OptionalDouble.empty();
        }

        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                values[i] = mean.getAsDouble();
            }
        }

        double[] smoothed = movingAverage(values, window);
        List<Double> turningPoints = turningPoints(smoothed);

        double threshold = sd.getAsDouble();
        double amplitudeSum = 0.0;
        int excursions = 0;
        for (int i = 1; i < turningPoints.size(); i++) {
            double amplitude = Math.abs(turningPoints.get(i) - turningPoints.get(i - 1));
            if (amplitude > threshold) {
                amplitudeSum += amplitude;
                excursions++;
            }
        }

        LOG.debugf("MAGE: %d turning points, %d excursions above %.3f",
                (Object) turningPoints.size(), (Object) excursions, (Object) threshold);

        if (excursions == 0) {
            return OptionalDouble.empty();
        }
        return result(amplitudeSum / excursions);
    }

    /**
     * Moving average over fully covered windows; output length is {@code n - window + 1}.
     */
    static double[] movingAverage(double[] values, int window)
    {
        double[] averaged = new double[values.length - window + 1];
        double windowSum = 0.0;
        for (int i = 0; i < window; i++) {
            windowSum += values[i];
        }
        averaged[0] = windowSum / window;
        for (int i = 1; i < averaged.length; i++) {
            windowSum += values[i + window - 1] - values[i - 1];
            averaged[i] = windowSum / window;
        }
        return averaged;
    }

    static List<Double> turningPoints(double[] curve)
    {
        List<Double> points = new ArrayList<>();
        points.add(curve[0]);

        int direction = 0;
        for (int i = 1; i < curve.length; i++) {
            double delta = curve[i] - curve[i - 1];
            if (delta == 0.0) {
                continue;
            }
            int step = delta > 0 ? 1 : -1;
            if (direction != 0 && step != direction) {
                points.add(curve[i - 1]);
            }
            direction = step;
        }

        if (curve.length > 1) {
            points.add(curve[curve.length - 1]);
        }
        return points;
    }
}
