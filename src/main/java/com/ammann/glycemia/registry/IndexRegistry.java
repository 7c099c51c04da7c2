/* (C)2026 */
package com.ammann.glycemia.registry;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.event.Excursion;
import com.ammann.glycemia.exception.IndexNotFoundException;
import com.ammann.glycemia.exception.ValidationException;
import com.ammann.glycemia.index.AreaUnderCurveIndex;
import com.ammann.glycemia.index.BloodGlucoseRiskIndex;
import com.ammann.glycemia.index.CoefficientOfVariationIndex;
import com.ammann.glycemia.index.CongaIndex;
import com.ammann.glycemia.index.EstimatedA1cIndex;
import com.ammann.glycemia.index.EventCountIndex;
import com.ammann.glycemia.index.GlycemicIndex;
import com.ammann.glycemia.index.GradeIndex;
import com.ammann.glycemia.index.GradeShareIndex;
import com.ammann.glycemia.index.IndexFactory;
import com.ammann.glycemia.index.JIndex;
import com.ammann.glycemia.index.M100Index;
import com.ammann.glycemia.index.MageIndex;
import com.ammann.glycemia.index.MeanEventDurationIndex;
import com.ammann.glycemia.index.MeanIndex;
import com.ammann.glycemia.index.MedianIndex;
import com.ammann.glycemia.index.MissingFractionIndex;
import com.ammann.glycemia.index.ModdIndex;
import com.ammann.glycemia.index.RecordCountIndex;
import com.ammann.glycemia.index.StandardDeviationIndex;
import com.ammann.glycemia.index.ThresholdCountIndex;
import com.ammann.glycemia.index.TimeBeyondThresholdIndex;
import com.ammann.glycemia.index.TimeInRangeIndex;
import com.ammann.glycemia.index.VarianceIndex;
import com.ammann.glycemia.model.GlucoseSeries;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Static mapping from display name to index implementation.
 *
 * <p>Names are matched exactly; there is no fuzzy or case-insensitive lookup. Iteration
 * follows registration order, which is also the order of batch results.
 */
public final class IndexRegistry
{
    public static final String MEAN = "Mean";
    public static final String MEDIAN = "Median";
    public static final String VARIANCE = "Variance";
    public static final String CV = "CV";
    public static final String MISSING_VALUES = "Missing values";
    public static final String RECORD_COUNT = "Total time points No";
    public static final String SD = "SD";
    public static final String M100 = "M100";
    public static final String J_INDEX = "J-index";
    public static final String MAGE = "MAGE";
    public static final String MODD = "MODD";
    public static final String CONGA = "CONGA";
    public static final String HYPOGLYCEMIA = "Hypoglycemia";
    public static final String HYPERGLYCEMIA = "Hyperglycemia";
    public static final String GRADE = "GRADE";
    public static final String GRADE_HYPO = "GRADE hypo";
    public static final String GRADE_HYPER = "GRADE hyper";
    public static final String LBGI = "LBGI";
    public static final String HBGI = "HBGI";
    public static final String EA1C = "eA1c";
    public static final String AUC = "AUC";
    public static final String HYPO_EVENTS_COUNT = "Hypo events count";
    public static final String TIME_IN_HYPO = "Time in hypo";
    public static final String MEAN_HYPO_EVENT_DURATION = "Mean hypo event duration";
    public static final String HYPER_EVENTS_COUNT = "Hyper events count";
    public static final String TIME_IN_HYPER = "Time in hyper";
    public static final String MEAN_HYPER_EVENT_DURATION = "Mean hyper event duration";
    public static final String TIME_IN_RANGE = "Time in range";

    private static final Map<String, IndexFactory> INDICES = createIndices();

    private IndexRegistry() {}

    private static Map<String, IndexFactory> createIndices()
    {
        Map<String, IndexFactory> indices = new LinkedHashMap<>();
        indices.put(MEAN, MeanIndex::new);
        indices.put(MEDIAN, MedianIndex::new);
        indices.put(VARIANCE, VarianceIndex::new);
        indices.put(CV, CoefficientOfVariationIndex::new);
        indices.put(MISSING_VALUES, MissingFractionIndex::new);
        indices.put(RECORD_COUNT, RecordCountIndex::new);
        indices.put(SD, StandardDeviationIndex::new);
        indices.put(M100, M100Index::new);
        indices.put(J_INDEX, JIndex::new);
        indices.put(MAGE, MageIndex::new);
        indices.put(MODD, ModdIndex::new);
        indices.put(CONGA, CongaIndex::new);
        indices.put(HYPOGLYCEMIA, (series, config) -> new ThresholdCountIndex(series, config, Excursion.BELOW));
        indices.put(HYPERGLYCEMIA, (series, config) -> new ThresholdCountIndex(series, config, Excursion.ABOVE));
        indices.put(GRADE, GradeIndex::new);
        indices.put(GRADE_HYPO, GradeShareIndex::hypo);
        indices.put(GRADE_HYPER, GradeShareIndex::hyper);
        indices.put(LBGI, BloodGlucoseRiskIndex::low);
        indices.put(HBGI, BloodGlucoseRiskIndex::high);
        indices.put(EA1C, EstimatedA1cIndex::new);
        indices.put(AUC, AreaUnderCurveIndex::new);
        indices.put(HYPO_EVENTS_COUNT, (series, config) -> new EventCountIndex(series, config, Excursion.BELOW));
        indices.put(TIME_IN_HYPO, (series, config) -> new TimeBeyondThresholdIndex(series, config, Excursion.BELOW));
        indices.put(MEAN_HYPO_EVENT_DURATION,
                (series, config) -> new MeanEventDurationIndex(series, config, Excursion.BELOW));
        indices.put(HYPER_EVENTS_COUNT, (series, config) -> new EventCountIndex(series, config, Excursion.ABOVE));
        indices.put(TIME_IN_HYPER, (series, config) -> new TimeBeyondThresholdIndex(series, config, Excursion.ABOVE));
        indices.put(MEAN_HYPER_EVENT_DURATION,
                (series, config) -> new MeanEventDurationIndex(series, config, Excursion.ABOVE));
        indices.put(TIME_IN_RANGE, TimeInRangeIndex::new);
        return Collections.unmodifiableMap(indices);
    }

    /** All registered names, in registration order. */
    public static List<String> names()
    {
        return List.copyOf(INDICES.keySet());
    }

    public static boolean contains(String name)
    {
        return name != null && INDICES.containsKey(name);
    }

    /**
     * Returns the factory registered under {@code name}.
     *
     * @throws IndexNotFoundException if no index has exactly this name
     */
    public static IndexFactory lookup(String name)
    {
        IndexFactory factory = name == null ? null : INDICES.get(name);
        if (factory == null) {
            throw new IndexNotFoundException(name);
        }
        return factory;
    }

    /** Looks up {@code name} and binds it to the series and configuration. */
    public static GlycemicIndex create(String name, GlucoseSeries series, CalculationConfig config)
    {
        return lookup(name).create(series, config);
    }

    /**
     * Evaluates the named indices with their default arguments.
     *
     * <p>All names are resolved before anything is computed, so an unknown name fails the
     * whole batch. Results are keyed by name in registration order, whatever the order of
     * {@code names}; a repeated name is evaluated once.
     *
     * @param names  index names to evaluate
     * @param series readings to evaluate
     * @param config calculation parameters
     * @return name to result, empty results marking undefined statistics
     */
    public static Map<String, OptionalDouble> calculate(Collection<String> names, GlucoseSeries series,
                                                        CalculationConfig config)
    {
        if (names == null) {
            throw ValidationException.invalidParameter("names", null, "collection of index names");
        }
        for (String name : names) {
            lookup(name);
        }

        Set<String> requested = Set.copyOf(names);
        Map<String, OptionalDouble> results = new LinkedHashMap<>();
        for (Map.Entry<String, IndexFactory> entry : INDICES.entrySet()) {
            if (requested.contains(entry.getKey())) {
                results.put(entry.getKey(), entry.getValue().create(series, config).calculate());
            }
        }
        return results;
    }
}
