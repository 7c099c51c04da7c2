/* (C)2026 */
package com.ammann.glycemia.service;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.exception.ApiException;
import com.ammann.glycemia.exception.SomeThingWentWrongException;
import com.ammann.glycemia.exception.ValidationException;
import com.ammann.glycemia.model.GlucoseSeries;
import com.ammann.glycemia.registry.IndexRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Service for evaluating batches of glycemic variability indices over one glucose series.
 *
 * <p>Indices are resolved by name through {@link IndexRegistry} and evaluated with their
 * default arguments from the supplied {@link CalculationConfig}. When no names are given,
 * the batch configured under {@code glycemia.batch.default-indices} is used.
 *
 * <p>The service keeps no per-request state; concurrent calls share only the read-only
 * series and configuration they are given.
 */
@ApplicationScoped
public class GlycemicVariabilityService
{
    private static final Logger LOG = Logger.getLogger(GlycemicVariabilityService.class);

    @Inject
    CalculationConfig defaultConfig;

    @ConfigProperty(name = "glycemia.batch.default-indices",
            defaultValue = "Mean,Median,Variance,CV,Missing values,Total time points No")
    List<String> defaultIndices;

    @Inject
    MeterRegistry meterRegistry;

    private Counter calculationsCounter;
    private Counter undefinedResultsCounter;

    @PostConstruct
    void init()
    {
        initMetrics();
    }

    /**
     * Evaluates the default batch with the default configuration.
     */
    public AnalysisResult analyze(GlucoseSeries series)
    {
        return analyze(series, defaultConfig, defaultIndices);
    }

    /**
     * Evaluates the named indices over {@code series}.
     *
     * @param series readings to analyze
     * @param config calculation parameters for this run
     * @param names  index names; {@code null} or empty selects the default batch
     * @return results keyed by name in registration order
     * @throws ValidationException if series or config is missing
     * @throws com.ammann.glycemia.exception.IndexNotFoundException if a name is not registered
     */
    public AnalysisResult analyze(GlucoseSeries series, CalculationConfig config, List<String> names)
    {
        if (series == null) {
            throw ValidationException.invalidParameter("series", null, "a GlucoseSeries");
        }
        if (config == null) {
            throw ValidationException.invalidParameter("config", null, "a CalculationConfig");
        }
        List<String> selected = (names == null || names.isEmpty()) ? defaultIndices : names;

        long startTime = System.nanoTime();
        Map<String, OptionalDouble> results;
        try {
            results = IndexRegistry.calculate(selected, series, config);
        } catch (ApiException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Index calculation failed for %s", series);
            throw new SomeThingWentWrongException(e);
        }
        long processingTimeNanos = System.nanoTime() - startTime;

        long undefined = results.values().stream().filter(OptionalDouble::isEmpty).count();
        incrementCounter(calculationsCounter, results.size());
        incrementCounter(undefinedResultsCounter, undefined);

        if (series.isAllMissing()) {
            LOG.warnf("Analyzed series of %d rows with no valid readings", series.size());
        }
        LOG.infof("Calculated %d indices (%d undefined) over %d readings in %.2fms",
                results.size(), undefined, series.size(), processingTimeNanos / 1_000_000.0);

        return new AnalysisResult(
                series.size(),
                series.missingCount(),
                config,
                results,
                processingTimeNanos
        );
    }

    public CalculationConfig getDefaultConfig()
    {
        return defaultConfig;
    }

    public List<String> getDefaultIndices()
    {
        return List.copyOf(defaultIndices);
    }

    private void initMetrics()
    {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - metrics disabled");
            return;
        }

        calculationsCounter =
                Counter.builder("glycemia_index_calculations_total")
                        .description("Total glycemic indices calculated")
                        .register(meterRegistry);

        undefinedResultsCounter =
                Counter.builder("glycemia_undefined_results_total")
                        .description("Total glycemic indices that were undefined for their input")
                        .register(meterRegistry);
    }

    private void incrementCounter(Counter counter, long amount)
    {
        if (counter != null) {
            counter.increment(amount);
        }
    }

    /**
     * Result of one batch evaluation.
     *
     * @param sampleCount         number of rows in the series
     * @param missingCount        number of missing readings
     * @param config              configuration the indices were evaluated with
     * @param indices             index name to result; empty marks an undefined statistic
     * @param processingTimeNanos wall-clock time of the evaluation
     */
    public record AnalysisResult(
            int sampleCount,
            int missingCount,
            CalculationConfig config,
            Map<String, OptionalDouble> indices,
            long processingTimeNanos
    )
    {
    }
}
