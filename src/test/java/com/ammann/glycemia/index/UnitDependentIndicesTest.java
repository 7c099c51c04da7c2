/* (C)2026 */
package com.ammann.glycemia.index;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.model.GlucoseSeries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.function.BiFunction;
import java.util.stream.Stream;

import static com.ammann.glycemia.support.TestDataFactory.NA;
import static com.ammann.glycemia.support.TestDataFactory.mgConfig;
import static com.ammann.glycemia.support.TestDataFactory.mmolConfig;
import static com.ammann.glycemia.support.TestDataFactory.series;
import static com.ammann.glycemia.support.TestDataFactory.toMmol;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * GRADE family, eA1c, M100 and J-index.
 */
class UnitDependentIndicesTest {

    private static final double[] MG_READINGS = {90, 126, 180, 72, NA, 250, 54};

    @ParameterizedTest(name = "{0}")
    @MethodSource("unitDependentIndices")
    void sameResultForSameValuesInEitherUnit(String name,
                                             BiFunction<GlucoseSeries, CalculationConfig, GlycemicIndex> factory) {
        double mg = factory.apply(series(MG_READINGS), mgConfig()).calculate().getAsDouble();
        double mmol = factory.apply(toMmol(MG_READINGS), mmolConfig()).calculate().getAsDouble();

        assertThat(mmol).isCloseTo(mg, within(1e-9));
    }

    static Stream<Arguments> unitDependentIndices() {
        return Stream.of(
                Arguments.of("GRADE", (BiFunction<GlucoseSeries, CalculationConfig, GlycemicIndex>) GradeIndex::new),
                Arguments.of("GRADE hypo", (BiFunction<GlucoseSeries, CalculationConfig, GlycemicIndex>) GradeShareIndex::hypo),
                Arguments.of("GRADE hyper", (BiFunction<GlucoseSeries, CalculationConfig, GlycemicIndex>) GradeShareIndex::hyper),
                Arguments.of("eA1c", (BiFunction<GlucoseSeries, CalculationConfig, GlycemicIndex>) EstimatedA1cIndex::new),
                Arguments.of("M100", (BiFunction<GlucoseSeries, CalculationConfig, GlycemicIndex>) M100Index::new),
                Arguments.of("J-index", (BiFunction<GlucoseSeries, CalculationConfig, GlycemicIndex>) JIndex::new),
                Arguments.of("LBGI", (BiFunction<GlucoseSeries, CalculationConfig, GlycemicIndex>) BloodGlucoseRiskIndex::low)
        );
    }

    @Test
    void gradeAveragesPerSampleScores() {
        GlucoseSeries series = series(5, 7, 10, 4);

        assertThat(new GradeIndex(series, mmolConfig()).calculate().getAsDouble())
                .isCloseTo(2.384799550370589, within(1e-9));
    }

    @Test
    void gradeMasksReadingsOutsideItsDomain() {
        double scoreOfTen = GradeIndex.score(10.0);

        assertThat(new GradeIndex(series(0.5, 0, 10), mmolConfig()).calculate().getAsDouble())
                .isCloseTo(scoreOfTen, within(1e-12));
        assertThat(new GradeIndex(series(0, -3), mmolConfig()).calculate()).isEmpty();
    }

    @Test
    void gradeSharesSplitTotalScore() {
        GlucoseSeries series = series(4.0, 10.0);

        double hypo = GradeShareIndex.hypo(series, mmolConfig()).calculate().getAsDouble();
        double hyper = GradeShareIndex.hyper(series, mmolConfig()).calculate().getAsDouble();

        assertThat(hypo).isCloseTo(0.77021499528604, within(1e-9));
        assertThat(hypo + hyper).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void gradeShareIsZeroWhenNoReadingIsBeyondCutoff() {
        GlucoseSeries series = series(100, 110, 120);

        assertThat(GradeShareIndex.hypo(series, mgConfig()).calculate()).hasValue(0.0);
        assertThat(GradeShareIndex.hyper(series, mgConfig()).calculate()).hasValue(0.0);
    }

    @Test
    void gradeShareIsUndefinedWithoutScores() {
        GlucoseSeries series = series(NA, NA);

        assertThat(GradeShareIndex.hypo(series, mgConfig()).calculate()).isEmpty();
        assertThat(GradeShareIndex.hyper(series, mgConfig()).calculate()).isEmpty();
    }

    @Test
    void estimatedA1cUsesMeanInMmol() {
        assertThat(new EstimatedA1cIndex(series(5, 7, 10, 4), mmolConfig()).calculate().getAsDouble())
                .isCloseTo(5.698041692987998, within(1e-9));
        assertThat(new EstimatedA1cIndex(series(NA), mmolConfig()).calculate()).isEmpty();
    }

    @Test
    void m100IsZeroAtReferenceAndMasksZeroReadings() {
        assertThat(new M100Index(series(100, 1000), mgConfig()).calculate().getAsDouble())
                .isCloseTo(500.0, within(1e-9));
        assertThat(new M100Index(series(100, 0), mgConfig()).calculate().getAsDouble())
                .isCloseTo(0.0, within(1e-9));
        assertThat(new M100Index(series(0, -1), mgConfig()).calculate()).isEmpty();
    }

    @Test
    void jIndexConvertsMmolToMg() {
        assertThat(new JIndex(series(100, 100), mgConfig()).calculate().getAsDouble())
                .isCloseTo(10.0, within(1e-9));
        assertThat(new JIndex(series(5, 5), mmolConfig()).calculate().getAsDouble())
                .isCloseTo(8.1, within(1e-9));
    }
}
