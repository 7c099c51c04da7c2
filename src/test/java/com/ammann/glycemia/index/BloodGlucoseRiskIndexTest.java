/* (C)2026 */
package com.ammann.glycemia.index;

import org.junit.jupiter.api.Test;

import static com.ammann.glycemia.support.TestDataFactory.NA;
import static com.ammann.glycemia.support.TestDataFactory.mgConfig;
import static com.ammann.glycemia.support.TestDataFactory.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BloodGlucoseRiskIndexTest {

    @Test
    void riskFunctionMatchesReferenceValues() {
        assertThat(BloodGlucoseRiskIndex.riskFunction(100)).isCloseTo(-4.920991499707003, within(1e-9));
        assertThat(BloodGlucoseRiskIndex.riskFunction(400)).isCloseTo(-3.8649913691874795, within(1e-9));
    }

    @Test
    void lowIndexAveragesRiskOfNegativeRiskFunction() {
        var lbgi = BloodGlucoseRiskIndex.low(series(100, 50), mgConfig()).calculate();

        assertThat(lbgi.getAsDouble()).isCloseTo(269.01949206250356, within(1e-6));
    }

    @Test
    void highIndexZeroesContributionsBelowSymmetryPoint() {
        var hbgi = BloodGlucoseRiskIndex.high(series(100, 50, 400), mgConfig()).calculate();

        assertThat(hbgi).hasValue(0.0);
    }

    @Test
    void nonPositiveAndMissingReadingsAreMaskedNotPropagated() {
        var withInvalid = BloodGlucoseRiskIndex.low(series(100, 0, -20, NA, 0.5), mgConfig()).calculate();
        var clean = BloodGlucoseRiskIndex.low(series(100), mgConfig()).calculate();

        assertThat(withInvalid.getAsDouble()).isCloseTo(clean.getAsDouble(), within(1e-12));
        assertThat(BloodGlucoseRiskIndex.low(series(0, -1), mgConfig()).calculate()).isEmpty();
        assertThat(BloodGlucoseRiskIndex.high(series(NA), mgConfig()).calculate()).isEmpty();
    }

    @Test
    void exposesSide() {
        assertThat(BloodGlucoseRiskIndex.low(series(100), mgConfig()).getSide())
                .isEqualTo(BloodGlucoseRiskIndex.Side.LOW);
        assertThat(BloodGlucoseRiskIndex.high(series(100), mgConfig()).getSide())
                .isEqualTo(BloodGlucoseRiskIndex.Side.HIGH);
    }
}
