/* (C)2026 */
package com.ammann.glycemia.dto;

import static com.ammann.glycemia.support.TestDataFactory.mgConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.enumeration.GlucoseUnit;
import com.ammann.glycemia.exception.ValidationException;
import com.ammann.glycemia.model.GlucoseSeries;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class IndexCalculationRequestDTOTest {

    private static IndexCalculationRequestDTO withOverrides(String unit, Double interval, Number window,
                                                            Number duration, Number hypo, Number hyper,
                                                            Number conga) {
        return new IndexCalculationRequestDTO(List.of(100.0), unit, interval, window, duration, hypo, hyper,
                conga, null);
    }

    @Test
    void nullReadingsBecomeMissing() {
        var request = new IndexCalculationRequestDTO(Arrays.asList(100.0, null, 120.0),
                null, null, null, null, null, null, null, null);

        GlucoseSeries series = request.toSeries();

        assertThat(series.size()).isEqualTo(3);
        assertThat(series.isMissing(1)).isTrue();
        assertThat(series.missingCount()).isEqualTo(1);
    }

    @Test
    void missingReadingListIsRejected() {
        var request = new IndexCalculationRequestDTO(null, null, null, null, null, null, null, null, null);

        assertThatThrownBy(request::toSeries).isInstanceOf(ValidationException.class);
    }

    @Test
    void noOverridesKeepsDefaults() {
        CalculationConfig config = withOverrides(null, null, null, null, null, null, null).toConfig(mgConfig());

        assertThat(config).isEqualTo(mgConfig());
    }

    @Test
    void overridesReplaceDefaults() {
        CalculationConfig config = withOverrides("mg", 15.0, 3, 30, 60, 200, 2).toConfig(mgConfig());

        assertThat(config).isEqualTo(new CalculationConfig(GlucoseUnit.MG, 15.0, 3, 30.0, 60, 200, 2));
    }

    @Test
    void unitChangeSwitchesDefaultThresholds() {
        CalculationConfig config = withOverrides("mmol", null, null, null, null, null, null).toConfig(mgConfig());

        assertThat(config.unit()).isEqualTo(GlucoseUnit.MMOL);
        assertThat(config.hypoThreshold()).isEqualTo(4);
        assertThat(config.hyperThreshold()).isEqualTo(10);
    }

    @Test
    void explicitThresholdWinsOverUnitDefault() {
        CalculationConfig config = withOverrides("mmol", null, null, null, 3, null, null).toConfig(mgConfig());

        assertThat(config.hypoThreshold()).isEqualTo(3);
        assertThat(config.hyperThreshold()).isEqualTo(10);
    }

    @Test
    void fractionalDurationIsAccepted() {
        CalculationConfig config = withOverrides(null, null, null, 12.5, null, null, null).toConfig(mgConfig());

        assertThat(config.eventDurationThresholdMinutes()).isEqualTo(12.5);
    }

    @Test
    void fractionalIntegerParametersAreRejected() {
        assertThatThrownBy(() -> withOverrides(null, null, null, null, 55.5, null, null).toConfig(mgConfig()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("hypoThreshold");
        assertThatThrownBy(() -> withOverrides(null, null, 2.5, null, null, null, null).toConfig(mgConfig()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("smoothingWindowSize");
        assertThatThrownBy(() -> withOverrides(null, null, null, null, null, null, 0.5).toConfig(mgConfig()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("congaHours");
    }

    @Test
    void invalidValuesAreRejectedByConfig() {
        assertThatThrownBy(() -> withOverrides("mg/dl", null, null, null, null, null, null).toConfig(mgConfig()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> withOverrides("MMOL", null, null, null, null, null, null).toConfig(mgConfig()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("unit");
        assertThatThrownBy(() -> withOverrides(null, 0.0, null, null, null, null, null).toConfig(mgConfig()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("intervalMinutes");
        assertThatThrownBy(() -> withOverrides(null, null, null, -1, null, null, null).toConfig(mgConfig()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("eventDurationThresholdMinutes");
    }
}
