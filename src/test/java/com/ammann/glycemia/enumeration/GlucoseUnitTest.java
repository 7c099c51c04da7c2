package com.ammann.glycemia.enumeration;

import com.ammann.glycemia.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GlucoseUnitTest
{

    @ParameterizedTest
    @CsvSource({
            "mg,MG",
            "mmol,MMOL"
    })
    void resolvesLabels(String label, GlucoseUnit expected)
    {
        assertThat(GlucoseUnit.fromLabel(label)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"mg/dl", "mmol/l", "g", "MG", "Mmol", "mg ", " mmol"})
    void rejectsUnknownLabels(String label)
    {
        assertThatThrownBy(() -> GlucoseUnit.fromLabel(label))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("unit");
    }

    @Test
    void convertsBetweenUnitsWithFactorEighteen()
    {
        assertThat(GlucoseUnit.MMOL.toMgPerDl(5.0)).isEqualTo(90.0);
        assertThat(GlucoseUnit.MG.toMmolPerL(90.0)).isCloseTo(5.0, within(1e-12));
        assertThat(GlucoseUnit.MG.toMgPerDl(90.0)).isEqualTo(90.0);
        assertThat(GlucoseUnit.MMOL.toMmolPerL(5.0)).isEqualTo(5.0);
        assertThat(GlucoseUnit.MG.toMgPerDl(Double.NaN)).isNaN();
    }
}
