/* (C)2026 */
package com.ammann.glycemia.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.glycemia.dto.GlycemicIndexReportDTO;
import com.ammann.glycemia.dto.IndexCalculationRequestDTO;
import com.ammann.glycemia.dto.IndexCatalogDTO;
import com.ammann.glycemia.exception.IndexNotFoundException;
import com.ammann.glycemia.exception.SomeThingWentWrongException;
import com.ammann.glycemia.exception.ValidationException;
import com.ammann.glycemia.model.GlucoseSeries;
import com.ammann.glycemia.registry.IndexRegistry;
import com.ammann.glycemia.service.GlycemicVariabilityService;
import com.ammann.glycemia.service.ServiceFixtures;
import com.ammann.glycemia.support.TestDataFactory;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class GlycemicIndexResourceTest {

    private static final List<String> DEFAULT_BATCH =
            List.of("Mean", "Median", "Variance", "CV", "Missing values", "Total time points No");

    @Test
    void listIndicesReturnsCatalog() {
        GlycemicIndexResource resource = buildResource();

        var response = resource.listIndices();
        IndexCatalogDTO dto = (IndexCatalogDTO) response.getEntity();

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(dto.indices()).containsExactlyElementsOf(IndexRegistry.names());
        assertThat(dto.defaultIndices()).containsExactlyElementsOf(DEFAULT_BATCH);
    }

    @Test
    void calculateReturnsRequestedIndicesWithNullForUndefined() {
        GlycemicIndexResource resource = buildResource();
        var request = request(Arrays.asList(100.0, null, 140.0), null, List.of("SD", "Mean", "MODD"));

        var response = resource.calculateIndices(request);
        GlycemicIndexReportDTO dto = (GlycemicIndexReportDTO) response.getEntity();

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(dto.indices().keySet()).containsExactly("Mean", "SD", "MODD");
        assertThat(dto.indices().get("Mean")).isEqualTo(120.0);
        assertThat(dto.indices().get("SD")).isEqualTo(20.0);
        assertThat(dto.indices()).containsEntry("MODD", null);
        assertThat(dto.sampleCount()).isEqualTo(3L);
        assertThat(dto.missingCount()).isEqualTo(1L);
        assertThat(dto.unit()).isEqualTo("mg");
        assertThat(dto.intervalMinutes()).isEqualTo(5.0);
    }

    @Test
    void calculateWithoutNamesUsesDefaultBatch() {
        GlycemicIndexResource resource = buildResource();

        var response = resource.calculateIndices(request(List.of(5.0, 6.0, 7.0), "mmol", null));
        GlycemicIndexReportDTO dto = (GlycemicIndexReportDTO) response.getEntity();

        assertThat(dto.indices().keySet()).containsExactlyElementsOf(DEFAULT_BATCH);
        assertThat(dto.unit()).isEqualTo("mmol");
    }

    @Test
    void calculateRejectsMissingBody() {
        GlycemicIndexResource resource = buildResource();

        assertThatThrownBy(() -> resource.calculateIndices(null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("body");
    }

    @Test
    void calculateRejectsEmptyReadings() {
        GlycemicIndexResource resource = buildResource();

        assertThatThrownBy(() -> resource.calculateIndices(request(List.of(), null, null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void calculateRejectsUnknownIndex() {
        GlycemicIndexResource resource = buildResource();

        assertThatThrownBy(() -> resource.calculateIndices(request(List.of(100.0), null, List.of("TIR"))))
                .isInstanceOf(IndexNotFoundException.class);
    }

    @Test
    void calculatePropagatesServiceFailure() {
        GlycemicIndexResource resource = new GlycemicIndexResource();
        GlycemicVariabilityService service = mock(GlycemicVariabilityService.class);
        when(service.getDefaultConfig()).thenReturn(TestDataFactory.mgConfig());
        when(service.analyze(any(GlucoseSeries.class), any(), anyList()))
                .thenThrow(new SomeThingWentWrongException(new IllegalStateException("boom")));
        resource.glycemicVariabilityService = service;

        assertThatThrownBy(() -> resource.calculateIndices(request(List.of(100.0), null, List.of("Mean"))))
                .isInstanceOf(SomeThingWentWrongException.class);
    }

    private static IndexCalculationRequestDTO request(List<Double> glucose, String unit, List<String> indices) {
        return new IndexCalculationRequestDTO(glucose, unit, null, null, null, null, null, null, indices);
    }

    private GlycemicIndexResource buildResource() {
        GlycemicIndexResource resource = new GlycemicIndexResource();
        resource.glycemicVariabilityService =
                ServiceFixtures.glycemicVariabilityService(TestDataFactory.mgConfig(), DEFAULT_BATCH);
        return resource;
    }
}
