package com.ammann.glycemia.resource;

import com.ammann.glycemia.config.CalculationConfig;
import com.ammann.glycemia.dto.GlycemicIndexReportDTO;
import com.ammann.glycemia.dto.IndexCalculationRequestDTO;
import com.ammann.glycemia.dto.IndexCatalogDTO;
import com.ammann.glycemia.exception.ValidationException;
import com.ammann.glycemia.model.GlucoseSeries;
import com.ammann.glycemia.properties.ApiProperties;
import com.ammann.glycemia.registry.IndexRegistry;
import com.ammann.glycemia.service.GlycemicVariabilityService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for glycemic variability indices over a glucose series supplied in the
 * request body.
 *
 * <p>Nothing is persisted; each request carries its own readings and optional
 * configuration overrides.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Glycemic Index API", description = "Glycemic variability indices for CGM series")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class GlycemicIndexResource {

    private static final Logger LOG = Logger.getLogger(GlycemicIndexResource.class);

    @Inject
    GlycemicVariabilityService glycemicVariabilityService;

    @GET
    @Path(ApiProperties.Indices.BASE)
    @Operation(
            summary = "List Glycemic Indices",
            description = "Lists every registered index name in registration order and the default batch"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Index catalog",
                    content = @Content(schema = @Schema(implementation = IndexCatalogDTO.class)))
    })
    public Response listIndices() {
        var catalog = new IndexCatalogDTO(
                IndexRegistry.names(),
                glycemicVariabilityService.getDefaultIndices()
        );
        return Response.ok(catalog).build();
    }

    @POST
    @Path(ApiProperties.Indices.CALCULATE)
    @Operation(
            summary = "Calculate Glycemic Indices",
            description = "Calculates the requested glycemic variability indices; undefined results are returned as null"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Indices calculated successfully",
                    content = @Content(schema = @Schema(implementation = GlycemicIndexReportDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid readings or parameters"),
            @APIResponse(responseCode = "404", description = "Unknown index name"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response calculateIndices(IndexCalculationRequestDTO request) {
        if (request == null) {
            throw ValidationException.invalidParameter("body", null, "glucose readings");
        }

        GlucoseSeries series = request.toSeries();
        CalculationConfig config = request.toConfig(glycemicVariabilityService.getDefaultConfig());

        LOG.debugf("Index calculation request: %d readings, unit=%s, interval=%.1f min, indices=%s",
                series.size(), config.unit().getLabel(), config.intervalMinutes(), request.indices());

        var result = glycemicVariabilityService.analyze(series, config, request.indices());
        return Response.ok(GlycemicIndexReportDTO.from(result)).build();
    }
}
