/* (C)2026 */
package com.ammann.kpi.resource;

import com.ammann.kpi.dto.ClickthroughRateDTO;
import com.ammann.kpi.dto.ClickthroughRateRequestDTO;
import com.ammann.kpi.dto.KpiListResponseDTO;
import com.ammann.kpi.model.RatioPoint;
import com.ammann.kpi.properties.ApiProperties;
import com.ammann.kpi.service.ClickthroughService;
import com.ammann.kpi.service.MinStartFilter;
import com.ammann.kpi.service.ReportCacheService;
import jakarta.annotation.security.PermitAll;
import jakarta.annotation.security.RolesAllowed;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for weekly search clickthrough rates.
 *
 * <p>Anyone may read the rates. Posting a new week requires {@code ADMIN_ROLE} or
 * {@code METRIC_WRITER_ROLE}.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Clickthrough.BASE)
@Tag(name = "Clickthrough API", description = "Weekly search clickthrough rates per engine")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ClickthroughResource {

    private static final Logger LOG = Logger.getLogger(ClickthroughResource.class);

    @Inject ClickthroughService clickthroughService;

    @Inject ReportCacheService cacheService;

    @GET
    @PermitAll
    @Operation(
            summary = "Get Clickthrough Rates",
            description =
                    "Returns clicks and searches per week, oldest first. Weeks with only one of"
                            + " the two numbers are left out.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Rates retrieved successfully",
                content = @Content(schema = @Schema(implementation = KpiListResponseDTO.class))),
        @APIResponse(responseCode = "404", description = "Unknown search engine"),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response getRates(
            @Parameter(description = "Search engine, e.g. sphinx or elastic")
                    @PathParam(ApiProperties.Clickthrough.ENGINE_PARAM)
                    String engine,
            @Parameter(
                            description =
                                    "Only weeks starting on or after this date (YYYY-MM-DD);"
                                            + " ignored when malformed")
                    @QueryParam(ApiProperties.Clickthrough.MIN_START_PARAM)
                    String minStart) {

        LOG.debugf("Clickthrough request: engine=%s, min_start=%s", engine, minStart);
        requireKnownEngine(engine);

        String cacheKey =
                ReportCacheService.generateCacheKey(
                        "clickthrough",
                        "engine",
                        engine,
                        "minStart",
                        MinStartFilter.parse(minStart).orElse(null));
        List<RatioPoint> points =
                cacheService.getCachedList(
                        cacheKey, () -> clickthroughService.clickthroughRates(engine, minStart));

        List<ClickthroughRateDTO> dtos = points.stream().map(ClickthroughRateDTO::from).toList();

        LOG.infof("Returned %d %s clickthrough weeks", dtos.size(), engine);
        return Response.ok(KpiListResponseDTO.of(dtos)).build();
    }

    @POST
    @RolesAllowed({"ADMIN_ROLE", "METRIC_WRITER_ROLE"})
    @Operation(
            summary = "Record Clickthrough Rate",
            description = "Stores clicks and searches for the week starting at the given date")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Week recorded"),
        @APIResponse(responseCode = "400", description = "Invalid date or counts"),
        @APIResponse(responseCode = "401", description = "Authentication required"),
        @APIResponse(responseCode = "403", description = "Insufficient permissions"),
        @APIResponse(responseCode = "404", description = "Unknown search engine"),
        @APIResponse(responseCode = "500", description = "Metric store error")
    })
    public Response recordRate(
            @Parameter(description = "Search engine, e.g. sphinx or elastic")
                    @PathParam(ApiProperties.Clickthrough.ENGINE_PARAM)
                    String engine,
            ClickthroughRateRequestDTO request) {

        LOG.debugf("Clickthrough write: engine=%s, request=%s", engine, request);
        requireKnownEngine(engine);

        clickthroughService.record(engine, request);
        cacheService.invalidateAll();

        return Response.status(Response.Status.CREATED).build();
    }

    private void requireKnownEngine(String engine) {
        if (!clickthroughService.isKnownEngine(engine)) {
            throw new NotFoundException("Unknown search engine '" + engine + "'");
        }
    }
}
