/* (C)2026 */
package com.ammann.kpi.resource;

import com.ammann.kpi.dto.KpiListResponseDTO;
import com.ammann.kpi.dto.KpiRecordDTO;
import com.ammann.kpi.model.MergedRecord;
import com.ammann.kpi.properties.ApiProperties;
import com.ammann.kpi.service.KpiReportService;
import com.ammann.kpi.service.ReportCacheService;
import jakarta.annotation.security.PermitAll;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.function.Supplier;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for the monthly KPI reports.
 *
 * <p>Every report lists one entry per month of the report window, most recent first,
 * with a count for each of the report's series. Reports are cached for a few hours.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Kpi.BASE)
@Tag(name = "KPI API", description = "Monthly support and knowledge base KPIs")
@Produces(MediaType.APPLICATION_JSON)
@PermitAll
public class KpiResource {

    private static final Logger LOG = Logger.getLogger(KpiResource.class);

    @Inject KpiReportService reportService;

    @Inject ReportCacheService cacheService;

    @GET
    @Path(ApiProperties.Kpi.SOLUTION)
    @Operation(
            summary = "Solved Questions",
            description = "Questions asked and questions with a solution, per month")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Report computed successfully",
                content = @Content(schema = @Schema(implementation = KpiListResponseDTO.class))),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response getSolutions() {
        return report("solution", reportService::solutions);
    }

    @GET
    @Path(ApiProperties.Kpi.VOTE)
    @Operation(
            summary = "Helpful Votes",
            description = "Total and helpful votes on articles and answers, per month")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Report computed successfully",
                content = @Content(schema = @Schema(implementation = KpiListResponseDTO.class))),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response getVotes() {
        return report("vote", reportService::votes);
    }

    @GET
    @Path(ApiProperties.Kpi.FAST_RESPONSE)
    @Operation(
            summary = "Fast Responses",
            description =
                    "Questions asked and questions answered within the fast-response window,"
                            + " per month")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Report computed successfully",
                content = @Content(schema = @Schema(implementation = KpiListResponseDTO.class))),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response getFastResponses() {
        return report("fast-response", reportService::fastResponses);
    }

    @GET
    @Path(ApiProperties.Kpi.ACTIVE_KB_CONTRIBUTORS)
    @Operation(
            summary = "Active Knowledge Base Contributors",
            description =
                    "Distinct revision creators and reviewers per month, en-US and other"
                            + " locales counted separately")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Report computed successfully",
                content = @Content(schema = @Schema(implementation = KpiListResponseDTO.class))),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response getActiveKbContributors() {
        return report("active-kb-contributors", reportService::activeKbContributors);
    }

    @GET
    @Path(ApiProperties.Kpi.ACTIVE_ANSWERERS)
    @Operation(
            summary = "Active Answerers",
            description = "Users who wrote at least the configured number of answers, per month")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Report computed successfully",
                content = @Content(schema = @Schema(implementation = KpiListResponseDTO.class))),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response getActiveAnswerers() {
        return report("active-answerers", reportService::activeAnswerers);
    }

    private Response report(String name, Supplier<List<MergedRecord>> reportSupplier) {
        LOG.debugf("KPI report request: %s", name);

        List<MergedRecord> records =
                cacheService.getCachedList(
                        ReportCacheService.generateCacheKey(name), reportSupplier);

        List<KpiRecordDTO> dtos = records.stream().map(KpiRecordDTO::from).toList();
        return Response.ok(KpiListResponseDTO.of(dtos)).build();
    }
}
