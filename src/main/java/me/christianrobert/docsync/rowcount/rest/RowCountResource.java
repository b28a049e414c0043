package me.christianrobert.docsync.rowcount.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.docsync.core.job.Job;
import me.christianrobert.docsync.core.job.service.JobRegistry;
import me.christianrobert.docsync.core.job.service.JobService;
import me.christianrobert.docsync.database.model.DatabaseEndpoint;
import me.christianrobert.docsync.rowcount.model.RowCountMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST resource for counting corpus table rows on either endpoint.
 */
@ApplicationScoped
@Path("/api/rowcounts")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RowCountResource {

    private static final Logger log = LoggerFactory.getLogger(RowCountResource.class);

    @Inject
    JobService jobService;

    @Inject
    JobRegistry jobRegistry;

    @POST
    @Path("/{endpoint}")
    public Response extractRowCounts(@PathParam("endpoint") String endpointName) {
        DatabaseEndpoint endpoint;
        try {
            endpoint = DatabaseEndpoint.fromName(endpointName);
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("status", "error", "message", e.getMessage()))
                    .build();
        }

        String friendlyName = endpoint + " row count extraction";
        log.info("Starting {} job via REST API", friendlyName);

        try {
            Job<?> job = jobRegistry.createJob(endpoint.name(), "ROW_COUNT")
                    .orElseThrow(() -> new IllegalArgumentException(
                            String.format("No job available for %s ROW_COUNT operation", endpoint)));

            String jobId = jobService.submitJob(job);

            Map<String, Object> result = Map.of(
                    "status", "success",
                    "jobId", jobId,
                    "message", friendlyName + " job started successfully"
            );

            log.info("{} job started with ID: {}", friendlyName, jobId);
            return Response.ok(result).build();

        } catch (Exception e) {
            log.error("Failed to start {} job", friendlyName, e);

            Map<String, Object> errorResult = Map.of(
                    "status", "error",
                    "message", "Failed to start " + friendlyName + ": " + e.getMessage()
            );

            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(errorResult)
                    .build();
        }
    }

    /**
     * Generate summary for row count extraction results.
     */
    public static Map<String, Object> generateRowCountSummary(List<RowCountMetadata> rowCounts) {
        Map<String, Long> tableRowCounts = new LinkedHashMap<>();
        long totalRows = 0;
        int errorTables = 0;

        for (RowCountMetadata rowCount : rowCounts) {
            tableRowCounts.put(rowCount.getTableName(), rowCount.getRowCount());
            if (rowCount.isError()) {
                errorTables++;
            } else {
                totalRows += rowCount.getRowCount();
            }
        }

        return Map.of(
                "totalTables", rowCounts.size(),
                "totalRows", totalRows,
                "errorTables", errorTables,
                "tables", tableRowCounts
        );
    }
}
