package me.christianrobert.docsync.sync.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.docsync.core.job.Job;
import me.christianrobert.docsync.core.job.model.sync.CorpusSyncResult;
import me.christianrobert.docsync.core.job.service.JobRegistry;
import me.christianrobert.docsync.core.job.service.JobService;
import me.christianrobert.docsync.database.model.DatabaseEndpoint;
import me.christianrobert.docsync.sync.job.CorpusSyncJob;
import me.christianrobert.docsync.sync.job.CorpusSyncPreflightJob;
import me.christianrobert.docsync.sync.model.SyncFailure;
import me.christianrobert.docsync.sync.model.SyncPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * REST resource for starting corpus sync and preflight jobs.
 * Only one sync or preflight may run at a time.
 */
@ApplicationScoped
@Path("/api/sync")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class CorpusSyncResource {

    private static final Logger log = LoggerFactory.getLogger(CorpusSyncResource.class);

    private static final String SYNC_JOB_TYPE = DatabaseEndpoint.PRODUCTION.name() + "_" + CorpusSyncJob.OPERATION_TYPE;
    private static final String PREFLIGHT_JOB_TYPE = DatabaseEndpoint.PRODUCTION.name() + "_" + CorpusSyncPreflightJob.OPERATION_TYPE;

    @Inject
    JobService jobService;

    @Inject
    JobRegistry jobRegistry;

    @POST
    @Path("/execute")
    public Response executeSync() {
        return startJob(CorpusSyncJob.OPERATION_TYPE, "Corpus sync from LOCAL to PRODUCTION");
    }

    @POST
    @Path("/preflight")
    public Response preflight() {
        return startJob(CorpusSyncPreflightJob.OPERATION_TYPE, "Corpus sync preflight");
    }

    private Response startJob(String operationType, String friendlyName) {
        log.info("Starting {} job via REST API", friendlyName);

        try {
            Job<?> job = jobRegistry.createJob(DatabaseEndpoint.PRODUCTION.name(), operationType)
                    .orElseThrow(() -> new IllegalArgumentException(
                            String.format("No job available for PRODUCTION %s operation", operationType)));

            Optional<String> submitted = jobService.submitJobIfNoneActive(job, SYNC_JOB_TYPE, PREFLIGHT_JOB_TYPE);
            if (submitted.isEmpty()) {
                log.warn("Refusing to start {}: a sync or preflight job is already running", friendlyName);
                return Response.status(Response.Status.CONFLICT)
                        .entity(Map.of(
                                "status", "error",
                                "message", "A corpus sync or preflight job is already running"))
                        .build();
            }
            String jobId = submitted.get();

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
     * Generate summary for a sync or preflight result.
     */
    public static Map<String, Object> generateCorpusSyncSummary(CorpusSyncResult result) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("mode", result.getMode().name());
        summary.put("dryRun", result.isDryRun());
        summary.put("executionDateTime", result.getExecutionDateTime().toString());
        summary.put("durationMillis", result.getDurationMillis());
        summary.put("successful", result.isSuccessful());
        summary.put("committed", result.isCommitted());
        summary.put("sourceRowCounts", result.getSourceRowCounts());
        summary.put("destinationRowCounts", result.getDestinationRowCounts());
        summary.put("rowsWritten", result.getRowsWritten());
        summary.put("sequenceValues", result.getSequenceValues());
        summary.put("completedPhases", result.getCompletedPhases().stream()
                .map(SyncPhase::name)
                .collect(Collectors.toList()));

        SyncFailure failure = result.getFailure();
        if (failure != null) {
            Map<String, Object> failureInfo = new LinkedHashMap<>();
            failureInfo.put("type", failure.getType().name());
            failureInfo.put("phase", failure.getPhase().name());
            failureInfo.put("tables", failure.getTables());
            failureInfo.put("message", failure.describe());
            failureInfo.put("sampleIds", failure.getSampleIds());
            summary.put("failure", failureInfo);
        }
        return summary;
    }
}
