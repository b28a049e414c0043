package me.christianrobert.docsync.core.job.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.docsync.core.job.model.JobProgress;
import me.christianrobert.docsync.core.job.model.JobStatus;
import me.christianrobert.docsync.core.job.model.sync.CorpusSyncResult;
import me.christianrobert.docsync.core.job.service.JobRegistry;
import me.christianrobert.docsync.core.job.service.JobService;
import me.christianrobert.docsync.rowcount.model.RowCountMetadata;
import me.christianrobert.docsync.rowcount.rest.RowCountResource;
import me.christianrobert.docsync.sync.rest.CorpusSyncResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Generic REST resource for job status and result retrieval.
 * Endpoints that start jobs live in their domain resources.
 */
@ApplicationScoped
@Path("/api/jobs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class JobResource {

    private static final Logger log = LoggerFactory.getLogger(JobResource.class);

    @Inject
    JobService jobService;

    @Inject
    JobRegistry jobRegistry;

    @GET
    public Response listJobs() {
        List<Map<String, Object>> jobs = new ArrayList<>();
        jobService.getAllJobExecutions().entrySet().stream()
                .sorted(Comparator.comparing(entry -> entry.getValue().getStartTime(),
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .forEach(entry -> {
                    Map<String, Object> info = new HashMap<>();
                    info.put("jobId", entry.getKey());
                    info.put("jobType", entry.getValue().getJob().getJobType());
                    info.put("status", entry.getValue().getStatus().name());
                    if (entry.getValue().getStartTime() != null) {
                        info.put("startTime", entry.getValue().getStartTime().toString());
                    }
                    jobs.add(info);
                });

        return Response.ok(Map.of(
                "jobs", jobs,
                "availableJobTypes", jobRegistry.getAvailableJobTypes()
        )).build();
    }

    @GET
    @Path("/{jobId}/status")
    public Response getJobStatus(@PathParam("jobId") String jobId) {
        log.debug("Getting job status for: {}", jobId);

        try {
            JobService.JobExecution<?> execution = jobService.getJobExecution(jobId);

            if (execution == null) {
                return notFound(jobId);
            }

            JobStatus status = execution.getStatus();
            JobProgress progress = execution.getProgress();

            Map<String, Object> result = new HashMap<>();
            result.put("jobId", jobId);
            result.put("jobType", execution.getJob().getJobType());
            result.put("status", status.name());
            result.put("isComplete", jobService.isJobComplete(jobId));

            if (progress != null) {
                Map<String, Object> progressInfo = Map.of(
                        "percentage", progress.getPercentage(),
                        "currentTask", progress.getCurrentTask(),
                        "details", progress.getDetails(),
                        "lastUpdated", progress.getLastUpdated().toString()
                );
                result.put("progress", progressInfo);
            }

            if (status == JobStatus.FAILED) {
                Exception error = jobService.getJobError(jobId);
                if (error != null) {
                    result.put("error", error.getMessage());
                }
            }

            if (execution.getStartTime() != null) {
                result.put("startTime", execution.getStartTime().toString());
            }

            if (execution.getEndTime() != null) {
                result.put("endTime", execution.getEndTime().toString());
            }

            return Response.ok(result).build();

        } catch (Exception e) {
            log.error("Error getting job status for: " + jobId, e);

            Map<String, Object> errorResult = Map.of(
                    "status", "error",
                    "message", "Error getting job status: " + e.getMessage()
            );

            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(errorResult)
                    .build();
        }
    }

    @GET
    @Path("/{jobId}/result")
    public Response getJobResult(@PathParam("jobId") String jobId) {
        log.debug("Getting job result for: {}", jobId);

        try {
            JobService.JobExecution<?> execution = jobService.getJobExecution(jobId);

            if (execution == null) {
                return notFound(jobId);
            }

            if (!jobService.isJobComplete(jobId)) {
                Map<String, Object> errorResult = Map.of(
                        "status", "error",
                        "message", "Job is not yet complete: " + jobId
                );
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(errorResult)
                        .build();
            }

            if (execution.getStatus() == JobStatus.FAILED) {
                Exception error = jobService.getJobError(jobId);
                Map<String, Object> errorResult = Map.of(
                        "status", "failed",
                        "jobId", jobId,
                        "message", error != null ? error.getMessage() : "Job failed with unknown error"
                );
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(errorResult)
                        .build();
            }

            Object result = jobService.getJobResult(jobId);
            String jobType = execution.getJob().getJobType();

            Map<String, Object> response = new HashMap<>();
            response.put("status", "success");
            response.put("jobId", jobId);
            response.put("jobType", jobType);

            if (result instanceof CorpusSyncResult) {
                CorpusSyncResult syncResult = (CorpusSyncResult) result;
                response.put("summary", CorpusSyncResource.generateCorpusSyncSummary(syncResult));
                response.put("totalRowsWritten", syncResult.getTotalRowsWritten());
                response.put("isSuccessful", syncResult.isSuccessful());
            } else if (result instanceof List<?> && jobType.contains("ROW_COUNT")) {
                @SuppressWarnings("unchecked")
                List<RowCountMetadata> rowCounts = (List<RowCountMetadata>) result;
                response.put("summary", RowCountResource.generateRowCountSummary(rowCounts));
                response.put("rowCountDataCount", rowCounts.size());
                response.put("result", result);
            } else {
                response.put("result", result);
            }

            return Response.ok(response).build();

        } catch (Exception e) {
            log.error("Error getting job result for: " + jobId, e);

            Map<String, Object> errorResult = Map.of(
                    "status", "error",
                    "message", "Error getting job result: " + e.getMessage()
            );

            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(errorResult)
                    .build();
        }
    }

    private static Response notFound(String jobId) {
        Map<String, Object> errorResult = Map.of(
                "status", "error",
                "message", "Job not found: " + jobId
        );
        return Response.status(Response.Status.NOT_FOUND)
                .entity(errorResult)
                .build();
    }
}
