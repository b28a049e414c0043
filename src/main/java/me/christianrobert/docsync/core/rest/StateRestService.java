package me.christianrobert.docsync.core.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.docsync.core.job.model.sync.CorpusSyncResult;
import me.christianrobert.docsync.core.job.service.JobService;
import me.christianrobert.docsync.core.service.StateService;
import me.christianrobert.docsync.rowcount.model.RowCountMetadata;
import me.christianrobert.docsync.sync.rest.CorpusSyncResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Path("/api/state")
@Produces(MediaType.APPLICATION_JSON)
public class StateRestService {

    private static final Logger log = LoggerFactory.getLogger(StateRestService.class);

    @Inject
    StateService stateService;

    @Inject
    JobService jobService;

    @GET
    public Response getCurrentState() {
        log.debug("Getting current application state");

        Map<String, Object> state = new LinkedHashMap<>();
        state.put("localRowCounts", toCountMap(stateService.getLocalRowCountMetadata()));
        state.put("productionRowCounts", toCountMap(stateService.getProductionRowCountMetadata()));
        state.put("lastPreflight", summarize(stateService.getLastPreflightResult()));
        state.put("lastSync", summarize(stateService.getLastSyncResult()));
        state.put("jobCount", jobService.getAllJobExecutions().size());

        return Response.ok(state).build();
    }

    @GET
    @Path("/reset")
    public Response resetState() {
        log.info("Resetting application state and job history");

        stateService.resetState();
        int removedJobs = jobService.resetJobs();

        log.info("State and job history reset completed successfully");
        return Response.ok(Map.of(
                "message", "State and job history reset successfully",
                "removedJobs", removedJobs
        )).build();
    }

    private static Map<String, Long> toCountMap(List<RowCountMetadata> rowCounts) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (RowCountMetadata rowCount : rowCounts) {
            counts.put(rowCount.getTableName(), rowCount.getRowCount());
        }
        return counts;
    }

    private static Map<String, Object> summarize(CorpusSyncResult result) {
        return result == null ? Map.of() : CorpusSyncResource.generateCorpusSyncSummary(result);
    }
}
