package me.christianrobert.docsync.sync.rest;

import jakarta.ws.rs.core.Response;
import me.christianrobert.docsync.core.job.Job;
import me.christianrobert.docsync.core.job.service.JobRegistry;
import me.christianrobert.docsync.core.job.service.JobService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CorpusSyncResourceTest {

    private JobService jobService;
    private JobRegistry jobRegistry;
    private CorpusSyncResource resource;
    private Job<?> job;

    @BeforeEach
    void setUp() {
        jobService = mock(JobService.class);
        jobRegistry = mock(JobRegistry.class);
        job = mock(Job.class);

        resource = new CorpusSyncResource();
        resource.jobService = jobService;
        resource.jobRegistry = jobRegistry;

        doReturn(Optional.of(job)).when(jobRegistry).createJob("PRODUCTION", "CORPUS_SYNC");
    }

    @Test
    void startsSyncThroughTheAtomicSubmission() {
        when(jobService.submitJobIfNoneActive(any(), eq("PRODUCTION_CORPUS_SYNC"), eq("PRODUCTION_SYNC_PREFLIGHT")))
                .thenReturn(Optional.of("production-corpus-sync-1"));

        Response response = resource.executeSync();

        assertEquals(200, response.getStatus());
        assertEquals("production-corpus-sync-1", ((Map<?, ?>) response.getEntity()).get("jobId"));
        verify(jobService, never()).submitJob(any());
    }

    @Test
    void activeSyncOrPreflightIsAConflict() {
        when(jobService.submitJobIfNoneActive(any(), any(String[].class))).thenReturn(Optional.empty());

        Response response = resource.executeSync();

        assertEquals(409, response.getStatus());
        verify(jobService, never()).submitJob(any());
    }
}
