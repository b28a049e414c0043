package me.christianrobert.docsync.core.job.service;

import me.christianrobert.docsync.core.job.Job;
import me.christianrobert.docsync.core.job.model.JobProgress;
import me.christianrobert.docsync.core.job.model.JobStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class JobServiceTest {

    private JobService jobService;

    @BeforeEach
    void setUp() {
        jobService = new JobService();
        jobService.init();
    }

    @AfterEach
    void tearDown() {
        jobService.shutdown();
    }

    private static Job<String> job(String id, String type, CompletableFuture<String> outcome) {
        return new Job<>() {
            @Override
            public String getJobId() {
                return id;
            }

            @Override
            public String getJobType() {
                return type;
            }

            @Override
            public String getDescription() {
                return "test job";
            }

            @Override
            public CompletableFuture<String> execute(Consumer<JobProgress> progressCallback) {
                updateProgress(progressCallback, 50, "Working", "halfway");
                return outcome;
            }
        };
    }

    private void awaitCompletion(String jobId) {
        try {
            jobService.getJobExecution(jobId).getFuture().get(10, TimeUnit.SECONDS);
        } catch (Exception ignored) {
            // failure status is asserted by the caller
        }
    }

    @Test
    void completedJobExposesItsResult() {
        String jobId = jobService.submitJob(job("job-1", "PRODUCTION_CORPUS_SYNC", CompletableFuture.completedFuture("done")));
        awaitCompletion(jobId);

        assertEquals(JobStatus.COMPLETED, jobService.getJobStatus(jobId));
        assertEquals("done", jobService.<String>getJobResult(jobId));
        assertEquals(50, jobService.getJobProgress(jobId).getPercentage());
        assertNull(jobService.getJobError(jobId));
    }

    @Test
    void failedJobKeepsTheUnwrappedError() {
        CompletableFuture<String> failing = CompletableFuture.failedFuture(
                new IllegalStateException("anchor mismatch"));
        String jobId = jobService.submitJob(job("job-2", "PRODUCTION_CORPUS_SYNC", failing));
        awaitCompletion(jobId);

        assertEquals(JobStatus.FAILED, jobService.getJobStatus(jobId));
        assertNull(jobService.getJobResult(jobId));
        assertInstanceOf(IllegalStateException.class, jobService.getJobError(jobId));
        assertEquals("anchor mismatch", jobService.getJobError(jobId).getMessage());
    }

    @Test
    void activeJobTypeIsDetectedAndSurvivesReset() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> blocking = CompletableFuture.supplyAsync(() -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        });

        String finished = jobService.submitJob(job("job-3", "LOCAL_ROW_COUNT", CompletableFuture.completedFuture("x")));
        awaitCompletion(finished);
        String running = jobService.submitJob(job("job-4", "PRODUCTION_CORPUS_SYNC", blocking));

        assertTrue(jobService.isJobTypeActive("PRODUCTION_CORPUS_SYNC"));
        assertFalse(jobService.isJobTypeActive("LOCAL_ROW_COUNT"));

        assertEquals(1, jobService.resetJobs());
        assertNotNull(jobService.getJobExecution(running));
        assertNull(jobService.getJobExecution(finished));

        release.countDown();
        awaitCompletion(running);
        assertFalse(jobService.isJobTypeActive("PRODUCTION_CORPUS_SYNC"));
    }

    @Test
    void concurrentSubmissionsStartOnlyOneConflictingJob() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch start = new CountDownLatch(1);
        int callers = 8;
        ExecutorService callerPool = Executors.newFixedThreadPool(callers);

        try {
            List<Future<Optional<String>>> submissions = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                String type = i % 2 == 0 ? "PRODUCTION_CORPUS_SYNC" : "PRODUCTION_SYNC_PREFLIGHT";
                Job<String> job = job("job-c" + i, type, CompletableFuture.supplyAsync(() -> {
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "done";
                }));
                submissions.add(callerPool.submit(() -> {
                    start.await();
                    return jobService.submitJobIfNoneActive(job, "PRODUCTION_CORPUS_SYNC", "PRODUCTION_SYNC_PREFLIGHT");
                }));
            }
            start.countDown();

            int started = 0;
            for (Future<Optional<String>> submission : submissions) {
                if (submission.get(10, TimeUnit.SECONDS).isPresent()) {
                    started++;
                }
            }

            assertEquals(1, started);
            assertEquals(1, jobService.getAllJobExecutions().size());
        } finally {
            release.countDown();
            callerPool.shutdownNow();
        }
    }

    @Test
    void submissionIsAllowedOnceTheConflictingJobFinished() {
        String first = jobService.submitJob(job("job-5", "PRODUCTION_CORPUS_SYNC", CompletableFuture.completedFuture("x")));
        awaitCompletion(first);

        Optional<String> second = jobService.submitJobIfNoneActive(
                job("job-6", "PRODUCTION_SYNC_PREFLIGHT", CompletableFuture.completedFuture("y")),
                "PRODUCTION_CORPUS_SYNC", "PRODUCTION_SYNC_PREFLIGHT");

        assertEquals(Optional.of("job-6"), second);
    }

    @Test
    void unwrapStripsFutureWrappers() {
        IllegalArgumentException root = new IllegalArgumentException("bad batch size");

        Exception unwrapped = JobService.unwrap(new ExecutionException(new CompletionException(root)));

        assertSame(root, unwrapped);
    }
}
