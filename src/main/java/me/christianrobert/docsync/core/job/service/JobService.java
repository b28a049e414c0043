package me.christianrobert.docsync.core.job.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.docsync.core.job.Job;
import me.christianrobert.docsync.core.job.model.JobProgress;
import me.christianrobert.docsync.core.job.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

@ApplicationScoped
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final Map<String, JobExecution<?>> jobExecutions = new ConcurrentHashMap<>();

    /**
     * Shared thread pool for all job executions.
     */
    private ExecutorService executorService;

    @PostConstruct
    public void init() {
        log.info("Initializing shared ExecutorService for job execution");
        executorService = Executors.newCachedThreadPool();
    }

    /**
     * Shuts down the thread pool on application shutdown.
     * Waits up to 30 seconds for running jobs to complete, so a sync in progress can still
     * commit or roll back its destination transaction.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down ExecutorService");
        if (executorService == null || executorService.isShutdown()) {
            return;
        }

        try {
            executorService.shutdown();
            if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Executor did not terminate in 30s, forcing shutdown");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while shutting down executor service", e);
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static class JobExecution<T> {
        private final Job<T> job;
        private volatile JobStatus status;
        private volatile JobProgress progress;
        private volatile LocalDateTime startTime;
        private volatile LocalDateTime endTime;
        private volatile T result;
        private volatile Exception error;
        private CompletableFuture<T> future;

        public JobExecution(Job<T> job) {
            this.job = job;
            this.status = JobStatus.PENDING;
            this.progress = new JobProgress();
        }

        public Job<T> getJob() { return job; }
        public JobStatus getStatus() { return status; }
        public void setStatus(JobStatus status) { this.status = status; }
        public JobProgress getProgress() { return progress; }
        public void setProgress(JobProgress progress) { this.progress = progress; }
        public LocalDateTime getStartTime() { return startTime; }
        public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }
        public LocalDateTime getEndTime() { return endTime; }
        public void setEndTime(LocalDateTime endTime) { this.endTime = endTime; }
        public T getResult() { return result; }
        public void setResult(T result) { this.result = result; }
        public Exception getError() { return error; }
        public void setError(Exception error) { this.error = error; }
        public CompletableFuture<T> getFuture() { return future; }
        public void setFuture(CompletableFuture<T> future) { this.future = future; }
    }

    /**
     * Submits the job unless a job of one of the given types is pending or running.
     * Check and submission happen under the same lock as {@link #submitJob(Job)}.
     *
     * @return the job id, or empty if a conflicting job is active
     */
    public synchronized <T> Optional<String> submitJobIfNoneActive(Job<T> job, String... conflictingJobTypes) {
        for (String jobType : conflictingJobTypes) {
            if (isJobTypeActive(jobType)) {
                log.warn("Not submitting {}: a {} job is already active", job.getJobId(), jobType);
                return Optional.empty();
            }
        }
        return Optional.of(submitJob(job));
    }

    public synchronized <T> String submitJob(Job<T> job) {
        String jobId = job.getJobId();

        log.info("Submitting job: {} ({})", jobId, job.getJobType());

        JobExecution<T> execution = new JobExecution<>(job);
        jobExecutions.put(jobId, execution);

        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            execution.setStatus(JobStatus.RUNNING);
            execution.setStartTime(LocalDateTime.now());

            log.info("Starting job execution: {}", jobId);

            try {
                T result = job.execute(progress -> {
                    execution.setProgress(progress);
                    log.debug("Job {} progress: {}% {}", jobId, progress.getPercentage(), progress.getCurrentTask());
                }).get();

                execution.setResult(result);
                execution.setStatus(JobStatus.COMPLETED);
                execution.setEndTime(LocalDateTime.now());

                log.info("Job completed successfully: {}", jobId);
                return result;

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                execution.setError(e);
                execution.setStatus(JobStatus.FAILED);
                execution.setEndTime(LocalDateTime.now());
                throw new RuntimeException("Job execution interrupted: " + jobId, e);
            } catch (Exception e) {
                Exception cause = unwrap(e);
                execution.setError(cause);
                execution.setStatus(JobStatus.FAILED);
                execution.setEndTime(LocalDateTime.now());

                log.error("Job failed: {}", jobId, cause);
                throw new RuntimeException("Job execution failed: " + cause.getMessage(), cause);
            }
        }, executorService);

        execution.setFuture(future);
        return jobId;
    }

    /**
     * Strips the future wrappers so the stored error carries the job's own message.
     */
    static Exception unwrap(Exception e) {
        Throwable current = e;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current instanceof Exception ? (Exception) current : e;
    }

    public JobExecution<?> getJobExecution(String jobId) {
        return jobExecutions.get(jobId);
    }

    public JobStatus getJobStatus(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        return execution != null ? execution.getStatus() : null;
    }

    public JobProgress getJobProgress(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        return execution != null ? execution.getProgress() : null;
    }

    public <T> T getJobResult(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        if (execution != null && execution.getStatus() == JobStatus.COMPLETED) {
            @SuppressWarnings("unchecked")
            T result = (T) execution.getResult();
            return result;
        }
        return null;
    }

    public Exception getJobError(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        if (execution != null && execution.getStatus() == JobStatus.FAILED) {
            return execution.getError();
        }
        return null;
    }

    public boolean isJobComplete(String jobId) {
        JobStatus status = getJobStatus(jobId);
        return status == JobStatus.COMPLETED || status == JobStatus.FAILED;
    }

    /**
     * @return true if a job of the given type is pending or running
     */
    public boolean isJobTypeActive(String jobType) {
        return jobExecutions.values().stream()
                .anyMatch(execution -> jobType.equals(execution.getJob().getJobType())
                        && (execution.getStatus() == JobStatus.PENDING || execution.getStatus() == JobStatus.RUNNING));
    }

    public Map<String, JobExecution<?>> getAllJobExecutions() {
        return Map.copyOf(jobExecutions);
    }

    /**
     * Clears finished job executions from memory.
     * Running jobs are kept: a sync cannot be cancelled half-way, it either commits or rolls back.
     *
     * @return number of executions removed
     */
    public int resetJobs() {
        int before = jobExecutions.size();
        jobExecutions.entrySet().removeIf(entry -> isJobComplete(entry.getKey()));
        int removed = before - jobExecutions.size();

        log.info("Cleared {} finished job executions, {} still active", removed, jobExecutions.size());
        return removed;
    }
}
