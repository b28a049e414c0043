package me.christianrobert.docsync.core.job;

import me.christianrobert.docsync.core.job.model.JobProgress;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Unit of background work run by the {@link me.christianrobert.docsync.core.job.service.JobService}:
 * a row count on one endpoint, a sync preflight or a corpus sync.
 *
 * @param <T> result type, stored with the job execution once the future completes
 */
public interface Job<T> {

    /**
     * @return unique id, prefixed with endpoint and operation (e.g. {@code production-corpus-sync-<uuid>})
     */
    String getJobId();

    /**
     * @return registry key {@code <ENDPOINT>_<OPERATION>}; at most one sync-type job runs per key
     */
    String getJobType();

    String getDescription();

    /**
     * Starts the job. Failures complete the future exceptionally; the message is what
     * {@code GET /api/jobs/{id}/status} reports.
     */
    CompletableFuture<T> execute(Consumer<JobProgress> progressCallback);

    default void updateProgress(Consumer<JobProgress> progressCallback, int percentage, String currentTask, String details) {
        if (progressCallback != null) {
            progressCallback.accept(new JobProgress(percentage, currentTask, details));
        }
    }
}
