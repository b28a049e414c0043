package me.christianrobert.docsync.core.job;

import jakarta.inject.Inject;
import me.christianrobert.docsync.core.job.model.JobProgress;
import me.christianrobert.docsync.core.service.StateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Abstract base class for read-only extraction jobs.
 *
 * @param <T> The type of metadata being extracted
 */
public abstract class AbstractDatabaseExtractionJob<T> implements DatabaseExtractionJob<T> {

    private static final Logger log = LoggerFactory.getLogger(AbstractDatabaseExtractionJob.class);

    protected final String jobId;

    @Inject
    protected StateService stateService;

    protected AbstractDatabaseExtractionJob() {
        this.jobId = generateJobId();
    }

    protected String generateJobId() {
        return getSourceDatabase().toLowerCase() + "-" +
               getExtractionType().toLowerCase().replace("_", "-") + "-" +
               UUID.randomUUID();
    }

    @Override
    public String getJobId() {
        return jobId;
    }

    @Override
    public String getJobType() {
        return getJobTypeIdentifier();
    }

    @Override
    public String getDescription() {
        return String.format("Extract %s from %s database and store in global state",
                            getExtractionType().replace("_", " ").toLowerCase(),
                            getSourceDatabase());
    }

    @Override
    public CompletableFuture<List<T>> execute(Consumer<JobProgress> progressCallback) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return performExtractionWithStateSaving(progressCallback);
            } catch (Exception e) {
                log.error("{} extraction failed", getExtractionType(), e);
                throw new RuntimeException(String.format("%s extraction failed: %s",
                                                       getExtractionType(), e.getMessage()), e);
            }
        });
    }

    /**
     * Template method for performing the actual extraction.
     */
    protected abstract List<T> performExtraction(Consumer<JobProgress> progressCallback) throws Exception;

    /**
     * Saves the extraction results to the appropriate state location.
     */
    protected abstract void saveResultsToState(List<T> results);

    protected final List<T> performExtractionWithStateSaving(Consumer<JobProgress> progressCallback) throws Exception {
        List<T> results = performExtraction(progressCallback);

        updateProgress(progressCallback, 95, "Storing results", "Saving extraction results to global state");
        saveResultsToState(results);

        String summaryMessage = generateSummaryMessage(results);
        updateProgress(progressCallback, 100, "Completed", summaryMessage);

        log.info("{} extraction completed successfully: {}", getExtractionType(), summaryMessage);
        return results;
    }

    protected String generateSummaryMessage(List<T> results) {
        return String.format("Extraction completed: %d %s extracted",
                           results.size(),
                           getExtractionType().replace("_", " ").toLowerCase());
    }
}
