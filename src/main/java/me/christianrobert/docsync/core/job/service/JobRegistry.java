package me.christianrobert.docsync.core.job.service;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import me.christianrobert.docsync.core.job.DatabaseExtractionJob;
import me.christianrobert.docsync.core.job.DatabaseWriteJob;
import me.christianrobert.docsync.core.job.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for database jobs using CDI-based discovery.
 * Discovers every DatabaseExtractionJob and DatabaseWriteJob bean and hands out fresh
 * (dependent-scoped) instances keyed by {@code <DATABASE>_<OPERATION>}.
 */
@ApplicationScoped
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    @Inject
    Instance<DatabaseExtractionJob<?>> extractionJobInstances;

    @Inject
    Instance<DatabaseWriteJob<?>> writeJobInstances;

    private final Map<String, Class<? extends Job<?>>> jobTypeMap = new ConcurrentHashMap<>();
    private final Map<String, String> jobDescriptions = new ConcurrentHashMap<>();

    @PostConstruct
    public void initialize() {
        log.info("Initializing JobRegistry and discovering database jobs (extraction and write)");

        int discoveredJobCount = 0;

        for (DatabaseExtractionJob<?> job : extractionJobInstances) {
            registerJob(createJobTypeKey(job.getSourceDatabase(), job.getExtractionType()), job, "extraction");
            discoveredJobCount++;
        }

        for (DatabaseWriteJob<?> job : writeJobInstances) {
            registerJob(createJobTypeKey(job.getTargetDatabase(), job.getWriteOperationType()), job, "write");
            discoveredJobCount++;
        }

        log.info("JobRegistry initialization completed. Discovered {} database jobs", discoveredJobCount);

        if (discoveredJobCount == 0) {
            log.warn("No database jobs were discovered. Check that job classes are properly annotated with CDI scopes.");
        }
    }

    private void registerJob(String jobTypeKey, Job<?> job, String jobCategory) {
        @SuppressWarnings("unchecked")
        Class<? extends Job<?>> jobClass = (Class<? extends Job<?>>) job.getClass();
        jobTypeMap.put(jobTypeKey, jobClass);
        jobDescriptions.put(jobTypeKey, job.getDescription());

        log.info("Registered {} job: {} -> {} ({})",
                jobCategory, jobTypeKey, jobClass.getSimpleName(), job.getDescription());
    }

    /**
     * Creates a new job instance for the specified database and operation type.
     *
     * @param database The database ("LOCAL" or "PRODUCTION")
     * @param operationType The operation type ("CORPUS_SYNC", "ROW_COUNT", ...)
     * @return A new job instance, or empty if no matching job is found
     */
    public Optional<Job<?>> createJob(String database, String operationType) {
        String jobTypeKey = createJobTypeKey(database, operationType);

        Class<? extends Job<?>> jobClass = jobTypeMap.get(jobTypeKey);
        if (jobClass == null) {
            log.warn("No job registered for key: {}", jobTypeKey);
            return Optional.empty();
        }

        Job<?> jobInstance;
        if (DatabaseExtractionJob.class.isAssignableFrom(jobClass)) {
            @SuppressWarnings("unchecked")
            Class<? extends DatabaseExtractionJob<?>> extractionJobClass =
                (Class<? extends DatabaseExtractionJob<?>>) jobClass;
            jobInstance = extractionJobInstances.select(extractionJobClass).get();
        } else if (DatabaseWriteJob.class.isAssignableFrom(jobClass)) {
            @SuppressWarnings("unchecked")
            Class<? extends DatabaseWriteJob<?>> writeJobClass =
                (Class<? extends DatabaseWriteJob<?>>) jobClass;
            jobInstance = writeJobInstances.select(writeJobClass).get();
        } else {
            throw new IllegalStateException("Unknown job type: " + jobClass);
        }

        log.debug("Created new job instance: {} for key: {}", jobClass.getSimpleName(), jobTypeKey);
        return Optional.of(jobInstance);
    }

    /**
     * @return job type keys mapped to their descriptions, sorted by key
     */
    public Map<String, String> getAvailableJobTypes() {
        return new TreeMap<>(jobDescriptions);
    }

    static String createJobTypeKey(String database, String operationType) {
        return database.toUpperCase() + "_" + operationType.toUpperCase();
    }
}
