package me.christianrobert.docsync.core.job;

import java.util.List;

/**
 * Job that only reads from one endpoint and stores what it found in the global state.
 *
 * @param <T> The type of metadata extracted (e.g. RowCountMetadata)
 */
public interface DatabaseExtractionJob<T> extends Job<List<T>> {

    /**
     * @return The endpoint read by this job ("LOCAL" or "PRODUCTION")
     */
    String getSourceDatabase();

    /**
     * @return The type of extraction (e.g. "ROW_COUNT")
     */
    String getExtractionType();

    Class<T> getResultType();

    default String getJobTypeIdentifier() {
        return getSourceDatabase() + "_" + getExtractionType();
    }
}
