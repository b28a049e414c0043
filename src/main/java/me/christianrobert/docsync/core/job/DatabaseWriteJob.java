package me.christianrobert.docsync.core.job;

/**
 * Job that writes to one of the two databases.
 * Only the PRODUCTION endpoint is ever written; the LOCAL source is read-only.
 *
 * @param <T> The type of result produced by the write operation (e.g. CorpusSyncResult)
 */
public interface DatabaseWriteJob<T> extends Job<T> {

    /**
     * @return The endpoint written by this job ("PRODUCTION")
     */
    String getTargetDatabase();

    /**
     * @return The type of write operation (e.g. "CORPUS_SYNC", "SYNC_PREFLIGHT")
     */
    String getWriteOperationType();

    Class<T> getResultType();

    /**
     * @return A unique identifier combining target database and operation type
     */
    default String getJobTypeIdentifier() {
        return getTargetDatabase() + "_" + getWriteOperationType();
    }
}
