package me.christianrobert.docsync.sync.exception;

import me.christianrobert.docsync.core.job.model.sync.CorpusSyncResult;
import me.christianrobert.docsync.sync.model.SyncFailure;

/**
 * Thrown by the synchronizer after the destination transaction has been rolled back.
 * The message names the failed phase, the error category and the offending tables or ids.
 */
public class SyncAbortedException extends RuntimeException {

    private final SyncFailure failure;
    private final transient CorpusSyncResult result;

    public SyncAbortedException(SyncFailure failure) {
        this(failure, null, null);
    }

    public SyncAbortedException(SyncFailure failure, CorpusSyncResult result, Throwable cause) {
        super(failure.describe(), cause);
        this.failure = failure;
        this.result = result;
    }

    public SyncFailure getFailure() {
        return failure;
    }

    /**
     * @return what the run had done up to the failure, or null
     */
    public CorpusSyncResult getResult() {
        return result;
    }
}
