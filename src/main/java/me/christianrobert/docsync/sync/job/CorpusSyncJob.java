package me.christianrobert.docsync.sync.job;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.docsync.core.job.model.sync.CorpusSyncResult;

/**
 * Copies node, contentdata and embedding rows from LOCAL to PRODUCTION in one destination transaction.
 */
@Dependent
public class CorpusSyncJob extends AbstractCorpusSyncJob {

    public static final String OPERATION_TYPE = "CORPUS_SYNC";

    @Override
    public String getWriteOperationType() {
        return OPERATION_TYPE;
    }

    @Override
    protected boolean isDryRun() {
        return false;
    }

    @Override
    protected void saveResultsToState(CorpusSyncResult result) {
        stateService.setLastSyncResult(result);
    }
}
