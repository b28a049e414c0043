package me.christianrobert.docsync.sync.job;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.docsync.core.job.model.sync.CorpusSyncResult;

/**
 * Runs the sync gates against PRODUCTION without writing anything.
 */
@Dependent
public class CorpusSyncPreflightJob extends AbstractCorpusSyncJob {

    public static final String OPERATION_TYPE = "SYNC_PREFLIGHT";

    @Override
    public String getWriteOperationType() {
        return OPERATION_TYPE;
    }

    @Override
    public String getDescription() {
        return "Check whether a corpus sync from LOCAL to PRODUCTION would pass, without writing";
    }

    @Override
    protected boolean isDryRun() {
        return true;
    }

    @Override
    protected void saveResultsToState(CorpusSyncResult result) {
        stateService.setLastPreflightResult(result);
    }
}
