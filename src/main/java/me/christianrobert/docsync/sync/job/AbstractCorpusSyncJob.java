package me.christianrobert.docsync.sync.job;

import jakarta.inject.Inject;
import me.christianrobert.docsync.core.job.AbstractDatabaseWriteJob;
import me.christianrobert.docsync.core.job.model.JobProgress;
import me.christianrobert.docsync.core.job.model.sync.CorpusSyncResult;
import me.christianrobert.docsync.database.model.ConnectionSettings;
import me.christianrobert.docsync.database.model.DatabaseEndpoint;
import me.christianrobert.docsync.database.service.PostgresConnectionService;
import me.christianrobert.docsync.sync.exception.SyncAbortedException;
import me.christianrobert.docsync.sync.model.SyncOptions;
import me.christianrobert.docsync.sync.service.CorpusSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.util.function.Consumer;

/**
 * Shared flow of the sync and preflight jobs: read options, resolve both endpoints,
 * connect, hand the connections to the {@link CorpusSynchronizer}.
 */
public abstract class AbstractCorpusSyncJob extends AbstractDatabaseWriteJob<CorpusSyncResult> {

    private static final Logger log = LoggerFactory.getLogger(AbstractCorpusSyncJob.class);

    @Inject
    private PostgresConnectionService postgresConnectionService;

    @Inject
    private CorpusSynchronizer corpusSynchronizer;

    protected abstract boolean isDryRun();

    @Override
    public String getTargetDatabase() {
        return DatabaseEndpoint.PRODUCTION.name();
    }

    @Override
    public Class<CorpusSyncResult> getResultType() {
        return CorpusSyncResult.class;
    }

    @Override
    protected CorpusSyncResult performWriteOperation(Consumer<JobProgress> progressCallback) throws Exception {
        updateProgress(progressCallback, 0, "Initializing", "Reading sync configuration");
        SyncOptions options = SyncOptions.fromConfig(configService, isDryRun());

        // Both endpoints must resolve before either connection is opened.
        ConnectionSettings localSettings = postgresConnectionService.resolveSettings(DatabaseEndpoint.LOCAL);
        ConnectionSettings productionSettings = postgresConnectionService.resolveSettings(DatabaseEndpoint.PRODUCTION);
        log.info("Resolved endpoints: local={}, production={}", localSettings, productionSettings);

        updateProgress(progressCallback, 3, "Connecting to databases", "Establishing LOCAL and PRODUCTION connections");

        try (Connection localConnection = postgresConnectionService.openConnection(localSettings);
             Connection productionConnection = postgresConnectionService.openConnection(productionSettings)) {

            try {
                return isDryRun()
                        ? corpusSynchronizer.preflight(localConnection, productionConnection, options, progressCallback)
                        : corpusSynchronizer.synchronize(localConnection, productionConnection, options, progressCallback);
            } catch (SyncAbortedException e) {
                if (e.getResult() != null) {
                    saveResultsToState(e.getResult());
                }
                throw e;
            }
        }
    }

    @Override
    protected String generateSummaryMessage(CorpusSyncResult result) {
        if (result.isDryRun()) {
            return String.format("Preflight passed (%s mode): local counts %s, production counts %s",
                    result.getMode(), result.getSourceRowCounts(), result.getDestinationRowCounts());
        }
        return String.format("Corpus sync completed (%s mode): %,d rows written %s, sequences %s",
                result.getMode(), result.getTotalRowsWritten(), result.getRowsWritten(), result.getSequenceValues());
    }
}
