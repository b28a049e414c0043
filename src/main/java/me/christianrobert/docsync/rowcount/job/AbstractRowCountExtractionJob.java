package me.christianrobert.docsync.rowcount.job;

import jakarta.inject.Inject;
import me.christianrobert.docsync.core.job.AbstractDatabaseExtractionJob;
import me.christianrobert.docsync.core.job.model.JobProgress;
import me.christianrobert.docsync.database.model.DatabaseEndpoint;
import me.christianrobert.docsync.database.service.PostgresConnectionService;
import me.christianrobert.docsync.rowcount.model.RowCountMetadata;
import me.christianrobert.docsync.rowcount.service.RowCountService;
import me.christianrobert.docsync.sync.model.SyncTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Counts the rows of the five corpus tables on one endpoint.
 * Tables that cannot be counted are reported with -1 instead of failing the job.
 */
public abstract class AbstractRowCountExtractionJob extends AbstractDatabaseExtractionJob<RowCountMetadata> {

    private static final Logger log = LoggerFactory.getLogger(AbstractRowCountExtractionJob.class);

    @Inject
    PostgresConnectionService postgresConnectionService;

    @Inject
    RowCountService rowCountService;

    protected abstract DatabaseEndpoint getEndpoint();

    @Override
    public String getSourceDatabase() {
        return getEndpoint().name();
    }

    @Override
    public String getExtractionType() {
        return "ROW_COUNT";
    }

    @Override
    public Class<RowCountMetadata> getResultType() {
        return RowCountMetadata.class;
    }

    @Override
    protected List<RowCountMetadata> performExtraction(Consumer<JobProgress> progressCallback) throws Exception {
        List<String> tables = SyncTables.ALL_TABLES;

        updateProgress(progressCallback, 5, "Connecting to " + getEndpoint(), "Establishing database connection");

        List<RowCountMetadata> allRowCounts = new ArrayList<>();

        try (Connection connection = postgresConnectionService.getConnection(getEndpoint())) {
            updateProgress(progressCallback, 10, "Connected", "Successfully connected to " + getEndpoint() + " database");

            long extractionTimestamp = System.currentTimeMillis();
            int processedTables = 0;

            for (String table : tables) {
                updateProgress(progressCallback,
                    10 + (processedTables * 85 / tables.size()),
                    "Counting rows in: " + table,
                    String.format("Table %d of %d", processedTables + 1, tables.size()));

                long rowCount = rowCountService.getRowCount(connection, table);
                allRowCounts.add(new RowCountMetadata(getEndpoint().name(), table, rowCount, extractionTimestamp));

                if (rowCount >= 0) {
                    log.debug("{} table {} has {} rows", getEndpoint(), table, rowCount);
                } else {
                    log.warn("{} table {} had error during row count", getEndpoint(), table);
                }
                processedTables++;
            }

            return allRowCounts;
        }
    }

    @Override
    protected String generateSummaryMessage(List<RowCountMetadata> results) {
        long totalRows = 0;
        int errorTables = 0;

        for (RowCountMetadata rowCount : results) {
            if (rowCount.isError()) {
                errorTables++;
            } else {
                totalRows += rowCount.getRowCount();
            }
        }

        String baseMessage = String.format("Row count extraction completed on %s: %d tables, %,d total rows",
                           getEndpoint(), results.size(), totalRows);

        if (errorTables > 0) {
            baseMessage += String.format(" (%d tables had errors)", errorTables);
        }

        return baseMessage;
    }
}
