package me.christianrobert.docsync.sync.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.docsync.rowcount.service.RowCountService;
import me.christianrobert.docsync.sync.model.CheckResult;
import me.christianrobert.docsync.sync.model.SyncErrorType;
import me.christianrobert.docsync.sync.model.SyncFailure;
import me.christianrobert.docsync.sync.model.SyncPhase;
import me.christianrobert.docsync.sync.model.SyncTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Recounts the destination inside the open transaction before it is committed.
 * Nodes may exceed the source count (resume mode keeps rows already present); contentdata and
 * embedding must match exactly.
 */
@ApplicationScoped
public class PostSyncValidator {

    private static final Logger log = LoggerFactory.getLogger(PostSyncValidator.class);

    @Inject
    RowCountService rowCountService;

    /**
     * @param sourceCounts       counts taken from the source snapshot
     * @param destinationCounts  filled with the recounted destination values
     */
    public CheckResult validate(Connection destination, Map<String, Long> sourceCounts,
                                Map<String, Long> destinationCounts) throws SQLException {
        destinationCounts.putAll(rowCountService.countRows(destination, SyncTables.DEPENDENT_TABLES));
        return compare(sourceCounts, destinationCounts);
    }

    CheckResult compare(Map<String, Long> sourceCounts, Map<String, Long> destinationCounts) {
        for (String table : SyncTables.DEPENDENT_TABLES) {
            long sourceCount = sourceCounts.getOrDefault(table, 0L);
            long destinationCount = destinationCounts.getOrDefault(table, 0L);

            boolean valid = SyncTables.NODE.equals(table)
                    ? destinationCount >= sourceCount
                    : destinationCount == sourceCount;

            if (!valid) {
                String expectation = SyncTables.NODE.equals(table) ? "at least" : "exactly";
                return CheckResult.failed(new SyncFailure(
                        SyncErrorType.COUNT_MISMATCH, SyncPhase.POST_SYNC_VALIDATION, List.of(table),
                        String.format("%s row count mismatch after sync: production=%d, expected %s local=%d",
                                table, destinationCount, expectation, sourceCount)));
            }
        }

        log.info("Post-sync counts verified: {}", destinationCounts);
        return CheckResult.passed();
    }
}
