package me.christianrobert.docsync.sync.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.docsync.rowcount.service.RowCountService;
import me.christianrobert.docsync.sync.model.CheckResult;
import me.christianrobert.docsync.sync.model.SyncErrorType;
import me.christianrobert.docsync.sync.model.SyncFailure;
import me.christianrobert.docsync.sync.model.SyncMode;
import me.christianrobert.docsync.sync.model.SyncPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * In strict mode the dependent tables on the destination must be empty.
 * Resume mode skips the check.
 */
@ApplicationScoped
public class TargetStateGuard {

    private static final Logger log = LoggerFactory.getLogger(TargetStateGuard.class);

    @Inject
    RowCountService rowCountService;

    public CheckResult check(Connection destination, List<String> dependentTables, SyncMode mode) throws SQLException {
        if (mode == SyncMode.RESUME) {
            log.warn("Resume mode: skipping target emptiness check for {}", dependentTables);
            return CheckResult.passed();
        }

        Map<String, Long> counts = rowCountService.countRows(destination, dependentTables);

        List<String> nonEmptyTables = new ArrayList<>();
        List<String> described = new ArrayList<>();
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            if (entry.getValue() != 0) {
                nonEmptyTables.add(entry.getKey());
                described.add(entry.getKey() + "(" + entry.getValue() + ")");
            }
        }

        if (nonEmptyTables.isEmpty()) {
            log.info("Target tables {} are empty", dependentTables);
            return CheckResult.passed();
        }

        return CheckResult.failed(new SyncFailure(
                SyncErrorType.NON_EMPTY_TARGET, SyncPhase.TARGET_STATE, nonEmptyTables,
                "target database is not empty for: " + String.join(", ", described)));
    }
}
