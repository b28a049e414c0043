package me.christianrobert.docsync.sync.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.docsync.sync.model.AnchorFingerprint;
import me.christianrobert.docsync.sync.model.CheckResult;
import me.christianrobert.docsync.sync.model.SyncErrorType;
import me.christianrobert.docsync.sync.model.SyncFailure;
import me.christianrobert.docsync.sync.model.SyncPhase;
import me.christianrobert.docsync.transfer.service.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Verifies that the anchor tables (publication, document) hold the same ids on both endpoints.
 * Anchors are never written; a difference stops the run before any dependent row is touched.
 */
@ApplicationScoped
public class AnchorParityChecker {

    private static final Logger log = LoggerFactory.getLogger(AnchorParityChecker.class);

    public CheckResult check(Connection source, Connection destination, List<String> anchorTables) throws SQLException {
        for (String table : anchorTables) {
            AnchorFingerprint sourceFingerprint = fingerprint(source, table);
            AnchorFingerprint destinationFingerprint = fingerprint(destination, table);

            CheckResult result = compare(sourceFingerprint, destinationFingerprint);
            if (!result.isPassed()) {
                return result;
            }
            log.info("Anchor table {} matches ({})", table, sourceFingerprint.summary());
        }
        return CheckResult.passed();
    }

    /**
     * Compares two fingerprints of the same table.
     */
    public CheckResult compare(AnchorFingerprint source, AnchorFingerprint destination) {
        Optional<String> discrepancy = source.discrepancyWith(destination);
        if (discrepancy.isEmpty()) {
            return CheckResult.passed();
        }

        String table = source.getTableName();
        List<Long> offendingIds = List.of();
        String message;
        switch (discrepancy.get()) {
            case "count":
                message = String.format("%s row count differs (local=%d, production=%d)",
                        table, source.getRowCount(), destination.getRowCount());
                break;
            case "id-set":
                List<Long> onlyLocal = idsMissingFrom(source.getSortedIds(), destination.getSortedIds());
                List<Long> onlyProduction = idsMissingFrom(destination.getSortedIds(), source.getSortedIds());
                offendingIds = new ArrayList<>(new TreeSet<>(concat(onlyLocal, onlyProduction)));
                message = String.format("%s id sets differ between local and production: "
                                + "%d ids only in local %s, %d ids only in production %s",
                        table, onlyLocal.size(), SyncFailure.sample(onlyLocal),
                        onlyProduction.size(), SyncFailure.sample(onlyProduction));
                break;
            default:
                message = String.format("%s id min/max differ (local=[%d..%d], production=[%d..%d])",
                        table, source.getMinId(), source.getMaxId(), destination.getMinId(), destination.getMaxId());
        }

        log.warn("Anchor mismatch on {}: {}", table, discrepancy.get());
        return CheckResult.failed(new SyncFailure(
                SyncErrorType.ANCHOR_MISMATCH, SyncPhase.ANCHOR_PARITY, List.of(table),
                message + " [" + discrepancy.get() + "]", offendingIds));
    }

    /**
     * @return ids of {@code ids} absent from {@code others}, ascending
     */
    static List<Long> idsMissingFrom(List<Long> ids, List<Long> others) {
        Set<Long> remaining = new TreeSet<>(ids);
        remaining.removeAll(new HashSet<>(others));
        return new ArrayList<>(remaining);
    }

    private static List<Long> concat(List<Long> first, List<Long> second) {
        List<Long> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }

    public AnchorFingerprint fingerprint(Connection connection, String table) throws SQLException {
        String qualified = SqlIdentifiers.qualify(table);
        String idColumn = SqlIdentifiers.quote("id");

        long count;
        long minId;
        long maxId;
        String statsSql = "SELECT COUNT(*), COALESCE(MIN(" + idColumn + "), 0), COALESCE(MAX(" + idColumn + "), 0) FROM " + qualified;
        try (PreparedStatement ps = connection.prepareStatement(statsSql);
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            count = rs.getLong(1);
            minId = rs.getLong(2);
            maxId = rs.getLong(3);
        }

        List<Long> ids = new ArrayList<>();
        String idSql = "SELECT " + idColumn + " FROM " + qualified + " ORDER BY " + idColumn;
        try (PreparedStatement ps = connection.prepareStatement(idSql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getLong(1));
            }
        }

        return new AnchorFingerprint(table, count, ids, minId, maxId);
    }
}
