package me.christianrobert.docsync.sequence.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.docsync.sync.model.SyncTables;
import me.christianrobert.docsync.transfer.service.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves the id sequences of the written tables past the copied ids.
 * <p>
 * A non-empty table gets {@code setval(seq, max(id), true)}, so the next value is max + 1.
 * An empty table gets {@code setval(seq, 1, false)}, so the next value is 1.
 */
@ApplicationScoped
public class SequenceResynchronizer {

    private static final Logger log = LoggerFactory.getLogger(SequenceResynchronizer.class);

    /**
     * @return the value set per table; tables without an owned sequence are left out
     */
    public Map<String, Long> resynchronize(Connection destination, List<String> tableNames) throws SQLException {
        Map<String, Long> values = new LinkedHashMap<>();

        for (String tableName : tableNames) {
            String sequenceName = findSequence(destination, tableName);
            if (sequenceName == null) {
                log.warn("Table {} has no sequence owning column {}, skipping resynchronization",
                        tableName, SyncTables.PRIMARY_KEY);
                continue;
            }

            Long maxId = fetchMaxId(destination, tableName);
            long value = maxId != null ? maxId : 1L;
            boolean isCalled = maxId != null;

            try (PreparedStatement ps = destination.prepareStatement("SELECT setval(CAST(? AS regclass), ?, ?)")) {
                ps.setString(1, sequenceName);
                ps.setLong(2, value);
                ps.setBoolean(3, isCalled);
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                }
            }

            values.put(tableName, value);
            log.info("Sequence {} for {} set to {} (is_called={})", sequenceName, tableName, value, isCalled);
        }
        return values;
    }

    private String findSequence(Connection destination, String tableName) throws SQLException {
        try (PreparedStatement ps = destination.prepareStatement("SELECT pg_get_serial_sequence(?, ?)")) {
            ps.setString(1, SqlIdentifiers.qualify(tableName));
            ps.setString(2, SyncTables.PRIMARY_KEY);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private Long fetchMaxId(Connection destination, String tableName) throws SQLException {
        String sql = "SELECT MAX(" + SqlIdentifiers.quote(SyncTables.PRIMARY_KEY) + ") FROM " + SqlIdentifiers.qualify(tableName);
        try (PreparedStatement ps = destination.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            long max = rs.getLong(1);
            return rs.wasNull() ? null : max;
        }
    }
}
