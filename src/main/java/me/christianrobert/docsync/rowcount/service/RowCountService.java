package me.christianrobert.docsync.rowcount.service;

import jakarta.enterprise.context.ApplicationScoped;
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
 * Counts rows of corpus tables.
 * Used by the row count extraction jobs and by the sync guards and post-sync validation.
 */
@ApplicationScoped
public class RowCountService {

    private static final Logger log = LoggerFactory.getLogger(RowCountService.class);

    /**
     * Gets the row count for a table, or -1 if counting fails.
     * Only meant for reporting; sync phases use {@link #countRows(Connection, String)}.
     */
    public long getRowCount(Connection connection, String tableName) {
        try {
            return countRows(connection, tableName);
        } catch (SQLException e) {
            log.error("Failed to get row count for table: {}", tableName, e);
            return -1;
        }
    }

    /**
     * Counts the rows of a table in schema {@code public}.
     *
     * @throws SQLException if the query fails (e.g. the table does not exist)
     */
    public long countRows(Connection connection, String tableName) throws SQLException {
        String sql = "SELECT COUNT(*) AS row_count FROM " + SqlIdentifiers.qualify(tableName);

        try (PreparedStatement stmt = connection.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            if (rs.next()) {
                return rs.getLong("row_count");
            }
            throw new SQLException("No result returned from count query on " + tableName);
        }
    }

    /**
     * Counts several tables, keeping the given order.
     */
    public Map<String, Long> countRows(Connection connection, List<String> tableNames) throws SQLException {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String tableName : tableNames) {
            counts.put(tableName, countRows(connection, tableName));
        }
        log.debug("Row counts: {}", counts);
        return counts;
    }
}
