package me.christianrobert.docsync.transfer.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.docsync.transfer.model.TableWritePlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

/**
 * Writes a batch of rows to the destination as one multi-row INSERT.
 * A batch whose bind parameters would exceed the protocol limit is split into several statements.
 */
@ApplicationScoped
public class BatchUpsertWriter {

    private static final Logger log = LoggerFactory.getLogger(BatchUpsertWriter.class);

    /** Bind parameters per statement allowed by the PostgreSQL wire protocol. */
    static final int MAX_BIND_PARAMETERS = 65_535;

    /**
     * @return number of rows inserted or updated
     */
    public long write(Connection destination, TableWritePlan plan, List<String[]> rows) throws SQLException {
        if (rows.isEmpty()) {
            return 0;
        }

        int rowsPerStatement = maxRowsPerStatement(plan.getColumnCount());
        long written = 0;
        for (int start = 0; start < rows.size(); start += rowsPerStatement) {
            List<String[]> chunk = rows.subList(start, Math.min(rows.size(), start + rowsPerStatement));
            written += writeStatement(destination, plan, chunk);
        }
        return written;
    }

    static int maxRowsPerStatement(int columnCount) {
        return Math.max(1, MAX_BIND_PARAMETERS / columnCount);
    }

    private long writeStatement(Connection destination, TableWritePlan plan, List<String[]> rows) throws SQLException {
        String sql = UpsertStatementBuilder.buildInsert(plan, rows.size());
        int columnCount = plan.getColumnCount();

        try (PreparedStatement ps = destination.prepareStatement(sql)) {
            int index = 1;
            for (String[] row : rows) {
                if (row.length != columnCount) {
                    throw new IllegalArgumentException(String.format(
                            "Row for %s has %d values, expected %d", plan.getTableName(), row.length, columnCount));
                }
                for (String value : row) {
                    if (value == null) {
                        ps.setNull(index++, Types.VARCHAR);
                    } else {
                        ps.setString(index++, value);
                    }
                }
            }
            int affected = ps.executeUpdate();
            log.debug("Wrote {} rows to {} ({} reported by the server)", rows.size(), plan.getTableName(), affected);
            return affected;
        }
    }
}
