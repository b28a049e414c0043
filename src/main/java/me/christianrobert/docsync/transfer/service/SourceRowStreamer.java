package me.christianrobert.docsync.transfer.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Streams a source query in fixed-size batches through a forward-only cursor.
 * Memory use is bounded by the batch size; the source connection must have autocommit off
 * for the PostgreSQL driver to fetch with a cursor.
 */
@ApplicationScoped
public class SourceRowStreamer {

    private static final Logger log = LoggerFactory.getLogger(SourceRowStreamer.class);

    @FunctionalInterface
    public interface BatchHandler {
        void handle(List<String[]> rows) throws SQLException;
    }

    /**
     * Runs the query and hands over rows (all columns read as strings) in batches of {@code batchSize}.
     *
     * @return the number of rows streamed
     */
    public long stream(Connection source, String sql, int batchSize, BatchHandler handler) throws SQLException {
        if (source.getAutoCommit()) {
            log.warn("Source connection is in autocommit mode; the driver will not use a cursor");
        }
        log.debug("Streaming source query with batch size {}: {}", batchSize, sql);

        long total = 0;
        try (PreparedStatement ps = source.prepareStatement(sql, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY)) {
            ps.setFetchSize(batchSize);

            try (ResultSet rs = ps.executeQuery()) {
                int columnCount = rs.getMetaData().getColumnCount();
                List<String[]> batch = new ArrayList<>(batchSize);

                while (rs.next()) {
                    String[] row = new String[columnCount];
                    for (int i = 0; i < columnCount; i++) {
                        row[i] = rs.getString(i + 1);
                    }
                    batch.add(row);

                    if (batch.size() == batchSize) {
                        handler.handle(batch);
                        total += batch.size();
                        batch = new ArrayList<>(batchSize);
                    }
                }

                if (!batch.isEmpty()) {
                    handler.handle(batch);
                    total += batch.size();
                }
            }
        }
        return total;
    }
}
