package me.christianrobert.docsync.transfer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.docsync.schema.model.TableShape;
import me.christianrobert.docsync.sync.model.SyncTables;
import me.christianrobert.docsync.transfer.model.TableWritePlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.function.LongConsumer;

/**
 * Copies the node forest parent-first and upserts it on {@code id}.
 * Nodes are always upserted, in both modes, so a repeated run converges to the same rows.
 */
@ApplicationScoped
public class NodeTreeTransferService {

    private static final Logger log = LoggerFactory.getLogger(NodeTreeTransferService.class);

    @Inject
    SourceRowStreamer sourceRowStreamer;

    @Inject
    BatchUpsertWriter batchUpsertWriter;

    /**
     * @param nodeShape     destination shape of the node table
     * @param writtenSoFar  receives the running total after every batch
     * @return rows written
     */
    public long transfer(Connection source, Connection destination, TableShape nodeShape, int batchSize,
                         LongConsumer writtenSoFar) throws SQLException {
        if (!SyncTables.NODE.equals(nodeShape.getTableName())) {
            throw new IllegalArgumentException("Node transfer needs the node table, got " + nodeShape.getTableName());
        }

        TableWritePlan plan = TableWritePlan.forShape(nodeShape, true);
        String selectSql = UpsertStatementBuilder.buildNodeTreeSelect(plan);
        log.info("Upserting nodes to production (parent-first order, batch size {})", batchSize);

        long[] written = {0};
        long streamed = sourceRowStreamer.stream(source, selectSql, batchSize, rows -> {
            written[0] += batchUpsertWriter.write(destination, plan, rows);
            writtenSoFar.accept(written[0]);
        });

        log.info("Node transfer finished: {} rows streamed, {} written", streamed, written[0]);
        return written[0];
    }
}
