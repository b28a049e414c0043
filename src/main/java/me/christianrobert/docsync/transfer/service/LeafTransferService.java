package me.christianrobert.docsync.transfer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.docsync.schema.model.TableShape;
import me.christianrobert.docsync.transfer.model.TableWritePlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.function.LongConsumer;

/**
 * Copies a table without parent/child order (contentdata, embedding) in id order.
 */
@ApplicationScoped
public class LeafTransferService {

    private static final Logger log = LoggerFactory.getLogger(LeafTransferService.class);

    @Inject
    SourceRowStreamer sourceRowStreamer;

    @Inject
    BatchUpsertWriter batchUpsertWriter;

    /**
     * @param upsert        plain INSERT when false, upsert on {@code id} when true
     * @param writtenSoFar  receives the running total after every batch
     * @return rows written
     */
    public long transfer(Connection source, Connection destination, TableShape shape, int batchSize, boolean upsert,
                         LongConsumer writtenSoFar) throws SQLException {
        TableWritePlan plan = TableWritePlan.forShape(shape, upsert);
        String selectSql = UpsertStatementBuilder.buildOrderedSelect(plan);
        log.info("{} {} (streaming, batch size {})", upsert ? "Upserting" : "Inserting", shape.getTableName(), batchSize);

        long[] written = {0};
        sourceRowStreamer.stream(source, selectSql, batchSize, rows -> {
            written[0] += batchUpsertWriter.write(destination, plan, rows);
            writtenSoFar.accept(written[0]);
        });

        log.info("Transfer of {} finished: {} rows written", shape.getTableName(), written[0]);
        return written[0];
    }
}
