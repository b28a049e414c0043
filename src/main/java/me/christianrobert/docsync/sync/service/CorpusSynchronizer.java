package me.christianrobert.docsync.sync.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.docsync.core.job.model.JobProgress;
import me.christianrobert.docsync.core.job.model.sync.CorpusSyncResult;
import me.christianrobert.docsync.rowcount.service.RowCountService;
import me.christianrobert.docsync.schema.model.TableShape;
import me.christianrobert.docsync.schema.service.SchemaParityVerifier;
import me.christianrobert.docsync.schema.service.TableShapeExtractor;
import me.christianrobert.docsync.sequence.service.SequenceResynchronizer;
import me.christianrobert.docsync.sync.exception.SyncAbortedException;
import me.christianrobert.docsync.sync.model.CheckResult;
import me.christianrobert.docsync.sync.model.SyncErrorType;
import me.christianrobert.docsync.sync.model.SyncFailure;
import me.christianrobert.docsync.sync.model.SyncOptions;
import me.christianrobert.docsync.sync.model.SyncPhase;
import me.christianrobert.docsync.sync.model.SyncTables;
import me.christianrobert.docsync.transfer.service.LeafTransferService;
import me.christianrobert.docsync.transfer.service.NodeTreeTransferService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Runs a corpus sync from LOCAL (source) to PRODUCTION (destination).
 * <p>
 * Every phase runs inside one destination transaction and returns a {@link CheckResult}.
 * A failed result or an {@link SQLException} rolls the transaction back and ends the run with a
 * {@link SyncAbortedException}; the single commit happens after post-sync validation.
 * The source is read in one repeatable-read snapshot.
 */
@ApplicationScoped
public class CorpusSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(CorpusSynchronizer.class);

    @Inject
    SchemaParityVerifier schemaParityVerifier;

    @Inject
    AnchorParityChecker anchorParityChecker;

    @Inject
    TargetStateGuard targetStateGuard;

    @Inject
    ReferentialGuard referentialGuard;

    @Inject
    RowCountService rowCountService;

    @Inject
    NodeTreeTransferService nodeTreeTransferService;

    @Inject
    LeafTransferService leafTransferService;

    @Inject
    SequenceResynchronizer sequenceResynchronizer;

    @Inject
    PostSyncValidator postSyncValidator;

    @FunctionalInterface
    interface Phase {
        CheckResult run() throws SQLException;
    }

    /**
     * Runs only the gates (schema, anchors, target state, references) and the row counts,
     * then rolls the destination back.
     */
    public CorpusSyncResult preflight(Connection source, Connection destination, SyncOptions options,
                                      Consumer<JobProgress> progressCallback) {
        return synchronize(source, destination, options.withDryRun(true), progressCallback);
    }

    /**
     * @throws SyncAbortedException after rollback, when any phase fails
     */
    public CorpusSyncResult synchronize(Connection source, Connection destination, SyncOptions options,
                                        Consumer<JobProgress> progressCallback) {
        CorpusSyncResult result = new CorpusSyncResult(options.getMode(), options.isDryRun());
        long startTime = System.currentTimeMillis();
        log.info("Starting corpus {} from LOCAL to PRODUCTION: {}", options.isDryRun() ? "preflight" : "sync", options);

        try {
            runPhase(SyncPhase.CONNECTION_SETUP, () -> {
                prepareConnections(source, destination);
                return CheckResult.passed();
            }, result, destination, progressCallback, startTime);

            for (Map.Entry<SyncPhase, Phase> entry : buildPhases(source, destination, options, result, progressCallback).entrySet()) {
                runPhase(entry.getKey(), entry.getValue(), result, destination, progressCallback, startTime);
            }

            result.setDurationMillis(System.currentTimeMillis() - startTime);
            report(progressCallback, SyncPhase.COMMIT.getStartPercentage() + 1,
                    options.isDryRun() ? "Preflight completed" : "Sync completed",
                    String.format("%d rows written in %d ms", result.getTotalRowsWritten(), result.getDurationMillis()));
            log.info("Corpus {} finished: {}", options.isDryRun() ? "preflight" : "sync", result);
            return result;

        } catch (SyncAbortedException e) {
            throw e;
        } catch (RuntimeException e) {
            SyncFailure failure = new SyncFailure(SyncErrorType.STORAGE_ERROR, currentPhase(result), List.of(),
                    "unexpected error: " + e.getMessage());
            throw abort(destination, result, failure, e, startTime);
        } finally {
            releaseSource(source);
        }
    }

    private Map<SyncPhase, Phase> buildPhases(Connection source, Connection destination, SyncOptions options,
                                              CorpusSyncResult result, Consumer<JobProgress> progressCallback) {
        Map<String, Long> sourceCounts = new LinkedHashMap<>();
        Map<SyncPhase, Phase> phases = new LinkedHashMap<>();

        phases.put(SyncPhase.SCHEMA_PARITY,
                () -> schemaParityVerifier.verify(source, destination, SyncTables.ALL_TABLES));

        phases.put(SyncPhase.ANCHOR_PARITY,
                () -> anchorParityChecker.check(source, destination, SyncTables.ANCHOR_TABLES));

        phases.put(SyncPhase.TARGET_STATE,
                () -> targetStateGuard.check(destination, SyncTables.DEPENDENT_TABLES, options.getMode()));

        phases.put(SyncPhase.SOURCE_COUNTS, () -> {
            sourceCounts.putAll(rowCountService.countRows(source, SyncTables.DEPENDENT_TABLES));
            sourceCounts.forEach(result::setSourceRowCount);
            rowCountService.countRows(destination, SyncTables.DEPENDENT_TABLES).forEach(result::setDestinationRowCount);
            log.info("Local counts: nodes={}, contentdata={}, embeddings={}",
                    sourceCounts.get(SyncTables.NODE), sourceCounts.get(SyncTables.CONTENT_DATA),
                    sourceCounts.get(SyncTables.EMBEDDING));
            return CheckResult.passed();
        });

        phases.put(SyncPhase.REFERENTIAL_INTEGRITY,
                () -> referentialGuard.check(source, destination));

        if (options.isDryRun()) {
            phases.put(SyncPhase.COMMIT, () -> {
                destination.rollback();
                log.info("Preflight only: destination transaction rolled back, nothing written");
                return CheckResult.passed();
            });
            return phases;
        }

        phases.put(SyncPhase.NODE_TRANSFER, () -> {
            TableShape shape = TableShapeExtractor.extractShape(destination, SyncTables.NODE);
            long total = sourceCounts.getOrDefault(SyncTables.NODE, 0L);
            long written = nodeTreeTransferService.transfer(source, destination, shape,
                    options.batchSizeFor(SyncTables.NODE),
                    soFar -> reportTransfer(progressCallback, SyncPhase.NODE_TRANSFER, SyncPhase.CONTENT_DATA_TRANSFER,
                            SyncTables.NODE, soFar, total));
            result.addRowsWritten(SyncTables.NODE, written);
            return CheckResult.passed();
        });

        phases.put(SyncPhase.CONTENT_DATA_TRANSFER,
                () -> transferLeaf(source, destination, SyncTables.CONTENT_DATA, options, sourceCounts, result,
                        progressCallback, SyncPhase.CONTENT_DATA_TRANSFER, SyncPhase.EMBEDDING_TRANSFER));

        phases.put(SyncPhase.EMBEDDING_TRANSFER,
                () -> transferLeaf(source, destination, SyncTables.EMBEDDING, options, sourceCounts, result,
                        progressCallback, SyncPhase.EMBEDDING_TRANSFER, SyncPhase.SEQUENCE_RESYNC));

        phases.put(SyncPhase.SEQUENCE_RESYNC, () -> {
            sequenceResynchronizer.resynchronize(destination, SyncTables.DEPENDENT_TABLES)
                    .forEach(result::setSequenceValue);
            return CheckResult.passed();
        });

        phases.put(SyncPhase.POST_SYNC_VALIDATION, () -> {
            Map<String, Long> destinationCounts = new LinkedHashMap<>();
            CheckResult validation = postSyncValidator.validate(destination, sourceCounts, destinationCounts);
            destinationCounts.forEach(result::setDestinationRowCount);
            return validation;
        });

        phases.put(SyncPhase.COMMIT, () -> {
            destination.commit();
            result.setCommitted(true);
            log.info("Destination transaction committed");
            return CheckResult.passed();
        });

        return phases;
    }

    private CheckResult transferLeaf(Connection source, Connection destination, String table, SyncOptions options,
                                     Map<String, Long> sourceCounts, CorpusSyncResult result,
                                     Consumer<JobProgress> progressCallback, SyncPhase phase, SyncPhase nextPhase)
            throws SQLException {
        TableShape shape = TableShapeExtractor.extractShape(destination, table);
        long total = sourceCounts.getOrDefault(table, 0L);
        long written = leafTransferService.transfer(source, destination, shape, options.batchSizeFor(table),
                options.getMode().usesUpsert(),
                soFar -> reportTransfer(progressCallback, phase, nextPhase, table, soFar, total));
        result.addRowsWritten(table, written);
        return CheckResult.passed();
    }

    private void runPhase(SyncPhase phase, Phase action, CorpusSyncResult result, Connection destination,
                          Consumer<JobProgress> progressCallback, long startTime) {
        report(progressCallback, phase.getStartPercentage(), phase.getLabel(), "Running " + phase.getLabel().toLowerCase());
        log.info("{}...", phase.getLabel());

        CheckResult outcome;
        SQLException cause = null;
        try {
            outcome = action.run();
        } catch (SQLException e) {
            cause = e;
            outcome = CheckResult.failed(storageFailure(phase, e));
        }

        if (outcome.getFailure().isPresent()) {
            throw abort(destination, result, outcome.getFailure().get(), cause, startTime);
        }

        result.addCompletedPhase(phase);
        log.debug("{} passed", phase.getLabel());
    }

    static SyncFailure storageFailure(SyncPhase phase, SQLException e) {
        String message = e.getMessage();
        if (e.getSQLState() != null) {
            message += " (SQLState " + e.getSQLState() + ")";
        }
        return new SyncFailure(SyncErrorType.STORAGE_ERROR, phase, tablesWrittenIn(phase), message);
    }

    static List<String> tablesWrittenIn(SyncPhase phase) {
        switch (phase) {
            case NODE_TRANSFER:
                return List.of(SyncTables.NODE);
            case CONTENT_DATA_TRANSFER:
                return List.of(SyncTables.CONTENT_DATA);
            case EMBEDDING_TRANSFER:
                return List.of(SyncTables.EMBEDDING);
            case SEQUENCE_RESYNC:
            case POST_SYNC_VALIDATION:
                return SyncTables.DEPENDENT_TABLES;
            default:
                return List.of();
        }
    }

    private SyncAbortedException abort(Connection destination, CorpusSyncResult result, SyncFailure failure,
                                       Throwable cause, long startTime) {
        result.setFailure(failure);
        result.setCommitted(false);
        result.setDurationMillis(System.currentTimeMillis() - startTime);

        SyncAbortedException exception = new SyncAbortedException(failure, result, cause);
        log.error("Corpus sync aborted: {}", failure.describe());

        try {
            destination.rollback();
            log.info("Destination transaction rolled back, production left unchanged");
        } catch (SQLException e) {
            log.error("Rollback of the destination transaction failed", e);
            exception.addSuppressed(e);
        }
        return exception;
    }

    private static SyncPhase currentPhase(CorpusSyncResult result) {
        List<SyncPhase> completed = result.getCompletedPhases();
        if (completed.isEmpty()) {
            return SyncPhase.CONNECTION_SETUP;
        }
        SyncPhase last = completed.get(completed.size() - 1);
        SyncPhase[] all = SyncPhase.values();
        return last.ordinal() + 1 < all.length ? all[last.ordinal() + 1] : last;
    }

    private void prepareConnections(Connection source, Connection destination) throws SQLException {
        source.setAutoCommit(false);
        source.setTransactionIsolation(Connection.TRANSACTION_REPEATABLE_READ);
        source.setReadOnly(true);

        destination.setAutoCommit(false);
        log.debug("Source is read-only/repeatable read, destination runs in a single transaction");
    }

    private void releaseSource(Connection source) {
        try {
            if (!source.isClosed() && !source.getAutoCommit()) {
                source.rollback();
            }
        } catch (SQLException e) {
            log.warn("Could not release the source snapshot: {}", e.getMessage(), e);
        }
    }

    private void reportTransfer(Consumer<JobProgress> progressCallback, SyncPhase phase, SyncPhase nextPhase,
                                String table, long written, long total) {
        int span = nextPhase.getStartPercentage() - phase.getStartPercentage();
        int percentage = phase.getStartPercentage() + (total > 0 ? (int) Math.min(span - 1, written * span / total) : 0);
        report(progressCallback, percentage, phase.getLabel(), String.format("%s: %,d of %,d rows", table, written, total));
    }

    private static void report(Consumer<JobProgress> progressCallback, int percentage, String task, String details) {
        if (progressCallback != null) {
            progressCallback.accept(new JobProgress(percentage, task, details));
        }
    }
}
