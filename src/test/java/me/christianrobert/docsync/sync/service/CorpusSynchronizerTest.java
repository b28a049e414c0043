package me.christianrobert.docsync.sync.service;

import me.christianrobert.docsync.core.job.model.JobProgress;
import me.christianrobert.docsync.core.job.model.sync.CorpusSyncResult;
import me.christianrobert.docsync.rowcount.service.RowCountService;
import me.christianrobert.docsync.schema.service.SchemaParityVerifier;
import me.christianrobert.docsync.sequence.service.SequenceResynchronizer;
import me.christianrobert.docsync.sync.exception.SyncAbortedException;
import me.christianrobert.docsync.sync.model.CheckResult;
import me.christianrobert.docsync.sync.model.SyncErrorType;
import me.christianrobert.docsync.sync.model.SyncFailure;
import me.christianrobert.docsync.sync.model.SyncMode;
import me.christianrobert.docsync.sync.model.SyncOptions;
import me.christianrobert.docsync.sync.model.SyncPhase;
import me.christianrobert.docsync.sync.model.SyncTables;
import me.christianrobert.docsync.transfer.service.LeafTransferService;
import me.christianrobert.docsync.transfer.service.NodeTreeTransferService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Gate sequencing and rollback behaviour with mocked phases.
 * The write path against real databases is covered by the integration tests.
 */
class CorpusSynchronizerTest {

    private Connection source;
    private Connection destination;
    private CorpusSynchronizer synchronizer;
    private List<JobProgress> progressUpdates;

    @BeforeEach
    void setUp() throws Exception {
        source = mock(Connection.class);
        destination = mock(Connection.class);

        synchronizer = new CorpusSynchronizer();
        synchronizer.schemaParityVerifier = mock(SchemaParityVerifier.class);
        synchronizer.anchorParityChecker = mock(AnchorParityChecker.class);
        synchronizer.targetStateGuard = mock(TargetStateGuard.class);
        synchronizer.referentialGuard = mock(ReferentialGuard.class);
        synchronizer.rowCountService = mock(RowCountService.class);
        synchronizer.nodeTreeTransferService = mock(NodeTreeTransferService.class);
        synchronizer.leafTransferService = mock(LeafTransferService.class);
        synchronizer.sequenceResynchronizer = mock(SequenceResynchronizer.class);
        synchronizer.postSyncValidator = mock(PostSyncValidator.class);

        when(synchronizer.schemaParityVerifier.verify(any(), any(), anyList())).thenReturn(CheckResult.passed());
        when(synchronizer.anchorParityChecker.check(any(), any(), anyList())).thenReturn(CheckResult.passed());
        when(synchronizer.targetStateGuard.check(any(), anyList(), any())).thenReturn(CheckResult.passed());
        when(synchronizer.referentialGuard.check(any(), any())).thenReturn(CheckResult.passed());
        when(synchronizer.rowCountService.countRows(any(Connection.class), anyList()))
                .thenReturn(Map.of(SyncTables.NODE, 3L, SyncTables.CONTENT_DATA, 1L, SyncTables.EMBEDDING, 1L));

        progressUpdates = new ArrayList<>();
    }

    private static SyncOptions strict() {
        return new SyncOptions(100, 10, SyncMode.STRICT, false);
    }

    @Test
    void preflightRunsGatesAndRollsBack() throws Exception {
        CorpusSyncResult result = synchronizer.preflight(source, destination, strict(), progressUpdates::add);

        assertTrue(result.isSuccessful());
        assertTrue(result.isDryRun());
        assertFalse(result.isCommitted());
        assertEquals(List.of(SyncPhase.CONNECTION_SETUP, SyncPhase.SCHEMA_PARITY, SyncPhase.ANCHOR_PARITY,
                SyncPhase.TARGET_STATE, SyncPhase.SOURCE_COUNTS, SyncPhase.REFERENTIAL_INTEGRITY, SyncPhase.COMMIT),
                result.getCompletedPhases());
        assertEquals(3L, result.getSourceRowCounts().get(SyncTables.NODE));

        verify(destination).setAutoCommit(false);
        verify(source).setReadOnly(true);
        verify(source).setTransactionIsolation(Connection.TRANSACTION_REPEATABLE_READ);
        verify(destination).rollback();
        verify(destination, never()).commit();
        verifyNoInteractions(synchronizer.nodeTreeTransferService, synchronizer.leafTransferService,
                synchronizer.sequenceResynchronizer);
    }

    @Test
    void schemaMismatchStopsBeforeAnyOtherGate() throws Exception {
        SyncFailure failure = new SyncFailure(SyncErrorType.SCHEMA_MISMATCH, SyncPhase.SCHEMA_PARITY,
                List.of("embedding"), "column definitions differ for tables [embedding]");
        when(synchronizer.schemaParityVerifier.verify(any(), any(), anyList())).thenReturn(CheckResult.failed(failure));

        SyncAbortedException e = assertThrows(SyncAbortedException.class,
                () -> synchronizer.synchronize(source, destination, strict(), progressUpdates::add));

        assertSame(failure, e.getFailure());
        assertSame(failure, e.getResult().getFailure());
        assertFalse(e.getResult().isCommitted());
        verify(destination).rollback();
        verifyNoInteractions(synchronizer.anchorParityChecker, synchronizer.targetStateGuard,
                synchronizer.referentialGuard, synchronizer.nodeTreeTransferService);
    }

    @Test
    void gatesRunInOrder() throws Exception {
        SyncFailure failure = new SyncFailure(SyncErrorType.DANGLING_REFERENCE, SyncPhase.REFERENTIAL_INTEGRITY,
                List.of("node", "document"), "1 document ids referenced by local nodes are missing in production",
                List.of(99L));
        when(synchronizer.referentialGuard.check(any(), any())).thenReturn(CheckResult.failed(failure));

        assertThrows(SyncAbortedException.class,
                () -> synchronizer.synchronize(source, destination, strict(), progressUpdates::add));

        InOrder inOrder = inOrder(synchronizer.schemaParityVerifier, synchronizer.anchorParityChecker,
                synchronizer.targetStateGuard, synchronizer.referentialGuard);
        inOrder.verify(synchronizer.schemaParityVerifier).verify(source, destination, SyncTables.ALL_TABLES);
        inOrder.verify(synchronizer.anchorParityChecker).check(source, destination, SyncTables.ANCHOR_TABLES);
        inOrder.verify(synchronizer.targetStateGuard).check(destination, SyncTables.DEPENDENT_TABLES, SyncMode.STRICT);
        inOrder.verify(synchronizer.referentialGuard).check(source, destination);
        verifyNoInteractions(synchronizer.nodeTreeTransferService);
    }

    @Test
    void sqlErrorBecomesStorageFailure() throws Exception {
        when(synchronizer.anchorParityChecker.check(any(), any(), anyList()))
                .thenThrow(new SQLException("connection reset", "08006"));

        SyncAbortedException e = assertThrows(SyncAbortedException.class,
                () -> synchronizer.synchronize(source, destination, strict(), progressUpdates::add));

        assertEquals(SyncErrorType.STORAGE_ERROR, e.getFailure().getType());
        assertEquals(SyncPhase.ANCHOR_PARITY, e.getFailure().getPhase());
        assertEquals("connection reset (SQLState 08006)", e.getFailure().getMessage());
        assertInstanceOf(SQLException.class, e.getCause());
        verify(destination).rollback();
    }

    @Test
    void failedRollbackIsAttachedToTheAbort() throws Exception {
        SyncFailure failure = new SyncFailure(SyncErrorType.NON_EMPTY_TARGET, SyncPhase.TARGET_STATE,
                List.of("node"), "target database is not empty for: node(3)");
        when(synchronizer.targetStateGuard.check(any(), anyList(), any())).thenReturn(CheckResult.failed(failure));
        doThrow(new SQLException("connection closed")).when(destination).rollback();

        SyncAbortedException e = assertThrows(SyncAbortedException.class,
                () -> synchronizer.synchronize(source, destination, strict(), progressUpdates::add));

        assertEquals(1, e.getSuppressed().length);
        assertEquals("connection closed", e.getSuppressed()[0].getMessage());
    }

    @Test
    void storageFailuresNameTheTablesBeingWritten() {
        assertEquals(List.of("embedding"), CorpusSynchronizer.tablesWrittenIn(SyncPhase.EMBEDDING_TRANSFER));
        assertEquals(SyncTables.DEPENDENT_TABLES, CorpusSynchronizer.tablesWrittenIn(SyncPhase.SEQUENCE_RESYNC));
        assertEquals(List.of(), CorpusSynchronizer.tablesWrittenIn(SyncPhase.SCHEMA_PARITY));
    }
}
