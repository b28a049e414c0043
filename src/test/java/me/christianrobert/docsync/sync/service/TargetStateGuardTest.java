package me.christianrobert.docsync.sync.service;

import me.christianrobert.docsync.rowcount.service.RowCountService;
import me.christianrobert.docsync.sync.model.CheckResult;
import me.christianrobert.docsync.sync.model.SyncErrorType;
import me.christianrobert.docsync.sync.model.SyncFailure;
import me.christianrobert.docsync.sync.model.SyncMode;
import me.christianrobert.docsync.sync.model.SyncTables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class TargetStateGuardTest {

    private RowCountService rowCountService;
    private Connection destination;
    private TargetStateGuard guard;

    @BeforeEach
    void setUp() {
        rowCountService = mock(RowCountService.class);
        destination = mock(Connection.class);
        guard = new TargetStateGuard();
        guard.rowCountService = rowCountService;
    }

    private static Map<String, Long> counts(long nodes, long contentData, long embeddings) {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put(SyncTables.NODE, nodes);
        counts.put(SyncTables.CONTENT_DATA, contentData);
        counts.put(SyncTables.EMBEDDING, embeddings);
        return counts;
    }

    @Test
    void emptyTargetPassesInStrictMode() throws Exception {
        when(rowCountService.countRows(destination, SyncTables.DEPENDENT_TABLES)).thenReturn(counts(0, 0, 0));

        assertTrue(guard.check(destination, SyncTables.DEPENDENT_TABLES, SyncMode.STRICT).isPassed());
    }

    @Test
    void nonEmptyTablesAreListedWithTheirCounts() throws Exception {
        when(rowCountService.countRows(destination, SyncTables.DEPENDENT_TABLES)).thenReturn(counts(12, 0, 3));

        CheckResult result = guard.check(destination, SyncTables.DEPENDENT_TABLES, SyncMode.STRICT);

        SyncFailure failure = result.getFailure().orElseThrow();
        assertEquals(SyncErrorType.NON_EMPTY_TARGET, failure.getType());
        assertEquals(List.of("node", "embedding"), failure.getTables());
        assertTrue(failure.getMessage().contains("node(12)"));
        assertTrue(failure.getMessage().contains("embedding(3)"));
        assertFalse(failure.getMessage().contains("contentdata"));
    }

    @Test
    void resumeModeSkipsCounting() throws Exception {
        CheckResult result = guard.check(destination, SyncTables.DEPENDENT_TABLES, SyncMode.RESUME);

        assertTrue(result.isPassed());
        verify(rowCountService, never()).countRows(any(Connection.class), anyList());
    }
}
