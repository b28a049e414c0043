package me.christianrobert.docsync.core.job.model.sync;

import me.christianrobert.docsync.sync.model.SyncFailure;
import me.christianrobert.docsync.sync.model.SyncMode;
import me.christianrobert.docsync.sync.model.SyncPhase;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a corpus sync (or preflight) run from LOCAL to PRODUCTION.
 * Tracks counts per table on both sides, rows written, sequence values and completed phases.
 */
public class CorpusSyncResult {

    private final SyncMode mode;
    private final boolean dryRun;
    private final LocalDateTime executionDateTime = LocalDateTime.now();
    private final Map<String, Long> sourceRowCounts = new LinkedHashMap<>();
    private final Map<String, Long> destinationRowCounts = new LinkedHashMap<>();
    private final Map<String, Long> rowsWritten = new LinkedHashMap<>();
    private final Map<String, Long> sequenceValues = new LinkedHashMap<>();
    private final List<SyncPhase> completedPhases = new ArrayList<>();
    private SyncFailure failure;
    private boolean committed;
    private long durationMillis;

    public CorpusSyncResult(SyncMode mode, boolean dryRun) {
        this.mode = mode;
        this.dryRun = dryRun;
    }

    public void addCompletedPhase(SyncPhase phase) {
        completedPhases.add(phase);
    }

    public void setSourceRowCount(String table, long count) {
        sourceRowCounts.put(table, count);
    }

    public void setDestinationRowCount(String table, long count) {
        destinationRowCounts.put(table, count);
    }

    public void addRowsWritten(String table, long rows) {
        rowsWritten.merge(table, rows, Long::sum);
    }

    public void setSequenceValue(String table, long value) {
        sequenceValues.put(table, value);
    }

    public void setFailure(SyncFailure failure) {
        this.failure = failure;
    }

    public void setCommitted(boolean committed) {
        this.committed = committed;
    }

    public void setDurationMillis(long durationMillis) {
        this.durationMillis = durationMillis;
    }

    public SyncMode getMode() {
        return mode;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public LocalDateTime getExecutionDateTime() {
        return executionDateTime;
    }

    public Map<String, Long> getSourceRowCounts() {
        return new LinkedHashMap<>(sourceRowCounts);
    }

    public Map<String, Long> getDestinationRowCounts() {
        return new LinkedHashMap<>(destinationRowCounts);
    }

    public Map<String, Long> getRowsWritten() {
        return new LinkedHashMap<>(rowsWritten);
    }

    public long getRowsWritten(String table) {
        return rowsWritten.getOrDefault(table, 0L);
    }

    public long getTotalRowsWritten() {
        return rowsWritten.values().stream().mapToLong(Long::longValue).sum();
    }

    public Map<String, Long> getSequenceValues() {
        return new LinkedHashMap<>(sequenceValues);
    }

    public List<SyncPhase> getCompletedPhases() {
        return new ArrayList<>(completedPhases);
    }

    public SyncFailure getFailure() {
        return failure;
    }

    public boolean isCommitted() {
        return committed;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public boolean isSuccessful() {
        return failure == null;
    }

    @Override
    public String toString() {
        return String.format("CorpusSyncResult{mode=%s, dryRun=%s, written=%s, committed=%s, successful=%s}",
                mode, dryRun, rowsWritten, committed, isSuccessful());
    }
}
