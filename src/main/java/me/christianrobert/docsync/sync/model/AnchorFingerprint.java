package me.christianrobert.docsync.sync.model;

import java.util.List;
import java.util.Optional;

/**
 * Compact summary of an anchor table on one endpoint: row count, sorted ids and id range.
 * An empty table has min and max id 0.
 */
public class AnchorFingerprint {

    private final String tableName;
    private final long rowCount;
    private final List<Long> sortedIds;
    private final long minId;
    private final long maxId;

    public AnchorFingerprint(String tableName, long rowCount, List<Long> sortedIds, long minId, long maxId) {
        this.tableName = tableName;
        this.rowCount = rowCount;
        this.sortedIds = List.copyOf(sortedIds);
        this.minId = minId;
        this.maxId = maxId;
    }

    /**
     * Compares this (source) fingerprint with the destination one.
     * Checked in order: count, id-set, id-range; the first difference wins.
     *
     * @return the kind of discrepancy ("count", "id-set" or "id-range"), empty if they match
     */
    public Optional<String> discrepancyWith(AnchorFingerprint other) {
        if (rowCount != other.rowCount) {
            return Optional.of("count");
        }
        if (!sortedIds.equals(other.sortedIds)) {
            return Optional.of("id-set");
        }
        if (minId != other.minId || maxId != other.maxId) {
            return Optional.of("id-range");
        }
        return Optional.empty();
    }

    public String getTableName() { return tableName; }
    public long getRowCount() { return rowCount; }
    public List<Long> getSortedIds() { return sortedIds; }
    public long getMinId() { return minId; }
    public long getMaxId() { return maxId; }

    /**
     * @return count and range without the (possibly long) id list
     */
    public String summary() {
        return String.format("count=%d, ids=[%d..%d]", rowCount, minId, maxId);
    }

    @Override
    public String toString() {
        return "AnchorFingerprint{table='" + tableName + "', " + summary() + "}";
    }
}
