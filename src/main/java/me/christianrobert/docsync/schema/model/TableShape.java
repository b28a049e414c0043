package me.christianrobert.docsync.schema.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered column descriptors of one table on one endpoint.
 * An empty column list means the table does not exist there.
 */
public class TableShape {

    private final String tableName;
    private final List<ColumnDescriptor> columns;

    public TableShape(String tableName, List<ColumnDescriptor> columns) {
        this.tableName = tableName;
        this.columns = List.copyOf(columns);
    }

    public String getTableName() {
        return tableName;
    }

    public List<ColumnDescriptor> getColumns() {
        return columns;
    }

    public boolean exists() {
        return !columns.isEmpty();
    }

    /**
     * @return the columns a copy reads from the source and writes to the destination
     */
    public List<ColumnDescriptor> getCopyableColumns() {
        return columns.stream()
                .filter(column -> !column.isGenerated())
                .collect(Collectors.toList());
    }

    public Optional<ColumnDescriptor> findColumn(String columnName) {
        return columns.stream()
                .filter(column -> column.getColumnName().equals(columnName))
                .findFirst();
    }

    /**
     * Describes how this shape differs from another one, column by column.
     * A table missing on both sides is a difference too: there is nothing to sync into.
     *
     * @return human readable differences, empty if the shapes match
     */
    public List<String> describeDifferences(TableShape other) {
        List<String> differences = new ArrayList<>();

        if (!exists() && !other.exists()) {
            differences.add("table missing on both endpoints");
            return differences;
        }
        if (!exists() || !other.exists()) {
            differences.add(String.format("table exists: %s vs %s", exists(), other.exists()));
            return differences;
        }

        int max = Math.max(columns.size(), other.columns.size());
        for (int i = 0; i < max; i++) {
            ColumnDescriptor mine = i < columns.size() ? columns.get(i) : null;
            ColumnDescriptor theirs = i < other.columns.size() ? other.columns.get(i) : null;
            if (mine == null || theirs == null) {
                differences.add(String.format("position %d: %s vs %s", i + 1,
                        mine != null ? mine.getColumnName() : "<none>",
                        theirs != null ? theirs.getColumnName() : "<none>"));
            } else if (!mine.equals(theirs)) {
                differences.add(String.format("position %d: %s vs %s", i + 1, mine, theirs));
            }
        }
        return differences;
    }

    @Override
    public String toString() {
        return "TableShape{table='" + tableName + "', columns=" + columns.size() + "}";
    }
}
