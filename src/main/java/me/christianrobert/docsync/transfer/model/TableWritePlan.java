package me.christianrobert.docsync.transfer.model;

import me.christianrobert.docsync.schema.model.ColumnDescriptor;
import me.christianrobert.docsync.schema.model.TableShape;
import me.christianrobert.docsync.sync.model.SyncTables;

import java.util.List;
import java.util.stream.Collectors;

/**
 * How rows of one table are written to the destination: which columns, plain insert or upsert on the
 * primary key, and whether explicit ids need {@code OVERRIDING SYSTEM VALUE}.
 */
public class TableWritePlan {

    private final String tableName;
    private final List<ColumnDescriptor> columns;
    private final boolean upsert;
    private final boolean overridingSystemValue;

    public TableWritePlan(String tableName, List<ColumnDescriptor> columns, boolean upsert, boolean overridingSystemValue) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("No writable columns for table " + tableName);
        }
        this.tableName = tableName;
        this.columns = List.copyOf(columns);
        this.upsert = upsert;
        this.overridingSystemValue = overridingSystemValue;
    }

    /**
     * Plan for a destination table shape: every non-generated column, in physical order.
     */
    public static TableWritePlan forShape(TableShape shape, boolean upsert) {
        boolean identityAlways = shape.findColumn(SyncTables.PRIMARY_KEY)
                .map(ColumnDescriptor::isIdentityAlways)
                .orElse(false);
        return new TableWritePlan(shape.getTableName(), shape.getCopyableColumns(), upsert, identityAlways);
    }

    public String getTableName() {
        return tableName;
    }

    public List<ColumnDescriptor> getColumns() {
        return columns;
    }

    public List<String> getColumnNames() {
        return columns.stream().map(ColumnDescriptor::getColumnName).collect(Collectors.toList());
    }

    public int getColumnCount() {
        return columns.size();
    }

    public boolean isUpsert() {
        return upsert;
    }

    public boolean isOverridingSystemValue() {
        return overridingSystemValue;
    }

    @Override
    public String toString() {
        return "TableWritePlan{table='" + tableName + "', columns=" + getColumnNames() +
                ", upsert=" + upsert + ", overridingSystemValue=" + overridingSystemValue + '}';
    }
}
