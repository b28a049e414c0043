package me.christianrobert.docsync.transfer.service;

import me.christianrobert.docsync.schema.model.ColumnDescriptor;
import me.christianrobert.docsync.sync.model.SyncTables;
import me.christianrobert.docsync.transfer.model.TableWritePlan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the SQL used to read rows from the source and write them to the destination.
 * <p>
 * Values travel as text: every column is selected as {@code col::text} and bound back with
 * {@code CAST(? AS <destination type>)}, so enum, jsonb, array and vector columns keep their exact value.
 */
public final class UpsertStatementBuilder {

    private UpsertStatementBuilder() {
    }

    /**
     * @param alias table alias to prefix columns with, or null
     */
    public static String buildSelectList(List<ColumnDescriptor> columns, String alias) {
        String prefix = alias != null ? alias + "." : "";
        return columns.stream()
                .map(column -> prefix + SqlIdentifiers.quote(column.getColumnName()) + "::text")
                .collect(Collectors.joining(", "));
    }

    /**
     * Source query for leaf tables: all rows in id order.
     */
    public static String buildOrderedSelect(TableWritePlan plan) {
        return "SELECT " + buildSelectList(plan.getColumns(), null) +
                " FROM " + SqlIdentifiers.qualify(plan.getTableName()) +
                " ORDER BY " + SqlIdentifiers.quote(SyncTables.PRIMARY_KEY) + " ASC";
    }

    /**
     * Source query for nodes in parent-first order.
     * Walks down from the roots tagging each node with its depth and sorts by
     * (depth, sequence_in_parent, id); a child is always deeper than its parent, so it comes later.
     */
    public static String buildNodeTreeSelect(TableWritePlan plan) {
        return "WITH RECURSIVE node_tree AS (\n" +
                "    SELECT n.id, 1 AS depth\n" +
                "    FROM public.node n\n" +
                "    WHERE n.parent_id IS NULL\n" +
                "    UNION ALL\n" +
                "    SELECT n.id, nt.depth + 1\n" +
                "    FROM public.node n\n" +
                "    JOIN node_tree nt ON n.parent_id = nt.id\n" +
                ")\n" +
                "SELECT " + buildSelectList(plan.getColumns(), "n") + "\n" +
                "FROM public.node n\n" +
                "JOIN node_tree nt ON n.id = nt.id\n" +
                "ORDER BY nt.depth ASC, n.sequence_in_parent ASC, n.id ASC";
    }

    /**
     * Multi-row insert for {@code rowCount} rows.
     * Upsert plans add {@code ON CONFLICT ("id") DO UPDATE} overwriting every non-key column.
     */
    public static String buildInsert(TableWritePlan plan, int rowCount) {
        if (rowCount < 1) {
            throw new IllegalArgumentException("rowCount must be positive: " + rowCount);
        }

        StringBuilder sql = new StringBuilder();
        sql.append("INSERT INTO ").append(SqlIdentifiers.qualify(plan.getTableName()))
                .append(" (").append(SqlIdentifiers.quoteAll(plan.getColumnNames())).append(")");

        if (plan.isOverridingSystemValue()) {
            sql.append(" OVERRIDING SYSTEM VALUE");
        }

        String rowPlaceholders = plan.getColumns().stream()
                .map(column -> "CAST(? AS " + column.getDataType() + ")")
                .collect(Collectors.joining(", ", "(", ")"));

        sql.append(" VALUES ");
        for (int i = 0; i < rowCount; i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(rowPlaceholders);
        }

        if (plan.isUpsert()) {
            sql.append(buildConflictClause(plan));
        }
        return sql.toString();
    }

    static String buildConflictClause(TableWritePlan plan) {
        String key = SqlIdentifiers.quote(SyncTables.PRIMARY_KEY);
        List<String> updates = plan.getColumnNames().stream()
                .filter(name -> !SyncTables.PRIMARY_KEY.equals(name))
                .map(name -> SqlIdentifiers.quote(name) + " = EXCLUDED." + SqlIdentifiers.quote(name))
                .collect(Collectors.toList());

        if (updates.isEmpty()) {
            return " ON CONFLICT (" + key + ") DO NOTHING";
        }
        return " ON CONFLICT (" + key + ") DO UPDATE SET " + String.join(", ", updates);
    }
}
