package me.christianrobert.docsync.schema.service;

import me.christianrobert.docsync.schema.model.ColumnDescriptor;
import me.christianrobert.docsync.schema.model.TableShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads column shapes of tables in schema {@code public} from the PostgreSQL catalog.
 * Columns come back in physical order; dropped columns are left out.
 */
public class TableShapeExtractor {

    private static final Logger log = LoggerFactory.getLogger(TableShapeExtractor.class);

    private static final String COLUMN_SQL = """
            SELECT a.attname AS column_name,
                   pg_catalog.format_type(a.atttypid, a.atttypmod) AS data_type,
                   NOT a.attnotnull AS nullable,
                   pg_catalog.pg_get_expr(d.adbin, d.adrelid) AS column_default,
                   a.attidentity AS identity,
                   a.attgenerated AS generated
            FROM pg_catalog.pg_attribute a
            JOIN pg_catalog.pg_class c ON c.oid = a.attrelid
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            LEFT JOIN pg_catalog.pg_attrdef d ON d.adrelid = a.attrelid AND d.adnum = a.attnum
            WHERE n.nspname = 'public'
              AND c.relname = ?
              AND c.relkind = 'r'
              AND a.attnum > 0
              AND NOT a.attisdropped
            ORDER BY a.attnum
            """;

    public static Map<String, TableShape> extractShapes(Connection connection, List<String> tableNames) throws SQLException {
        Map<String, TableShape> shapes = new LinkedHashMap<>();
        for (String tableName : tableNames) {
            shapes.put(tableName, extractShape(connection, tableName));
        }
        return shapes;
    }

    public static TableShape extractShape(Connection connection, String tableName) throws SQLException {
        List<ColumnDescriptor> columns = new ArrayList<>();

        try (PreparedStatement ps = connection.prepareStatement(COLUMN_SQL)) {
            ps.setString(1, tableName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    columns.add(new ColumnDescriptor(
                            rs.getString("column_name"),
                            rs.getString("data_type"),
                            rs.getBoolean("nullable"),
                            rs.getString("column_default"),
                            rs.getString("identity"),
                            rs.getString("generated")));
                }
            }
        }

        if (columns.isEmpty()) {
            log.warn("Table public.{} not found", tableName);
        } else {
            log.debug("Extracted {} columns for table public.{}", columns.size(), tableName);
        }
        return new TableShape(tableName, columns);
    }
}
