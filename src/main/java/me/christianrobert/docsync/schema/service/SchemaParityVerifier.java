package me.christianrobert.docsync.schema.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.docsync.schema.model.TableShape;
import me.christianrobert.docsync.sync.model.CheckResult;
import me.christianrobert.docsync.sync.model.SyncErrorType;
import me.christianrobert.docsync.sync.model.SyncFailure;
import me.christianrobert.docsync.sync.model.SyncPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compares the column shapes of the synchronized tables between source and destination.
 * Reads the catalog only.
 */
@ApplicationScoped
public class SchemaParityVerifier {

    private static final Logger log = LoggerFactory.getLogger(SchemaParityVerifier.class);

    /**
     * Verifies that every table has the same ordered column descriptors on both sides.
     *
     * @return passed, or a SCHEMA_MISMATCH failure naming every mismatching table
     */
    public CheckResult verify(Connection source, Connection destination, List<String> tableNames) throws SQLException {
        Map<String, TableShape> sourceShapes = TableShapeExtractor.extractShapes(source, tableNames);
        Map<String, TableShape> destinationShapes = TableShapeExtractor.extractShapes(destination, tableNames);
        return compare(sourceShapes, destinationShapes, tableNames);
    }

    CheckResult compare(Map<String, TableShape> sourceShapes, Map<String, TableShape> destinationShapes,
                        List<String> tableNames) {
        List<String> mismatchingTables = new ArrayList<>();
        List<String> details = new ArrayList<>();

        for (String tableName : tableNames) {
            TableShape sourceShape = sourceShapes.get(tableName);
            TableShape destinationShape = destinationShapes.get(tableName);

            List<String> differences = sourceShape.describeDifferences(destinationShape);
            if (!differences.isEmpty()) {
                mismatchingTables.add(tableName);
                details.add(tableName + " (" + String.join("; ", differences) + ")");
                log.warn("Column shape of table {} differs between source and destination: {}", tableName, differences);
            } else {
                log.debug("Table {} has matching shape ({} columns)", tableName, sourceShape.getColumns().size());
            }
        }

        if (mismatchingTables.isEmpty()) {
            log.info("Schema parity verified for {} tables", tableNames.size());
            return CheckResult.passed();
        }

        return CheckResult.failed(new SyncFailure(
                SyncErrorType.SCHEMA_MISMATCH,
                SyncPhase.SCHEMA_PARITY,
                mismatchingTables,
                "column definitions differ for tables " + mismatchingTables + ": " + String.join(", ", details)));
    }
}
