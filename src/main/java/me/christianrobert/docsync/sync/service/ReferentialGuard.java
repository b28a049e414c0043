package me.christianrobert.docsync.sync.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.docsync.sync.model.CheckResult;
import me.christianrobert.docsync.sync.model.SyncErrorType;
import me.christianrobert.docsync.sync.model.SyncFailure;
import me.christianrobert.docsync.sync.model.SyncPhase;
import me.christianrobert.docsync.sync.model.SyncTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks, before any node is written, that the source node set can be inserted at the destination:
 * every referenced document exists there and every node hangs below a root.
 */
@ApplicationScoped
public class ReferentialGuard {

    private static final Logger log = LoggerFactory.getLogger(ReferentialGuard.class);

    private static final String DOCUMENT_IDS_SQL =
            "SELECT DISTINCT document_id FROM public.node WHERE document_id IS NOT NULL";

    private static final String EXISTING_DOCUMENTS_SQL =
            "SELECT id FROM public.document WHERE id = ANY(?)";

    private static final String UNREACHABLE_NODES_SQL = """
            WITH RECURSIVE node_tree AS (
                SELECT n.id
                FROM public.node n
                WHERE n.parent_id IS NULL
                UNION ALL
                SELECT n.id
                FROM public.node n
                JOIN node_tree nt ON n.parent_id = nt.id
            )
            SELECT n.id
            FROM public.node n
            WHERE NOT EXISTS (SELECT 1 FROM node_tree nt WHERE nt.id = n.id)
            ORDER BY n.id
            """;

    public CheckResult check(Connection source, Connection destination) throws SQLException {
        List<Long> documentIds = fetchReferencedDocumentIds(source);
        log.info("Verifying {} distinct document ids exist on production", documentIds.size());

        List<Long> missing = findMissingDocumentIds(destination, documentIds);
        if (!missing.isEmpty()) {
            return CheckResult.failed(new SyncFailure(
                    SyncErrorType.DANGLING_REFERENCE, SyncPhase.REFERENTIAL_INTEGRITY,
                    List.of(SyncTables.NODE, SyncTables.DOCUMENT),
                    String.format("%d document ids referenced by local nodes are missing in production. Example: %s",
                            missing.size(), SyncFailure.sample(missing)),
                    missing));
        }

        List<Long> unreachable = findUnreachableNodeIds(source);
        if (!unreachable.isEmpty()) {
            return CheckResult.failed(new SyncFailure(
                    SyncErrorType.DANGLING_REFERENCE, SyncPhase.REFERENTIAL_INTEGRITY,
                    List.of(SyncTables.NODE),
                    String.format("%d local nodes are not reachable from any root node via parent_id. Example: %s",
                            unreachable.size(), SyncFailure.sample(unreachable)),
                    unreachable));
        }

        log.info("Document id parity check passed");
        return CheckResult.passed();
    }

    List<Long> fetchReferencedDocumentIds(Connection source) throws SQLException {
        List<Long> ids = new ArrayList<>();
        try (PreparedStatement ps = source.prepareStatement(DOCUMENT_IDS_SQL);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getLong(1));
            }
        }
        return ids;
    }

    /**
     * @return the ids absent from the destination document table, sorted ascending
     */
    List<Long> findMissingDocumentIds(Connection destination, List<Long> documentIds) throws SQLException {
        if (documentIds.isEmpty()) {
            return List.of();
        }

        Set<Long> present = new HashSet<>();
        Array idArray = destination.createArrayOf("bigint", documentIds.toArray());
        try (PreparedStatement ps = destination.prepareStatement(EXISTING_DOCUMENTS_SQL)) {
            ps.setArray(1, idArray);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    present.add(rs.getLong(1));
                }
            }
        } finally {
            idArray.free();
        }

        Set<Long> missing = new TreeSet<>(documentIds);
        missing.removeAll(present);
        return new ArrayList<>(missing);
    }

    List<Long> findUnreachableNodeIds(Connection source) throws SQLException {
        List<Long> ids = new ArrayList<>();
        try (PreparedStatement ps = source.prepareStatement(UNREACHABLE_NODES_SQL);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getLong(1));
            }
        }
        return ids;
    }
}
