package me.christianrobert.docsync.integration;

import me.christianrobert.docsync.core.job.model.JobProgress;
import me.christianrobert.docsync.core.job.model.sync.CorpusSyncResult;
import me.christianrobert.docsync.rowcount.service.RowCountService;
import me.christianrobert.docsync.schema.service.SchemaParityVerifier;
import me.christianrobert.docsync.sequence.service.SequenceResynchronizer;
import me.christianrobert.docsync.sync.model.SyncMode;
import me.christianrobert.docsync.sync.model.SyncOptions;
import me.christianrobert.docsync.sync.service.AnchorParityChecker;
import me.christianrobert.docsync.sync.service.CorpusSynchronizer;
import me.christianrobert.docsync.sync.service.PostSyncValidator;
import me.christianrobert.docsync.sync.service.ReferentialGuard;
import me.christianrobert.docsync.sync.service.TargetStateGuard;
import me.christianrobert.docsync.transfer.service.BatchUpsertWriter;
import me.christianrobert.docsync.transfer.service.LeafTransferService;
import me.christianrobert.docsync.transfer.service.NodeTreeTransferService;
import me.christianrobert.docsync.transfer.service.SourceRowStreamer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.lang.reflect.Field;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Base class for end-to-end sync tests using Testcontainers.
 *
 * <p>One PostgreSQL container hosts two databases, {@code sync_local} and {@code sync_production},
 * standing in for the two endpoints. Both get the corpus schema before every test; each test seeds
 * its own rows and runs a fully wired {@link CorpusSynchronizer} over fresh connections.
 *
 * <p>The {@link #local} and {@link #production} connections stay in autocommit mode and are meant for
 * seeding and for asserting on committed state.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class CorpusSyncTestBase {

    protected static final String LOCAL_DB = "sync_local";
    protected static final String PRODUCTION_DB = "sync_production";

    @Container
    protected static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
        .withDatabaseName("testdb")
        .withUsername("test")
        .withPassword("test");

    /**
     * Corpus schema, identical on both endpoints unless a test alters it.
     */
    protected static final String CORPUS_DDL = """
        CREATE TYPE embeddingsource AS ENUM ('TEXT_CONTENT', 'DESCRIPTION', 'CAPTION');
        CREATE TABLE publication (
            id SERIAL PRIMARY KEY,
            title VARCHAR NOT NULL,
            abstract TEXT,
            citation JSONB,
            publication_date DATE,
            source_url VARCHAR
        );
        CREATE TABLE document (
            id SERIAL PRIMARY KEY,
            publication_id INTEGER NOT NULL REFERENCES publication(id),
            type VARCHAR,
            download_url VARCHAR,
            description TEXT
        );
        CREATE TABLE node (
            id SERIAL PRIMARY KEY,
            document_id INTEGER NOT NULL REFERENCES document(id),
            parent_id INTEGER REFERENCES node(id),
            tag_name VARCHAR NOT NULL,
            section_type VARCHAR,
            sequence_in_parent INTEGER NOT NULL DEFAULT 0,
            positional_data JSONB NOT NULL DEFAULT '[]',
            created_at TIMESTAMP NOT NULL DEFAULT now()
        );
        CREATE TABLE contentdata (
            id SERIAL PRIMARY KEY,
            node_id INTEGER NOT NULL UNIQUE REFERENCES node(id),
            text_content TEXT,
            storage_url VARCHAR,
            description TEXT,
            caption TEXT,
            embedding_source embeddingsource NOT NULL
        );
        CREATE TABLE embedding (
            id SERIAL PRIMARY KEY,
            content_data_id INTEGER NOT NULL REFERENCES contentdata(id),
            embedding_vector REAL[] NOT NULL,
            model_name VARCHAR NOT NULL,
            created_at TIMESTAMP NOT NULL DEFAULT now()
        )
        """;

    /** Connection to the source database, autocommit. */
    protected Connection local;

    /** Connection to the destination database, autocommit. */
    protected Connection production;

    protected CorpusSynchronizer synchronizer;

    protected List<JobProgress> progressUpdates;

    @BeforeAll
    static void startPostgres() throws SQLException {
        postgres.start();

        try (Connection admin = DriverManager.getConnection(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
             Statement stmt = admin.createStatement()) {
            for (String database : List.of(LOCAL_DB, PRODUCTION_DB)) {
                try (ResultSet rs = stmt.executeQuery("SELECT 1 FROM pg_database WHERE datname = '" + database + "'")) {
                    if (rs.next()) {
                        continue;
                    }
                }
                stmt.execute("CREATE DATABASE " + database);
            }
        }
    }

    @BeforeEach
    void setup() throws Exception {
        local = connect(LOCAL_DB);
        production = connect(PRODUCTION_DB);

        for (Connection connection : List.of(local, production)) {
            executeUpdate(connection, "DROP SCHEMA IF EXISTS public CASCADE");
            executeUpdate(connection, "CREATE SCHEMA public");
            executeBatch(connection, CORPUS_DDL);
        }

        synchronizer = createSynchronizer();
        progressUpdates = new ArrayList<>();
    }

    @AfterEach
    void cleanup() throws SQLException {
        for (Connection connection : new Connection[]{local, production}) {
            if (connection != null && !connection.isClosed()) {
                connection.close();
            }
        }
    }

    protected static Connection connect(String database) throws SQLException {
        String url = String.format("jdbc:postgresql://%s:%d/%s",
            postgres.getHost(), postgres.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT), database);
        return DriverManager.getConnection(url, postgres.getUsername(), postgres.getPassword());
    }

    /**
     * Wires the synchronizer the way the container would, injecting the package-private fields by reflection.
     */
    private static CorpusSynchronizer createSynchronizer() throws Exception {
        RowCountService rowCountService = new RowCountService();

        TargetStateGuard targetStateGuard = new TargetStateGuard();
        injectDependency(targetStateGuard, "rowCountService", rowCountService);

        PostSyncValidator postSyncValidator = new PostSyncValidator();
        injectDependency(postSyncValidator, "rowCountService", rowCountService);

        SourceRowStreamer sourceRowStreamer = new SourceRowStreamer();
        BatchUpsertWriter batchUpsertWriter = new BatchUpsertWriter();

        NodeTreeTransferService nodeTreeTransferService = new NodeTreeTransferService();
        injectDependency(nodeTreeTransferService, "sourceRowStreamer", sourceRowStreamer);
        injectDependency(nodeTreeTransferService, "batchUpsertWriter", batchUpsertWriter);

        LeafTransferService leafTransferService = new LeafTransferService();
        injectDependency(leafTransferService, "sourceRowStreamer", sourceRowStreamer);
        injectDependency(leafTransferService, "batchUpsertWriter", batchUpsertWriter);

        CorpusSynchronizer synchronizer = new CorpusSynchronizer();
        injectDependency(synchronizer, "schemaParityVerifier", new SchemaParityVerifier());
        injectDependency(synchronizer, "anchorParityChecker", new AnchorParityChecker());
        injectDependency(synchronizer, "targetStateGuard", targetStateGuard);
        injectDependency(synchronizer, "referentialGuard", new ReferentialGuard());
        injectDependency(synchronizer, "rowCountService", rowCountService);
        injectDependency(synchronizer, "nodeTreeTransferService", nodeTreeTransferService);
        injectDependency(synchronizer, "leafTransferService", leafTransferService);
        injectDependency(synchronizer, "sequenceResynchronizer", new SequenceResynchronizer());
        injectDependency(synchronizer, "postSyncValidator", postSyncValidator);
        return synchronizer;
    }

    private static void injectDependency(Object target, String fieldName, Object dependency) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, dependency);
    }

    // ========== Sync Helper Methods ==========

    protected static SyncOptions options(SyncMode mode, int batchSize) {
        return new SyncOptions(batchSize, batchSize, mode, false);
    }

    /**
     * Runs a sync over fresh connections, closed afterwards like the job does.
     */
    protected CorpusSyncResult runSync(SyncOptions options) throws SQLException {
        Consumer<JobProgress> callback = progressUpdates::add;
        try (Connection source = connect(LOCAL_DB);
             Connection destination = connect(PRODUCTION_DB)) {
            return options.isDryRun()
                ? synchronizer.preflight(source, destination, options, callback)
                : synchronizer.synchronize(source, destination, options, callback);
        }
    }

    // ========== Seeding Helper Methods ==========

    /**
     * Inserts publications 1-3 and documents 1-3.
     */
    protected void seedAnchors(Connection connection) throws SQLException {
        executeBatch(connection, """
            INSERT INTO publication (id, title, abstract, citation, publication_date, source_url) VALUES
                (1, 'Country Climate and Development Report: Ghana', 'Abstract A', '{"year": 2022}', '2022-10-01', 'https://example.org/1'),
                (2, 'Country Climate and Development Report: Peru', NULL, '{"year": 2023, "tags": ["water"]}', '2023-05-15', NULL),
                (3, 'Country Climate and Development Report: Nepal', 'Abstract C', NULL, NULL, 'https://example.org/3');
            INSERT INTO document (id, publication_id, type, download_url, description) VALUES
                (1, 1, 'MAIN', 'https://example.org/1.pdf', 'Main report'),
                (2, 2, 'MAIN', 'https://example.org/2.pdf', NULL),
                (3, 3, 'SUPPLEMENTAL', NULL, 'Annex')
            """);
    }

    /**
     * Seeds the local corpus: eight nodes over four levels whose ids do not follow the tree
     * (children often have lower ids than their parents), three contentdata rows and three embeddings.
     */
    protected void seedLocalCorpus() throws SQLException {
        executeBatch(local, """
            INSERT INTO node (id, document_id, parent_id, tag_name, section_type, sequence_in_parent, positional_data) VALUES
                (10, 1, NULL, 'section', 'MAIN', 0, '[{"page": 1}]'),
                (5, 2, NULL, 'section', 'MAIN', 0, '[]');
            INSERT INTO node (id, document_id, parent_id, tag_name, section_type, sequence_in_parent, positional_data) VALUES
                (7, 1, 10, 'section', 'CHAPTER', 1, '[]'),
                (3, 1, 10, 'section', 'CHAPTER', 0, '[]'),
                (4, 2, 5, 'p', NULL, 0, '[{"page": 2, "bbox": [1.5, 2, 3, 4]}]');
            INSERT INTO node (id, document_id, parent_id, tag_name, section_type, sequence_in_parent, positional_data) VALUES
                (1, 1, 3, 'section', 'SUBSECTION', 0, '[]'),
                (2, 1, 7, 'p', NULL, 0, '[]');
            INSERT INTO node (id, document_id, parent_id, tag_name, section_type, sequence_in_parent, positional_data) VALUES
                (12, 1, 1, 'p', NULL, 0, '[]');
            INSERT INTO contentdata (id, node_id, text_content, storage_url, description, caption, embedding_source) VALUES
                (1, 12, 'Emissions rose by 3% in ''22, mostly from transport', NULL, NULL, NULL, 'TEXT_CONTENT'),
                (2, 2, 'Résumé: água, 水, "quoted"', NULL, NULL, NULL, 'TEXT_CONTENT'),
                (3, 4, NULL, 'https://storage.example.org/fig1.png', 'Rainfall map', 'Figure 1', 'DESCRIPTION');
            INSERT INTO embedding (id, content_data_id, embedding_vector, model_name) VALUES
                (1, 1, '{0.125, -0.5, 1e-07}', 'text-embedding-3-small'),
                (2, 2, '{0.25, 0.75, -1}', 'text-embedding-3-small'),
                (3, 3, '{1, 2, 3}', 'text-embedding-3-small')
            """);
    }

    // ========== Database Helper Methods ==========

    protected static void executeUpdate(Connection connection, String sql) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        }
    }

    /**
     * Executes statements separated by semicolons; not for function bodies.
     */
    protected static void executeBatch(Connection connection, String sql) throws SQLException {
        for (String stmt : sql.split(";")) {
            String trimmed = stmt.trim();
            if (!trimmed.isEmpty()) {
                executeUpdate(connection, trimmed);
            }
        }
    }

    protected static long queryLong(Connection connection, String sql) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    protected static List<String> queryStrings(Connection connection, String sql) throws SQLException {
        List<String> values = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                values.add(rs.getString(1));
            }
        }
        return values;
    }

    protected static long count(Connection connection, String table) throws SQLException {
        return queryLong(connection, "SELECT COUNT(*) FROM public." + table);
    }
}
