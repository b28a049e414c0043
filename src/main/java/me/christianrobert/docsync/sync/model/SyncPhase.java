package me.christianrobert.docsync.sync.model;

/**
 * Phases of a sync run in execution order.
 */
public enum SyncPhase {

    CONNECTION_SETUP("Connection setup", 5),
    SCHEMA_PARITY("Schema parity check", 10),
    ANCHOR_PARITY("Publication/document parity check", 20),
    TARGET_STATE("Target state check", 25),
    SOURCE_COUNTS("Source row counting", 28),
    REFERENTIAL_INTEGRITY("Document reference check", 30),
    NODE_TRANSFER("Node transfer", 35),
    CONTENT_DATA_TRANSFER("Content data transfer", 60),
    EMBEDDING_TRANSFER("Embedding transfer", 70),
    SEQUENCE_RESYNC("Sequence resynchronization", 90),
    POST_SYNC_VALIDATION("Post-sync validation", 93),
    COMMIT("Commit", 96);

    private final String label;
    private final int startPercentage;

    SyncPhase(String label, int startPercentage) {
        this.label = label;
        this.startPercentage = startPercentage;
    }

    public String getLabel() {
        return label;
    }

    public int getStartPercentage() {
        return startPercentage;
    }
}
