package me.christianrobert.docsync.sync.model;

/**
 * How the destination's dependent tables are treated.
 */
public enum SyncMode {

    /** Dependent tables must be empty; contentdata and embeddings are plain inserts. */
    STRICT,

    /** Pre-existing rows are tolerated; every write is an upsert on the primary key. */
    RESUME;

    public static SyncMode fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            return STRICT;
        }
        for (SyncMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown sync mode: " + name + " (expected STRICT or RESUME)");
    }

    public boolean usesUpsert() {
        return this == RESUME;
    }
}
