package me.christianrobert.docsync.sync.model;

import java.util.List;

/**
 * Names of the corpus tables handled by the synchronizer (schema {@code public}).
 */
public final class SyncTables {

    public static final String PUBLICATION = "publication";
    public static final String DOCUMENT = "document";
    public static final String NODE = "node";
    public static final String CONTENT_DATA = "contentdata";
    public static final String EMBEDDING = "embedding";

    public static final String PRIMARY_KEY = "id";

    /** Verified only, never written. */
    public static final List<String> ANCHOR_TABLES = List.of(PUBLICATION, DOCUMENT);

    /** Written at the destination, in this order. */
    public static final List<String> DEPENDENT_TABLES = List.of(NODE, CONTENT_DATA, EMBEDDING);

    public static final List<String> ALL_TABLES = List.of(PUBLICATION, DOCUMENT, NODE, CONTENT_DATA, EMBEDDING);

    private SyncTables() {
    }
}
