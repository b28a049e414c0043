package me.christianrobert.docsync.sync.model;

import me.christianrobert.docsync.config.service.ConfigService;

/**
 * Tunables of one sync run, read from the configuration when the run starts.
 */
public class SyncOptions {

    public static final int DEFAULT_BATCH_SIZE = 2000;
    public static final int DEFAULT_EMBEDDING_BATCH_SIZE = 50;

    private final int batchSize;
    private final int embeddingBatchSize;
    private final SyncMode mode;
    private final boolean dryRun;

    public SyncOptions(int batchSize, int embeddingBatchSize, SyncMode mode, boolean dryRun) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, was " + batchSize);
        }
        if (embeddingBatchSize <= 0) {
            throw new IllegalArgumentException("Embedding batch size must be positive, was " + embeddingBatchSize);
        }
        if (mode == null) {
            throw new IllegalArgumentException("Sync mode must be set");
        }
        this.batchSize = batchSize;
        this.embeddingBatchSize = embeddingBatchSize;
        this.mode = mode;
        this.dryRun = dryRun;
    }

    /**
     * Reads {@code sync.batch-size}, {@code sync.embedding-batch-size} and {@code sync.mode}.
     *
     * @throws IllegalArgumentException on non-numeric or non-positive sizes or an unknown mode
     */
    public static SyncOptions fromConfig(ConfigService configService, boolean dryRun) {
        Integer batchSize = configService.getConfigValueAsInteger("sync.batch-size");
        Integer embeddingBatchSize = configService.getConfigValueAsInteger("sync.embedding-batch-size");
        SyncMode mode = SyncMode.fromName(configService.getConfigValueAsString("sync.mode"));

        return new SyncOptions(
                batchSize != null ? batchSize : DEFAULT_BATCH_SIZE,
                embeddingBatchSize != null ? embeddingBatchSize : DEFAULT_EMBEDDING_BATCH_SIZE,
                mode,
                dryRun);
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getEmbeddingBatchSize() {
        return embeddingBatchSize;
    }

    public SyncMode getMode() {
        return mode;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public SyncOptions withDryRun(boolean dryRun) {
        return new SyncOptions(batchSize, embeddingBatchSize, mode, dryRun);
    }

    /**
     * @return the batch size used when streaming the given dependent table
     */
    public int batchSizeFor(String tableName) {
        return SyncTables.EMBEDDING.equals(tableName) ? embeddingBatchSize : batchSize;
    }

    @Override
    public String toString() {
        return "SyncOptions{mode=" + mode + ", batchSize=" + batchSize +
                ", embeddingBatchSize=" + embeddingBatchSize + ", dryRun=" + dryRun + '}';
    }
}
