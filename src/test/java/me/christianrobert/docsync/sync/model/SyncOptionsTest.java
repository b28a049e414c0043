package me.christianrobert.docsync.sync.model;

import me.christianrobert.docsync.config.service.ConfigService;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SyncOptionsTest {

    @Test
    void defaultsComeFromConfiguration() {
        SyncOptions options = SyncOptions.fromConfig(new ConfigService(), false);

        assertEquals(2000, options.getBatchSize());
        assertEquals(50, options.getEmbeddingBatchSize());
        assertEquals(SyncMode.STRICT, options.getMode());
        assertFalse(options.isDryRun());
    }

    @Test
    void embeddingsUseTheirOwnBatchSize() {
        SyncOptions options = new SyncOptions(500, 20, SyncMode.RESUME, false);

        assertEquals(500, options.batchSizeFor(SyncTables.NODE));
        assertEquals(500, options.batchSizeFor(SyncTables.CONTENT_DATA));
        assertEquals(20, options.batchSizeFor(SyncTables.EMBEDDING));
    }

    @Test
    void stringValuesFromRestAreAccepted() {
        ConfigService configService = new ConfigService();
        configService.setConfigValue("sync.batch-size", "100");
        configService.setConfigValue("sync.mode", "resume");

        SyncOptions options = SyncOptions.fromConfig(configService, true);

        assertEquals(100, options.getBatchSize());
        assertEquals(SyncMode.RESUME, options.getMode());
        assertTrue(options.getMode().usesUpsert());
        assertTrue(options.isDryRun());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SyncOptions(0, 50, SyncMode.STRICT, false));
        assertThrows(IllegalArgumentException.class, () -> new SyncOptions(10, -1, SyncMode.STRICT, false));

        ConfigService configService = new ConfigService();
        configService.setConfigValue("sync.mode", "MERGE");
        assertThrows(IllegalArgumentException.class, () -> SyncOptions.fromConfig(configService, false));

        configService.resetToDefaults();
        configService.setConfigValue("sync.embedding-batch-size", "many");
        assertThrows(IllegalArgumentException.class, () -> SyncOptions.fromConfig(configService, false));
    }

    @Test
    void dryRunCopyKeepsTunables() {
        SyncOptions options = new SyncOptions(300, 30, SyncMode.RESUME, false).withDryRun(true);

        assertTrue(options.isDryRun());
        assertEquals(300, options.getBatchSize());
        assertEquals(30, options.getEmbeddingBatchSize());
        assertEquals(SyncMode.RESUME, options.getMode());
    }
}
