package me.christianrobert.docsync.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.docsync.core.job.model.sync.CorpusSyncResult;
import me.christianrobert.docsync.rowcount.model.RowCountMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory application state filled by finished jobs and read by the REST layer.
 */
@ApplicationScoped
public class StateService {

    private static final Logger log = LoggerFactory.getLogger(StateService.class);

    List<RowCountMetadata> localRowCountMetadata = new ArrayList<>();
    List<RowCountMetadata> productionRowCountMetadata = new ArrayList<>();

    CorpusSyncResult lastPreflightResult;
    CorpusSyncResult lastSyncResult;

    public List<RowCountMetadata> getLocalRowCountMetadata() {
        return localRowCountMetadata;
    }

    public void setLocalRowCountMetadata(List<RowCountMetadata> localRowCountMetadata) {
        this.localRowCountMetadata = localRowCountMetadata;
    }

    public List<RowCountMetadata> getProductionRowCountMetadata() {
        return productionRowCountMetadata;
    }

    public void setProductionRowCountMetadata(List<RowCountMetadata> productionRowCountMetadata) {
        this.productionRowCountMetadata = productionRowCountMetadata;
    }

    public CorpusSyncResult getLastPreflightResult() {
        return lastPreflightResult;
    }

    public void setLastPreflightResult(CorpusSyncResult lastPreflightResult) {
        this.lastPreflightResult = lastPreflightResult;
    }

    public CorpusSyncResult getLastSyncResult() {
        return lastSyncResult;
    }

    public void setLastSyncResult(CorpusSyncResult lastSyncResult) {
        this.lastSyncResult = lastSyncResult;
    }

    public void resetState() {
        log.info("Resetting application state");
        localRowCountMetadata = new ArrayList<>();
        productionRowCountMetadata = new ArrayList<>();
        lastPreflightResult = null;
        lastSyncResult = null;
    }
}
