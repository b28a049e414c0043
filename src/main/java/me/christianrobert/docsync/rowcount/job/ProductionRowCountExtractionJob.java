package me.christianrobert.docsync.rowcount.job;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.docsync.database.model.DatabaseEndpoint;
import me.christianrobert.docsync.rowcount.model.RowCountMetadata;

import java.util.List;

@Dependent
public class ProductionRowCountExtractionJob extends AbstractRowCountExtractionJob {

    @Override
    protected DatabaseEndpoint getEndpoint() {
        return DatabaseEndpoint.PRODUCTION;
    }

    @Override
    protected void saveResultsToState(List<RowCountMetadata> results) {
        stateService.setProductionRowCountMetadata(results);
    }
}
