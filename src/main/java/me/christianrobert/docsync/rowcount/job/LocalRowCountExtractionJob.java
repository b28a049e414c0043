package me.christianrobert.docsync.rowcount.job;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.docsync.database.model.DatabaseEndpoint;
import me.christianrobert.docsync.rowcount.model.RowCountMetadata;

import java.util.List;

@Dependent
public class LocalRowCountExtractionJob extends AbstractRowCountExtractionJob {

    @Override
    protected DatabaseEndpoint getEndpoint() {
        return DatabaseEndpoint.LOCAL;
    }

    @Override
    protected void saveResultsToState(List<RowCountMetadata> results) {
        stateService.setLocalRowCountMetadata(results);
    }
}
