package me.christianrobert.docsync.rowcount.model;

/**
 * Row count of one corpus table on one endpoint.
 * A count of -1 means the table could not be counted.
 */
public class RowCountMetadata {
    private final String endpoint;
    private final String tableName;
    private final long rowCount;
    private final long extractionTimestamp;

    public RowCountMetadata(String endpoint, String tableName, long rowCount, long extractionTimestamp) {
        this.endpoint = endpoint;
        this.tableName = tableName;
        this.rowCount = rowCount;
        this.extractionTimestamp = extractionTimestamp;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getTableName() {
        return tableName;
    }

    public long getRowCount() {
        return rowCount;
    }

    public long getExtractionTimestamp() {
        return extractionTimestamp;
    }

    public boolean isError() {
        return rowCount < 0;
    }

    @Override
    public String toString() {
        return "RowCountMetadata{" +
                "endpoint='" + endpoint + '\'' +
                ", tableName='" + tableName + '\'' +
                ", rowCount=" + rowCount +
                ", extractionTimestamp=" + extractionTimestamp +
                '}';
    }
}
