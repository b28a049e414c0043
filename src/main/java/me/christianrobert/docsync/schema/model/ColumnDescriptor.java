package me.christianrobert.docsync.schema.model;

import java.util.Objects;

/**
 * Normalized shape of one column, as compared between the two endpoints.
 * This is a pure data model without dependencies on other services.
 */
public class ColumnDescriptor {

    /** Placeholder replacing sequence defaults so differently named sequences compare equal. */
    public static final String SEQUENCE_DEFAULT_PLACEHOLDER = "nextval(...)";

    private final String columnName;
    private final String dataType;      // pg_catalog.format_type(), e.g. "character varying(255)"
    private final boolean nullable;
    private final String defaultValue;  // normalized, null if none
    private final String identity;      // "a" (always), "d" (by default) or ""
    private final String generated;     // "s" (stored generated column) or ""

    public ColumnDescriptor(String columnName, String dataType, boolean nullable, String defaultValue,
                            String identity, String generated) {
        this.columnName = columnName;
        this.dataType = dataType;
        this.nullable = nullable;
        this.defaultValue = normalizeDefault(defaultValue);
        this.identity = identity != null ? identity : "";
        this.generated = generated != null ? generated : "";
    }

    /**
     * Replaces any default that draws from a sequence with {@link #SEQUENCE_DEFAULT_PLACEHOLDER}
     * and trims the rest. Blank defaults become null.
     */
    public static String normalizeDefault(String defaultValue) {
        if (defaultValue == null) {
            return null;
        }
        String trimmed = defaultValue.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.contains("nextval(")) {
            return SEQUENCE_DEFAULT_PLACEHOLDER;
        }
        return trimmed;
    }

    public String getColumnName() { return columnName; }
    public String getDataType() { return dataType; }
    public boolean isNullable() { return nullable; }
    public String getDefaultValue() { return defaultValue; }
    public String getIdentity() { return identity; }
    public String getGenerated() { return generated; }

    public boolean isIdentityAlways() {
        return "a".equals(identity);
    }

    /**
     * Generated columns are computed by the destination and can be neither read for copying nor written.
     */
    public boolean isGenerated() {
        return !generated.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnDescriptor)) return false;
        ColumnDescriptor that = (ColumnDescriptor) o;
        return nullable == that.nullable &&
                Objects.equals(columnName, that.columnName) &&
                Objects.equals(dataType, that.dataType) &&
                Objects.equals(defaultValue, that.defaultValue) &&
                identity.equals(that.identity) &&
                generated.equals(that.generated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnName, dataType, nullable, defaultValue, identity, generated);
    }

    @Override
    public String toString() {
        return "ColumnDescriptor{name='" + columnName + "', type='" + dataType + "', nullable=" + nullable +
                ", default='" + defaultValue + "', identity='" + identity + "', generated='" + generated + "'}";
    }
}
