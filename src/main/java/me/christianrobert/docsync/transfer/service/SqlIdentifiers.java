package me.christianrobert.docsync.transfer.service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Quoting helpers for identifiers that are interpolated into generated SQL.
 * All corpus tables live in schema {@code public}.
 */
public final class SqlIdentifiers {

    public static final String SCHEMA = "public";

    private SqlIdentifiers() {
    }

    public static String quote(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier must not be empty");
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public static String qualify(String tableName) {
        return quote(SCHEMA) + "." + quote(tableName);
    }

    public static String quoteAll(List<String> identifiers) {
        return identifiers.stream()
                .map(SqlIdentifiers::quote)
                .collect(Collectors.joining(", "));
    }
}
