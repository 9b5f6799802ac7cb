package com.sqldumpextract;

/**
 * One reported incident. {@code table} is null when no table was active.
 */
public record ExtractionWarning(
        WarningKind kind,
        String table,
        long lineNumber,
        String message) {

    @Override
    public String toString() {
        return String.format("%s [%s] line %d: %s", kind, table == null ? "-" : table, lineNumber, message);
    }
}
