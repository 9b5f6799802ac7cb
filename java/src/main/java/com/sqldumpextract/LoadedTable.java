package com.sqldumpextract;

import java.util.List;

/**
 * A table read back from an extraction output file.
 *
 * @param skippedRows rows dropped because their width differs from the header
 */
public record LoadedTable(
        String name,
        List<String> columns,
        List<List<String>> rows,
        long skippedRows) {

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }
}
