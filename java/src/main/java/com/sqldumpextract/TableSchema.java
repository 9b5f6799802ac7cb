package com.sqldumpextract;

import java.util.List;

/**
 * Name and ordered column names of one dumped table. Column types are not
 * modeled.
 */
public record TableSchema(
        String name,
        List<String> columns) {

    public TableSchema {
        columns = List.copyOf(columns);
    }

    public int columnCount() {
        return columns.size();
    }

    public int indexOf(String column) {
        return columns.indexOf(column);
    }
}
