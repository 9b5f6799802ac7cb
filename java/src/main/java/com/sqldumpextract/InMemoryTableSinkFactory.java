package com.sqldumpextract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps every extracted table in memory, keyed by table name in discovery
 * order. Meant for small dumps and tests; rows may contain nulls.
 */
public class InMemoryTableSinkFactory implements TableSinkFactory {

    /**
     * Header and rows captured for one table.
     */
    public record TableData(
            TableSchema schema,
            List<List<String>> rows) {
    }

    private final Map<String, TableData> tables = new LinkedHashMap<>();

    @Override
    public TableSink open(TableSchema schema) {
        List<List<String>> rows = new ArrayList<>();
        tables.remove(schema.name());
        tables.put(schema.name(), new TableData(schema, Collections.unmodifiableList(rows)));
        return new TableSink() {
            @Override
            public void writeHeader(List<String> columns) {
                // the schema already carries the header
            }

            @Override
            public void writeRow(List<String> values) {
                rows.add(Collections.unmodifiableList(new ArrayList<>(values)));
            }

            @Override
            public void close() {
            }
        };
    }

    public Map<String, TableData> tables() {
        return Collections.unmodifiableMap(tables);
    }

    public TableData table(String name) {
        return tables.get(name);
    }
}
