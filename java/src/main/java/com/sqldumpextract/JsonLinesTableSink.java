package com.sqldumpextract;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Writes one table as JSON lines: a {@code {"columns": [...]}} line, then one
 * object per row mapping column name to value, with JSON {@code null} for SQL
 * NULL. When a column name repeats, the later value wins in that row's object.
 */
public class JsonLinesTableSink implements TableSink {
    private static final Gson gson = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    private final BufferedWriter writer;
    private List<String> columns;

    public JsonLinesTableSink(Path file) throws IOException {
        this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
    }

    public static TableSinkFactory factory(Path outputDir) {
        return schema -> {
            Files.createDirectories(outputDir);
            return new JsonLinesTableSink(outputDir.resolve(OutputFormat.fileName(schema.name(), OutputFormat.JSONL)));
        };
    }

    @Override
    public void writeHeader(List<String> columns) throws IOException {
        this.columns = List.copyOf(columns);
        writer.write(gson.toJson(Map.of("columns", this.columns)));
        writer.newLine();
    }

    @Override
    public void writeRow(List<String> values) throws IOException {
        if (columns == null) {
            throw new IOException("header must be written before rows");
        }
        Map<String, String> data = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            data.put(columns.get(i), values.get(i));
        }
        writer.write(gson.toJson(data));
        writer.newLine();
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
