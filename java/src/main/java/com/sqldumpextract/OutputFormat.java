package com.sqldumpextract;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Output formats selectable from the command line and profiles.
 */
public enum OutputFormat {
    CSV(".csv"),
    JSONL(".jsonl"),
    BIN(".bin"),
    SQLITE(".db");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Sink factory writing to {@code output}: a directory of per-table files,
     * or the database file for {@link #SQLITE}.
     */
    public TableSinkFactory createFactory(Path output, SqliteProfile sqliteProfile) {
        switch (this) {
            case JSONL:
                return JsonLinesTableSink.factory(output);
            case BIN:
                return BinaryTableSink.factory(output);
            case SQLITE:
                return new SqliteSinkFactory(output, sqliteProfile);
            case CSV:
            default:
                return CsvTableSink.factory(output);
        }
    }

    public static OutputFormat fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            String known = Arrays.stream(values()).map(f -> f.name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Unknown output format '" + name + "' (expected one of " + known + ")", e);
        }
    }

    static String fileName(String table, OutputFormat format) {
        return sanitizeFilename(table) + format.extension;
    }

    static String sanitizeFilename(String name) {
        return name.replaceAll("[^A-Za-z0-9_.-]+", "_");
    }
}
