package com.sqldumpextract;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.stream.Stream;

import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import lombok.extern.java.Log;

/**
 * Reads an extraction output directory back into memory, one
 * {@link LoadedTable} per {@code .csv} or {@code .bin} file, keyed by file stem.
 * <p>
 * Empty CSV fields load as empty strings; the binary format keeps NULL as
 * {@code null}. A file that cannot be read is logged and left out.
 */
@Log
public class TableFileLoader {

    public Map<String, LoadedTable> loadDirectory(Path dir) throws IOException {
        List<Path> files;
        try (Stream<Path> paths = Files.list(dir)) {
            files = paths.filter(Files::isRegularFile)
                    .filter(p -> isCsv(p) || isBin(p))
                    .sorted()
                    .toList();
        }

        Map<String, LoadedTable> tables = new LinkedHashMap<>();
        for (Path file : files) {
            try {
                LoadedTable table = isCsv(file) ? loadCsv(file) : loadBin(file);
                if (tables.putIfAbsent(table.name(), table) != null) {
                    log.warning(() -> "Table " + table.name() + " already loaded; ignoring " + file);
                    continue;
                }
                if (table.skippedRows() > 0) {
                    log.warning(String.format("%s: %,d rows x %d cols (%,d lines skipped)",
                            table.name(), table.rowCount(), table.columnCount(), table.skippedRows()));
                } else {
                    log.info(String.format("%s: %,d rows x %d cols", table.name(), table.rowCount(), table.columnCount()));
                }
            } catch (IOException | UncheckedIOException | IllegalStateException e) {
                log.log(Level.WARNING, "Failed to load " + file, e);
            }
        }
        log.info(() -> "Loaded " + tables.size() + " tables from " + dir);
        return Collections.unmodifiableMap(tables);
    }

    public LoadedTable loadCsv(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = CSVParser.parse(reader, CsvTableSink.FORMAT)) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                throw new IOException("missing header row in " + file);
            }
            List<String> columns = records.next().toList();
            List<List<String>> rows = new ArrayList<>();
            long skipped = 0;
            while (records.hasNext()) {
                CSVRecord record = records.next();
                if (record.size() != columns.size()) {
                    skipped++;
                    continue;
                }
                rows.add(record.toList());
            }
            return new LoadedTable(stem(file), columns, Collections.unmodifiableList(rows), skipped);
        }
    }

    public LoadedTable loadBin(Path file) throws IOException {
        try (TableBinIO.TableBinReader reader = TableBinIO.openReader(file)) {
            List<String> columns = reader.columns();
            List<List<String>> rows = new ArrayList<>();
            long skipped = 0;
            List<String> row;
            while ((row = reader.readRow()) != null) {
                if (row.size() != columns.size()) {
                    skipped++;
                    continue;
                }
                rows.add(Collections.unmodifiableList(row));
            }
            return new LoadedTable(stem(file), List.copyOf(columns), Collections.unmodifiableList(rows), skipped);
        }
    }

    private static boolean isCsv(Path file) {
        return file.getFileName().toString().endsWith(OutputFormat.CSV.extension());
    }

    private static boolean isBin(Path file) {
        return file.getFileName().toString().endsWith(OutputFormat.BIN.extension());
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
