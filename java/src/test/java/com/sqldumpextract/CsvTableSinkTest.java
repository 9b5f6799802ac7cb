package com.sqldumpextract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvTableSinkTest {

    @Test
    void writeRow_nullIsUnquotedAndEmptyStringIsQuoted(@TempDir Path tmpDir) throws Exception {
        Path file = tmpDir.resolve("t.csv");
        try (CsvTableSink sink = new CsvTableSink(file)) {
            sink.writeHeader(List.of("id", "name", "note"));
            sink.writeRow(Arrays.asList("1", null, ""));
        }

        List<String> lines = Files.readAllLines(file);
        assertEquals(List.of("\"id\",\"name\",\"note\"", "\"1\",,\"\""), lines);
    }

    @Test
    void writeRow_specialCharacters_surviveReload(@TempDir Path tmpDir) throws Exception {
        Path file = tmpDir.resolve("notes.csv");
        List<String> tricky = List.of("say \"hi\", ok", "line1\nline2", "C:\\temp\\x");
        try (CsvTableSink sink = new CsvTableSink(file)) {
            sink.writeHeader(List.of("a", "b", "c"));
            sink.writeRow(tricky);
        }

        assertTrue(Files.readString(file).contains("C:\\\\temp\\\\x"));
        LoadedTable table = new TableFileLoader().loadCsv(file);
        assertEquals("notes", table.name());
        assertEquals(List.of("a", "b", "c"), table.columns());
        assertEquals(List.of(tricky), table.rows());
    }

    @Test
    void factory_createsOutputDirectoryAndNamesFileAfterTable(@TempDir Path tmpDir) throws Exception {
        Path outputDir = tmpDir.resolve("nested/out");
        TableSinkFactory factory = CsvTableSink.factory(outputDir);

        try (TableSink sink = factory.open(new TableSchema("order items", List.of("id")))) {
            sink.writeHeader(List.of("id"));
            sink.writeRow(List.of("5"));
        }

        Path expected = outputDir.resolve("order_items.csv");
        assertTrue(Files.isRegularFile(expected));
        assertEquals(List.of("\"id\"", "\"5\""), Files.readAllLines(expected));
    }
}
