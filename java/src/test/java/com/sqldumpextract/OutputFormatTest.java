package com.sqldumpextract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

class OutputFormatTest {

    @Test
    void fromName_isCaseInsensitive() {
        assertEquals(OutputFormat.JSONL, OutputFormat.fromName("JSONL"));
        assertEquals(OutputFormat.CSV, OutputFormat.fromName(" csv "));
        assertEquals(OutputFormat.SQLITE, OutputFormat.fromName("sqlite"));
    }

    @Test
    void fromName_unknown_listsKnownFormats() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> OutputFormat.fromName("xml"));
        assertTrue(ex.getMessage().contains("csv, jsonl, bin, sqlite"));
    }

    @Test
    void fileName_replacesUnsafeCharacters() {
        assertEquals("order_items.csv", OutputFormat.fileName("order items", OutputFormat.CSV));
        assertEquals("a_b.jsonl", OutputFormat.fileName("a/b", OutputFormat.JSONL));
        assertEquals("t-1.bin", OutputFormat.fileName("t-1", OutputFormat.BIN));
    }

    @Test
    void createFactory_sqliteUsesDatabaseFile() {
        assertTrue(OutputFormat.SQLITE.createFactory(Path.of("out.db"), null) instanceof SqliteSinkFactory);
    }
}
