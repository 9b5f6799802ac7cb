package com.sqldumpextract;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes one table in the {@link TableBinIO} format, which keeps NULL and the
 * empty string apart.
 */
public class BinaryTableSink implements TableSink {
    private final Path file;
    private TableBinIO.TableBinWriter writer;

    public BinaryTableSink(Path file) throws IOException {
        this.file = file;
        Files.deleteIfExists(file);
    }

    public static TableSinkFactory factory(Path outputDir) {
        return schema -> {
            Files.createDirectories(outputDir);
            return new BinaryTableSink(outputDir.resolve(OutputFormat.fileName(schema.name(), OutputFormat.BIN)));
        };
    }

    @Override
    public void writeHeader(List<String> columns) throws IOException {
        if (writer != null) {
            throw new IOException("header already written to " + file);
        }
        writer = TableBinIO.openWriter(file, columns);
    }

    @Override
    public void writeRow(List<String> values) throws IOException {
        if (writer == null) {
            throw new IOException("header must be written before rows");
        }
        writer.writeRow(values);
    }

    @Override
    public void close() throws IOException {
        if (writer != null) {
            writer.close();
        }
    }
}
