package com.sqldumpextract;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;

/**
 * Writes one table to a UTF-8 CSV file.
 * <p>
 * Every non-null field is quoted and backslash is the escape character, so a
 * NULL value comes out as an empty unquoted field while {@code ''} comes out
 * as {@code ""}.
 */
public class CsvTableSink implements TableSink {
    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setQuoteMode(QuoteMode.ALL)
            .setEscape('\\')
            .setRecordSeparator("\n")
            .build();

    private final Path file;
    private final CSVPrinter printer;

    public CsvTableSink(Path file) throws IOException {
        this.file = file;
        this.printer = new CSVPrinter(Files.newBufferedWriter(file, StandardCharsets.UTF_8), FORMAT);
    }

    public static TableSinkFactory factory(Path outputDir) {
        return schema -> {
            Files.createDirectories(outputDir);
            return new CsvTableSink(outputDir.resolve(OutputFormat.fileName(schema.name(), OutputFormat.CSV)));
        };
    }

    public Path getFile() {
        return file;
    }

    @Override
    public void writeHeader(List<String> columns) throws IOException {
        printer.printRecord(columns);
    }

    @Override
    public void writeRow(List<String> values) throws IOException {
        printer.printRecord(values);
    }

    @Override
    public void close() throws IOException {
        printer.close(true);
    }
}
