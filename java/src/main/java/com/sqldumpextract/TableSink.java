package com.sqldumpextract;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Destination of one table's extracted rows. Receives the header exactly once,
 * then rows of the same width. A {@code null} value is SQL NULL; each sink
 * writes it using its own empty-field convention.
 */
public interface TableSink extends Closeable {

    void writeHeader(List<String> columns) throws IOException;

    void writeRow(List<String> values) throws IOException;
}
