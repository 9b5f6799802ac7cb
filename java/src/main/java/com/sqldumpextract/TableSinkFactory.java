package com.sqldumpextract;

import java.io.Closeable;
import java.io.IOException;

/**
 * Opens a {@link TableSink} per table, creating or truncating its destination.
 * Factories that hold shared resources (a database connection) release them on
 * {@link #close()}.
 */
@FunctionalInterface
public interface TableSinkFactory extends Closeable {

    TableSink open(TableSchema schema) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
