package com.sqldumpextract;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes one table into a SQLite table of TEXT columns, replacing any table of
 * the same name. Rows are inserted in batches, one commit per batch.
 * <p>
 * A repeated column name gets a numeric suffix ({@code name_2}) because SQLite
 * rejects duplicate column names.
 */
public class SqliteTableSink implements TableSink {
    private final Connection connection;
    private final String tableName;
    private final int batchSize;
    private PreparedStatement insertStmt;
    private int pending;

    SqliteTableSink(Connection connection, String tableName, int batchSize) {
        this.connection = connection;
        this.tableName = tableName;
        this.batchSize = Math.max(batchSize, 1);
    }

    @Override
    public void writeHeader(List<String> columns) throws IOException {
        List<String> names = uniqueNames(columns);
        String columnDefs = names.stream().map(c -> quote(c) + " TEXT").collect(Collectors.joining(", "));
        String placeholders = names.stream().map(c -> "?").collect(Collectors.joining(", "));
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("DROP TABLE IF EXISTS " + quote(tableName));
            stmt.execute("CREATE TABLE " + quote(tableName) + " (" + columnDefs + ")");
            connection.commit();
            insertStmt = connection.prepareStatement("INSERT INTO " + quote(tableName) + " VALUES (" + placeholders + ")");
        } catch (SQLException e) {
            throw new IOException("Cannot create SQLite table " + tableName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void writeRow(List<String> values) throws IOException {
        if (insertStmt == null) {
            throw new IOException("header must be written before rows");
        }
        try {
            for (int i = 0; i < values.size(); i++) {
                insertStmt.setString(i + 1, values.get(i));
            }
            insertStmt.addBatch();
            if (++pending >= batchSize) {
                executeBatch();
            }
        } catch (SQLException e) {
            throw new IOException("Cannot insert into SQLite table " + tableName + ": " + e.getMessage(), e);
        }
    }

    private void executeBatch() throws SQLException {
        if (pending > 0) {
            insertStmt.executeBatch();
            insertStmt.clearBatch();
            connection.commit();
            pending = 0;
        }
    }

    @Override
    public void close() throws IOException {
        if (insertStmt == null) {
            return;
        }
        SQLException failure = null;
        try {
            executeBatch();
        } catch (SQLException e) {
            failure = e;
        }
        try {
            insertStmt.close();
        } catch (SQLException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        insertStmt = null;
        if (failure != null) {
            throw new IOException("Cannot flush SQLite table " + tableName + ": " + failure.getMessage(), failure);
        }
    }

    static List<String> uniqueNames(List<String> columns) {
        Set<String> used = new HashSet<>();
        List<String> names = new ArrayList<>(columns.size());
        for (String column : columns) {
            String name = column;
            int suffix = 2;
            while (!used.add(name.toLowerCase(Locale.ROOT))) {
                name = column + "_" + suffix++;
            }
            names.add(name);
        }
        return names;
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
