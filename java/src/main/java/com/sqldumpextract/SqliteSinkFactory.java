package com.sqldumpextract;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import lombok.extern.java.Log;

/**
 * Opens one SQLite database file and hands out a {@link SqliteTableSink} per
 * table. The connection is created on the first table and closed with the
 * factory.
 */
@Log
public class SqliteSinkFactory implements TableSinkFactory {
    private final Path dbFile;
    private final SqliteProfile profile;
    private Connection connection;

    public SqliteSinkFactory(Path dbFile, SqliteProfile profile) {
        this.dbFile = dbFile;
        this.profile = profile != null ? profile : new SqliteProfile();
    }

    @Override
    public TableSink open(TableSchema schema) throws IOException {
        try {
            return new SqliteTableSink(connection(), schema.name(), profile.batch());
        } catch (SQLException e) {
            throw new IOException("Cannot open SQLite table " + schema.name() + ": " + e.getMessage(), e);
        }
    }

    private Connection connection() throws SQLException, IOException {
        if (connection == null) {
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbFile.toAbsolutePath());

            // Run PRAGMAs outside a transaction (SQLite complains otherwise)
            connection.setAutoCommit(true);
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=OFF");
                stmt.execute("PRAGMA synchronous=OFF");
                stmt.execute("PRAGMA temp_store=MEMORY");
                stmt.execute("PRAGMA cache_size=-" + profile.cache_kb());
                stmt.execute("PRAGMA mmap_size=" + (profile.mmap_mb() * 1024L * 1024L));
            }
            connection.setAutoCommit(false);
            log.fine(() -> "Opened SQLite output " + dbFile);
        }
        return connection;
    }

    @Override
    public void close() throws IOException {
        if (connection == null) {
            return;
        }
        try {
            commitAndClose(connection, dbFile);
        } finally {
            connection = null;
        }
    }

    /**
     * Commit pending rows and close the connection, closing it even when the
     * commit fails.
     */
    static void commitAndClose(Connection connection, Path dbFile) throws IOException {
        SQLException failure = null;
        try {
            connection.commit();
        } catch (SQLException e) {
            failure = e;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw new IOException("Cannot close SQLite output " + dbFile + ": " + failure.getMessage(), failure);
        }
    }
}
