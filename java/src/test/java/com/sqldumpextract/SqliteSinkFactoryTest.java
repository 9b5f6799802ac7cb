package com.sqldumpextract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteSinkFactoryTest {

    @Test
    void commitAndClose_commitFails_stillClosesConnection() throws Exception {
        Connection connection = mock(Connection.class);
        doThrow(new SQLException("database is locked")).when(connection).commit();

        IOException ex = assertThrows(IOException.class,
                () -> SqliteSinkFactory.commitAndClose(connection, Path.of("out.db")));

        verify(connection).close();
        assertEquals("database is locked", ex.getCause().getMessage());
    }

    @Test
    void commitAndClose_bothFail_keepsCloseFailureAsSuppressed() throws Exception {
        Connection connection = mock(Connection.class);
        doThrow(new SQLException("commit failed")).when(connection).commit();
        doThrow(new SQLException("close failed")).when(connection).close();

        IOException ex = assertThrows(IOException.class,
                () -> SqliteSinkFactory.commitAndClose(connection, Path.of("out.db")));

        assertEquals("commit failed", ex.getCause().getMessage());
        assertEquals("close failed", ex.getCause().getSuppressed()[0].getMessage());
    }

    @Test
    void close_withoutAnyTable_doesNothing(@TempDir Path tmpDir) throws Exception {
        SqliteSinkFactory factory = new SqliteSinkFactory(tmpDir.resolve("never.db"), null);
        factory.close();
        assertFalse(Files.exists(tmpDir.resolve("never.db")));
    }
}
