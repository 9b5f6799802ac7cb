package com.sqldumpextract;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;

import com.sqldumpextract.ParserState.DriverState;
import com.sqldumpextract.ParserState.TableProgress;

import lombok.extern.java.Log;

/**
 * Single forward pass over a SQL dump that routes every INSERT tuple of the
 * table declared by the preceding CREATE TABLE to that table's sink.
 * <p>
 * Only the current statement is buffered, so memory does not grow with the
 * dump. Malformed tuples, arity mismatches and sink failures are reported in
 * the returned {@link ExtractionSummary}; only an I/O error reading the dump
 * itself is thrown.
 */
@Log
public class DumpExtractor {
    private final TableSinkFactory sinkFactory;
    private final ExtractionOptions options;

    public DumpExtractor(TableSinkFactory sinkFactory) {
        this(sinkFactory, ExtractionOptions.defaults());
    }

    public DumpExtractor(TableSinkFactory sinkFactory, ExtractionOptions options) {
        this.sinkFactory = sinkFactory;
        this.options = options;
    }

    /**
     * Reader over {@code in} that replaces undecodable bytes instead of failing.
     */
    public static BufferedReader openReader(InputStream in, Charset charset) {
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return new BufferedReader(new InputStreamReader(in, decoder));
    }

    public ExtractionSummary extract(Path dumpFile, Charset charset) throws IOException {
        try (BufferedReader reader = openReader(Files.newInputStream(dumpFile), charset)) {
            return extract(reader);
        }
    }

    public ExtractionSummary extract(BufferedReader reader) throws IOException {
        ParserState state = new ParserState(options.maxRecordedWarnings());
        StatementScanner scanner = new StatementScanner();
        StringBuilder pendingInsert = null;
        long pendingLine = 0;

        try {
            String line;
            while ((line = reader.readLine()) != null) {
                long lineNo = ++state.linesRead;
                if (options.progressLogInterval() > 0 && lineNo % options.progressLogInterval() == 0) {
                    log.fine(String.format("Processing line %,d...", lineNo));
                }

                if (pendingInsert != null) {
                    pendingInsert.append('\n').append(line);
                    if (scanner.feed(line)) {
                        handleInsert(state, pendingInsert.toString(), pendingLine);
                        pendingInsert = null;
                    }
                    continue;
                }

                Optional<String> createdTable = SchemaTracker.matchHeader(line);
                if (createdTable.isPresent()) {
                    if (stopRequested(state, false)) {
                        break;
                    }
                    startTable(state, createdTable.get(), line);
                    continue;
                }

                boolean insertStart = InsertStatement.isInsertStart(line);
                if (state.driverState == DriverState.IN_SCHEMA) {
                    if (!insertStart) {
                        if (state.tracker.accept(line) == SchemaTracker.State.CLOSED) {
                            finishSchema(state, lineNo);
                        }
                        continue;
                    }
                    log.warning(() -> "CREATE TABLE `" + state.current().name
                            + "` was not terminated before line " + lineNo + "; closing it");
                    state.tracker.close();
                    finishSchema(state, lineNo);
                }

                if (insertStart) {
                    if (stopRequested(state, true)) {
                        break;
                    }
                    scanner.reset();
                    if (scanner.feed(line)) {
                        handleInsert(state, line, lineNo);
                    } else {
                        pendingInsert = new StringBuilder(line);
                        pendingLine = lineNo;
                    }
                }
            }

            if (pendingInsert != null) {
                long startLine = pendingLine;
                log.warning(() -> "INSERT starting at line " + startLine + " is not terminated at end of input");
                handleInsert(state, pendingInsert.toString(), pendingLine);
            }
            if (state.driverState == DriverState.IN_SCHEMA) {
                state.tracker.close();
                finishSchema(state, state.linesRead);
            }
        } finally {
            closeCurrent(state);
        }

        ExtractionSummary summary = state.toSummary();
        log.info(String.format("Extraction finished: %d tables, %,d rows, %,d lines%s",
                summary.tables().size(), summary.totalRows(), summary.linesRead(),
                summary.cancelled() ? " (cancelled)" : ""));
        return summary;
    }

    /**
     * Poll the stop signal. Stopping at an INSERT leaves the active table
     * short of rows; stopping at the next CREATE TABLE does not.
     */
    private boolean stopRequested(ParserState state, boolean insideTable) {
        if (options.stopSignal().getAsBoolean()) {
            state.cancelled = true;
            TableProgress current = state.current();
            if (insideTable && current != null && current.selected) {
                current.interrupted = true;
            }
            log.info(() -> "Stop requested after line " + state.linesRead);
            return true;
        }
        return false;
    }

    private void startTable(ParserState state, String name, String headerLine) {
        closeCurrent(state);
        state.statementsRead++;
        boolean selected = options.tableFilter().test(name);
        state.declare(name, selected);
        log.info(() -> "Found table: " + name + (selected ? "" : " (not selected)"));
        if (state.tracker.begin(name, headerLine) == SchemaTracker.State.CLOSED) {
            finishSchema(state, state.linesRead);
        }
    }

    private void finishSchema(ParserState state, long lineNo) {
        TableProgress table = state.current();
        table.schema = state.tracker.schema();
        state.driverState = DriverState.READY;
        for (String duplicate : state.tracker.duplicateColumns()) {
            warn(state, WarningKind.DUPLICATE_COLUMN, table.name, lineNo,
                    "column `" + duplicate + "` is declared more than once");
        }
        log.fine(() -> "Table " + table.name + " columns: " + String.join(", ", table.schema.columns()));
    }

    private void handleInsert(ParserState state, String statement, long lineNo) {
        state.statementsRead++;
        TableProgress table = state.current();
        if (table == null || table.schema == null) {
            warn(state, WarningKind.INSERT_BEFORE_SCHEMA, null, lineNo, "INSERT before any CREATE TABLE; skipped");
            return;
        }

        Optional<InsertStatement> parsed = InsertStatement.parse(statement);
        if (parsed.isEmpty()) {
            table.malformedTuples++;
            warn(state, WarningKind.MALFORMED_LITERAL, table.name, lineNo, "unrecognized INSERT statement; skipped");
            return;
        }
        InsertStatement insert = parsed.get();
        if (!insert.table().equals(table.name)) {
            warn(state, WarningKind.MISPLACED_INSERT, table.name, lineNo,
                    "INSERT into `" + insert.table() + "` attributed to active table `" + table.name + "`");
        }
        if (!table.selected || table.failed()) {
            return;
        }

        TableSchema schema = table.schema;
        int[] projection = null;
        int expected = schema.columnCount();
        if (insert.hasExplicitColumns()) {
            projection = projection(schema, insert.columns());
            if (projection == null) {
                warn(state, WarningKind.UNKNOWN_COLUMN, table.name, lineNo,
                        "column list " + insert.columns() + " names columns missing from the schema; skipped");
                return;
            }
            expected = insert.columns().size();
        }

        if (!ensureOpen(state, table, lineNo)) {
            return;
        }

        for (ParsedTuple tuple : new ValuesClauseSplitter(insert.valuesClause())) {
            if (tuple.isMalformed()) {
                table.malformedTuples++;
                warn(state, WarningKind.MALFORMED_LITERAL, table.name, lineNo, tuple.error());
                continue;
            }
            if (tuple.arity() != expected) {
                table.arityMismatches++;
                warn(state, WarningKind.ARITY_MISMATCH, table.name, lineNo,
                        "row has " + tuple.arity() + " fields, expected " + expected);
                continue;
            }
            List<String> row = projection == null ? tuple.values() : project(tuple.values(), projection);
            try {
                table.sink.writeRow(row);
            } catch (IOException e) {
                failTable(state, table, lineNo, e);
                return;
            }
            table.digest.update(row);
            table.rowsWritten++;
        }
    }

    private boolean ensureOpen(ParserState state, TableProgress table, long lineNo) {
        if (table.sinkOpened) {
            return table.sink != null;
        }
        table.sinkOpened = true;
        try {
            table.sink = sinkFactory.open(table.schema);
            table.sink.writeHeader(table.schema.columns());
            return true;
        } catch (IOException e) {
            failTable(state, table, lineNo, e);
            return false;
        }
    }

    private void failTable(ParserState state, TableProgress table, long lineNo, IOException failure) {
        table.failure = failure.getMessage() != null ? failure.getMessage() : failure.toString();
        if (table.sink != null) {
            try {
                table.sink.close();
            } catch (IOException closeFailure) {
                failure.addSuppressed(closeFailure);
            }
            table.sink = null;
        }
        log.log(Level.SEVERE, "Output for table " + table.name + " failed; skipping its remaining rows", failure);
        warn(state, WarningKind.SINK_WRITE_FAILURE, table.name, lineNo, table.failure);
    }

    private void closeCurrent(ParserState state) {
        TableProgress table = state.current();
        if (table == null || table.sink == null) {
            return;
        }
        try {
            table.sink.close();
            table.sink = null;
            log.info(() -> String.format("  Saved %,d rows to %s", table.rowsWritten, table.name));
        } catch (IOException e) {
            table.sink = null;
            failTable(state, table, state.linesRead, e);
        }
    }

    private void warn(ParserState state, WarningKind kind, String table, long lineNo, String message) {
        ExtractionWarning warning = new ExtractionWarning(kind, table, lineNo, message);
        if (state.warn(warning)) {
            log.warning(warning::toString);
        } else {
            log.fine(warning::toString);
        }
    }

    /**
     * For each schema column, its position in {@code listed}, or -1 when the
     * statement leaves it out. Null when {@code listed} names an unknown column.
     */
    private static int[] projection(TableSchema schema, List<String> listed) {
        for (String column : listed) {
            if (schema.indexOf(column) < 0) {
                return null;
            }
        }
        int[] positions = new int[schema.columnCount()];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = listed.indexOf(schema.columns().get(i));
        }
        return positions;
    }

    private static List<String> project(List<String> values, int[] positions) {
        List<String> row = new ArrayList<>(positions.length);
        for (int position : positions) {
            row.add(position < 0 ? null : values.get(position));
        }
        return row;
    }
}
