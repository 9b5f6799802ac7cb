package com.sqldumpextract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one extraction run, owned by {@link DumpExtractor}.
 */
class ParserState {

    enum DriverState {
        NO_TABLE,
        IN_SCHEMA,
        READY
    }

    /**
     * Counters and sink handle of one declared table.
     */
    static final class TableProgress {
        final String name;
        final boolean selected;
        final TableDigest digest = new TableDigest();
        TableSchema schema;
        TableSink sink;
        boolean sinkOpened;
        long rowsWritten;
        long arityMismatches;
        long malformedTuples;
        String failure;
        boolean interrupted;

        TableProgress(String name, boolean selected) {
            this.name = name;
            this.selected = selected;
        }

        boolean failed() {
            return failure != null;
        }

        TableReport toReport() {
            List<String> columns = schema != null ? schema.columns() : List.of();
            return new TableReport(name, columns, selected, rowsWritten, arityMismatches, malformedTuples,
                    !failed() && !interrupted, failure, sinkOpened ? digest.hex() : null);
        }
    }

    DriverState driverState = DriverState.NO_TABLE;
    final SchemaTracker tracker = new SchemaTracker();
    long linesRead;
    long statementsRead;
    boolean cancelled;

    private TableProgress current;
    private final Map<String, TableProgress> tables = new LinkedHashMap<>();
    private final List<ExtractionWarning> warnings = new ArrayList<>();
    private final Map<WarningKind, Long> warningCounts = new EnumMap<>(WarningKind.class);
    private final int maxRecordedWarnings;

    ParserState(int maxRecordedWarnings) {
        this.maxRecordedWarnings = maxRecordedWarnings;
    }

    TableProgress current() {
        return current;
    }

    /**
     * Make {@code name} the active table. A name declared before starts over.
     */
    TableProgress declare(String name, boolean selected) {
        tables.remove(name);
        current = new TableProgress(name, selected);
        tables.put(name, current);
        driverState = DriverState.IN_SCHEMA;
        return current;
    }

    /**
     * Count a warning and keep it if the cap allows.
     *
     * @return true when the warning was stored
     */
    boolean warn(ExtractionWarning warning) {
        warningCounts.merge(warning.kind(), 1L, Long::sum);
        if (warnings.size() < maxRecordedWarnings) {
            warnings.add(warning);
            return true;
        }
        return false;
    }

    ExtractionSummary toSummary() {
        List<TableReport> reports = tables.values().stream().map(TableProgress::toReport).toList();
        return new ExtractionSummary(reports, Collections.unmodifiableList(new ArrayList<>(warnings)),
                Collections.unmodifiableMap(new EnumMap<>(warningCounts)), linesRead, statementsRead, cancelled);
    }
}
