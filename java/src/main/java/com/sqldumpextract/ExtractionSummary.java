package com.sqldumpextract;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one extraction run, produced even when some tables failed.
 * <p>
 * {@code warnings} holds at most the configured number of incidents;
 * {@code warningCounts} counts all of them.
 */
public record ExtractionSummary(
        List<TableReport> tables,
        List<ExtractionWarning> warnings,
        Map<WarningKind, Long> warningCounts,
        long linesRead,
        long statementsRead,
        boolean cancelled) {

    public Optional<TableReport> table(String name) {
        return tables.stream().filter(t -> t.name().equals(name)).findFirst();
    }

    public long totalRows() {
        return tables.stream().mapToLong(TableReport::rowsWritten).sum();
    }

    public long warningCount(WarningKind kind) {
        return warningCounts.getOrDefault(kind, 0L);
    }

    public List<TableReport> incompleteTables() {
        return tables.stream().filter(t -> !t.complete()).toList();
    }
}
