package com.sqldumpextract;

import java.util.Collection;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

/**
 * Knobs of one extraction run.
 *
 * @param tableFilter         tables whose rows are written; others only have
 *                            their schema tracked
 * @param stopSignal          polled between statements; true stops the run
 * @param maxRecordedWarnings cap on stored warnings (counts stay exact)
 * @param progressLogInterval lines between FINE progress messages
 */
public record ExtractionOptions(
        Predicate<String> tableFilter,
        BooleanSupplier stopSignal,
        int maxRecordedWarnings,
        long progressLogInterval) {

    public static final int DEFAULT_MAX_WARNINGS = 1000;
    public static final long DEFAULT_PROGRESS_INTERVAL = 10_000L;

    public static ExtractionOptions defaults() {
        return new ExtractionOptions(table -> true, () -> false, DEFAULT_MAX_WARNINGS, DEFAULT_PROGRESS_INTERVAL);
    }

    public ExtractionOptions withTables(Collection<String> tables) {
        if (tables == null || tables.isEmpty()) {
            return withTableFilter(table -> true);
        }
        Set<String> selected = Set.copyOf(tables);
        return withTableFilter(selected::contains);
    }

    public ExtractionOptions withTableFilter(Predicate<String> filter) {
        return new ExtractionOptions(filter, stopSignal, maxRecordedWarnings, progressLogInterval);
    }

    public ExtractionOptions withStopSignal(BooleanSupplier signal) {
        return new ExtractionOptions(tableFilter, signal, maxRecordedWarnings, progressLogInterval);
    }

    public ExtractionOptions withMaxRecordedWarnings(int max) {
        return new ExtractionOptions(tableFilter, stopSignal, max, progressLogInterval);
    }
}
