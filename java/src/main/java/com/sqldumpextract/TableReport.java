package com.sqldumpextract;

import java.util.List;

/**
 * Per-table outcome of an extraction run.
 *
 * @param selected false when the table filter excluded the table's rows
 * @param complete false when the sink failed or the run stopped inside this table
 * @param failure  sink failure message, or null
 * @param digest   BLAKE3 hex fingerprint of the written rows, or null when no
 *                 sink was opened
 */
public record TableReport(
        String name,
        List<String> columns,
        boolean selected,
        long rowsWritten,
        long arityMismatches,
        long malformedTuples,
        boolean complete,
        String failure,
        String digest) {
}
