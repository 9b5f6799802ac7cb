package com.sqldumpextract;

/**
 * Data-quality incidents reported by an extraction run. None of them stops the
 * run; {@link #SINK_WRITE_FAILURE} stops output for the affected table only.
 */
public enum WarningKind {
    MALFORMED_LITERAL,
    ARITY_MISMATCH,
    INSERT_BEFORE_SCHEMA,
    SINK_WRITE_FAILURE,
    MISPLACED_INSERT,
    DUPLICATE_COLUMN,
    UNKNOWN_COLUMN
}
