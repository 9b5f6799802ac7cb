package com.sqldumpextract;

import java.util.Collections;
import java.util.List;

/**
 * One parenthesized tuple of a VALUES clause, either decoded into its fields
 * or marked malformed with the reason it was discarded.
 * <p>
 * {@code start} is the offset of the opening parenthesis and {@code end} the
 * offset scanning resumed from. Field values may be {@code null} (SQL NULL).
 */
public record ParsedTuple(
        List<String> values,
        int start,
        int end,
        String error) {

    static ParsedTuple of(List<String> values, int start, int end) {
        return new ParsedTuple(Collections.unmodifiableList(values), start, end, null);
    }

    static ParsedTuple malformed(int start, int end, String error) {
        return new ParsedTuple(Collections.emptyList(), start, end, error);
    }

    public boolean isMalformed() {
        return error != null;
    }

    public int arity() {
        return values.size();
    }
}
