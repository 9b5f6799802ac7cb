package com.sqldumpextract;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects the column names of the CREATE TABLE statement being read.
 * <p>
 * Only the column name of each declaration is kept; types, defaults and key
 * definitions are skipped. Duplicate names are kept and listed in
 * {@link #duplicateColumns()}.
 */
public class SchemaTracker {

    public enum State {
        IDLE,
        AWAITING_COLUMNS,
        CLOSED
    }

    private static final Pattern TABLE_NAME_PATTERN = Pattern.compile(
            "^\\s*CREATE\\s+(?:TEMPORARY\\s+)?TABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?(?:`([^`]+)`|([\\w$]+))",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CONSTRAINT_PATTERN = Pattern.compile(
            "(?i)^(PRIMARY|UNIQUE|KEY|INDEX|CONSTRAINT|FOREIGN|FULLTEXT|SPATIAL|CHECK)\\b.*", Pattern.DOTALL);
    private static final Pattern COLUMN_PATTERN = Pattern.compile("^`([^`]+)`(?:\\s|$)");

    private State state = State.IDLE;
    private String tableName;
    private final List<String> columns = new ArrayList<>();
    private final Set<String> seen = new HashSet<>();
    private final List<String> duplicates = new ArrayList<>();

    /**
     * Table name declared by a CREATE TABLE header line, if {@code line} is one.
     */
    public static Optional<String> matchHeader(String line) {
        Matcher matcher = TABLE_NAME_PATTERN.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1) != null ? matcher.group(1) : matcher.group(2));
    }

    /**
     * Start collecting columns for a new table. Declarations that follow the
     * opening parenthesis on the header line itself are collected too.
     */
    public State begin(String name, String headerLine) {
        tableName = name;
        columns.clear();
        seen.clear();
        duplicates.clear();
        state = State.AWAITING_COLUMNS;

        Matcher matcher = TABLE_NAME_PATTERN.matcher(headerLine);
        int bodyStart = matcher.find() ? headerLine.indexOf('(', matcher.end()) : -1;
        if (bodyStart >= 0) {
            collectDeclarations(headerLine.substring(bodyStart + 1));
        }
        closeIfTerminated(headerLine);
        return state;
    }

    /**
     * Consume one line of the table body.
     */
    public State accept(String line) {
        if (state != State.AWAITING_COLUMNS) {
            throw new IllegalStateException("no CREATE TABLE body is open (state " + state + ")");
        }
        collectDeclarations(line);
        closeIfTerminated(line);
        return state;
    }

    /**
     * Close the body without having seen its terminator.
     */
    public void close() {
        if (state == State.AWAITING_COLUMNS) {
            state = State.CLOSED;
        }
    }

    public State state() {
        return state;
    }

    public TableSchema schema() {
        if (tableName == null) {
            throw new IllegalStateException("no table declared yet");
        }
        return new TableSchema(tableName, columns);
    }

    public List<String> duplicateColumns() {
        return List.copyOf(duplicates);
    }

    private void closeIfTerminated(String line) {
        if (line.trim().endsWith(";")) {
            state = State.CLOSED;
        }
    }

    private void collectDeclarations(String text) {
        // Split by top-level commas
        int depth = 0;
        boolean inQuote = false;
        char quoteChar = 0;
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (c == '\\' && i + 1 < text.length()) {
                current.append(c).append(text.charAt(++i));
                continue;
            }

            if (!inQuote && (c == '\'' || c == '"')) {
                inQuote = true;
                quoteChar = c;
            } else if (inQuote && c == quoteChar) {
                inQuote = false;
            } else if (!inQuote) {
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                } else if (c == ',' && depth <= 0) {
                    addColumn(current.toString());
                    current.setLength(0);
                    continue;
                }
            }
            current.append(c);
        }
        addColumn(current.toString());
    }

    private void addColumn(String declaration) {
        String item = declaration.trim();
        if (item.isEmpty() || CONSTRAINT_PATTERN.matcher(item).matches()) {
            return;
        }
        Matcher matcher = COLUMN_PATTERN.matcher(item);
        if (!matcher.find()) {
            return;
        }
        String name = matcher.group(1);
        if (!seen.add(name)) {
            duplicates.add(name);
        }
        columns.add(name);
    }
}
