package com.sqldumpextract;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The parts of one INSERT statement the extractor needs: target table, the
 * optional explicit column list, and the raw VALUES clause without its
 * terminating semicolon.
 *
 * @param columns explicit column list, or {@code null} when the statement has none
 */
public record InsertStatement(
        String table,
        List<String> columns,
        String valuesClause) {

    private static final Pattern INSERT_START = Pattern.compile(
            "^\\s*(?:INSERT(?:\\s+IGNORE)?|REPLACE)\\s+INTO\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern INSERT_HEAD = Pattern.compile(
            "^\\s*(?:INSERT(?:\\s+IGNORE)?|REPLACE)\\s+INTO\\s+(?:`([^`]+)`|([\\w$]+))\\s*"
                    + "(?:\\(([^)]*)\\)\\s*)?VALUES\\s*",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public static boolean isInsertStart(String line) {
        return INSERT_START.matcher(line).lookingAt();
    }

    public boolean hasExplicitColumns() {
        return columns != null;
    }

    /**
     * Split a complete INSERT statement, or return empty if its head is not
     * {@code INSERT INTO <table> [(<columns>)] VALUES}.
     */
    public static Optional<InsertStatement> parse(String statement) {
        Matcher matcher = INSERT_HEAD.matcher(statement);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        String table = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);

        List<String> columns = null;
        if (matcher.group(3) != null) {
            columns = Arrays.stream(matcher.group(3).split(","))
                    .map(col -> col.trim().replaceAll("[`'\"]", ""))
                    .toList();
        }

        String valuesPart = statement.substring(matcher.end()).stripTrailing();
        if (valuesPart.endsWith(";")) {
            valuesPart = valuesPart.substring(0, valuesPart.length() - 1);
        }
        return Optional.of(new InsertStatement(table, columns, valuesPart));
    }
}
