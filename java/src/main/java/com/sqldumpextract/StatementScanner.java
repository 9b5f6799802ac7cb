package com.sqldumpextract;

/**
 * Tracks quote, escape and parenthesis state across the physical lines of one
 * statement to tell where it ends.
 */
public class StatementScanner {
    private int parenDepth = 0;
    private boolean inSingleQuote = false;
    private boolean inDoubleQuote = false;
    private boolean escapeNext = false;

    public void reset() {
        parenDepth = 0;
        inSingleQuote = false;
        inDoubleQuote = false;
        escapeNext = false;
    }

    /**
     * Scan the next line of the statement.
     *
     * @return true when the statement ends with this line
     */
    public boolean feed(String line) {
        // a backslash ending the previous line escaped the line break itself
        escapeNext = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (escapeNext) {
                escapeNext = false;
                continue;
            }
            if (c == '\\') {
                escapeNext = true;
                continue;
            }
            if (c == '\'' && !inDoubleQuote) {
                inSingleQuote = !inSingleQuote;
            } else if (c == '"' && !inSingleQuote) {
                inDoubleQuote = !inDoubleQuote;
            } else if (!inSingleQuote && !inDoubleQuote) {
                if (c == '(') {
                    parenDepth++;
                } else if (c == ')') {
                    parenDepth--;
                }
            }
        }
        return !isInsideLiteral() && parenDepth <= 0 && line.trim().endsWith(";");
    }

    public boolean isInsideLiteral() {
        return inSingleQuote || inDoubleQuote;
    }
}
