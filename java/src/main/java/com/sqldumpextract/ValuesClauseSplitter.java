package com.sqldumpextract;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily splits the text following {@code VALUES} (without the terminating
 * semicolon) into tuples.
 * <p>
 * A tuple that fails to decode is yielded as a malformed {@link ParsedTuple};
 * scanning then resumes after its matching top-level {@code )}, or at the end
 * of the clause when none can be found.
 */
public class ValuesClauseSplitter implements Iterable<ParsedTuple> {
    private final String clause;

    public ValuesClauseSplitter(String clause) {
        this.clause = clause;
    }

    @Override
    public Iterator<ParsedTuple> iterator() {
        return new Iterator<>() {
            private int pos = 0;
            private ParsedTuple next;

            {
                advance();
            }

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public ParsedTuple next() {
                if (next == null) {
                    throw new NoSuchElementException();
                }
                ParsedTuple result = next;
                advance();
                return result;
            }

            private void advance() {
                next = null;
                pos = skipSeparators(pos);
                if (pos >= clause.length()) {
                    return;
                }
                if (clause.charAt(pos) != '(') {
                    int open = findOpen(pos);
                    int resume = open < 0 ? clause.length() : open;
                    next = ParsedTuple.malformed(pos, resume,
                            "expected '(' but found '" + clause.charAt(pos) + "' at offset " + pos);
                    pos = resume;
                    return;
                }
                try {
                    next = TupleTokenizer.parse(clause, pos);
                    pos = next.end();
                } catch (MalformedLiteralException e) {
                    int resume = recoveryPoint(pos);
                    next = ParsedTuple.malformed(pos, resume, e.getMessage());
                    pos = resume;
                }
            }
        };
    }

    private int skipSeparators(int from) {
        int i = from;
        while (i < clause.length() && (clause.charAt(i) == ',' || Character.isWhitespace(clause.charAt(i)))) {
            i++;
        }
        return i;
    }

    /**
     * Offset just past the top-level {@code )} closing the tuple opened at
     * {@code open}, tracking quotes and escapes, or the clause length.
     */
    private int recoveryPoint(int open) {
        boolean inSingleQuote = false;
        boolean inDoubleQuote = false;
        boolean escapeNext = false;
        int parenDepth = 0;

        for (int i = open; i < clause.length(); i++) {
            char c = clause.charAt(i);
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
                    if (parenDepth == 0) {
                        return i + 1;
                    }
                }
            }
        }
        return clause.length();
    }

    private int findOpen(int from) {
        boolean inSingleQuote = false;
        boolean inDoubleQuote = false;
        for (int i = from; i < clause.length(); i++) {
            char c = clause.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '\'' && !inDoubleQuote) {
                inSingleQuote = !inSingleQuote;
            } else if (c == '"' && !inSingleQuote) {
                inDoubleQuote = !inDoubleQuote;
            } else if (c == '(' && !inSingleQuote && !inDoubleQuote) {
                return i;
            }
        }
        return -1;
    }
}
