package com.sqldumpextract;

/**
 * Decodes a single SQL literal from a VALUES clause.
 * <p>
 * Handles quoted strings (single or double quotes, backslash escapes and
 * doubled quotes), the unquoted {@code NULL} keyword, and bare tokens such as
 * numbers, which are passed through as text. A charset introducer in front of
 * a quoted string ({@code _binary 'abc'}) is dropped.
 */
public final class ValueTokenizer {

    private ValueTokenizer() {
    }

    /**
     * Parse the value starting at {@code start}, skipping leading whitespace.
     *
     * @return the decoded value and the offset right after it (after the
     *         closing quote, or at the delimiter ending a bare token)
     * @throws MalformedLiteralException if the buffer ends before a value
     *                                   starts or inside a quoted literal
     */
    public static ParsedValue parse(String text, int start) throws MalformedLiteralException {
        int i = skipWhitespace(text, start);
        if (i >= text.length()) {
            throw new MalformedLiteralException("expected a value", i);
        }
        if (isNullKeyword(text, i)) {
            return new ParsedValue(null, i + 4);
        }
        char c = text.charAt(i);
        if (c == '\'' || c == '"') {
            return parseQuoted(text, i);
        }
        int quoteAt = introducedQuote(text, i);
        if (quoteAt >= 0) {
            return parseQuoted(text, quoteAt);
        }
        return parseBare(text, i);
    }

    static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isNullKeyword(String text, int i) {
        if (!text.regionMatches(true, i, "NULL", 0, 4)) {
            return false;
        }
        int next = skipWhitespace(text, i + 4);
        return next >= text.length() || text.charAt(next) == ',' || text.charAt(next) == ')';
    }

    private static ParsedValue parseQuoted(String text, int start) throws MalformedLiteralException {
        char quote = text.charAt(start);
        int len = text.length();
        StringBuilder value = new StringBuilder();
        int i = start + 1;
        while (i < len) {
            char c = text.charAt(i);
            if (c == '\\') {
                if (i + 1 >= len) {
                    throw new MalformedLiteralException("dangling escape in quoted literal", i);
                }
                value.append(unescape(text.charAt(i + 1)));
                i += 2;
                continue;
            }
            if (c == quote) {
                if (i + 1 < len && text.charAt(i + 1) == quote) {
                    value.append(quote);
                    i += 2;
                    continue;
                }
                return new ParsedValue(value.toString(), i + 1);
            }
            value.append(c);
            i++;
        }
        throw new MalformedLiteralException("unterminated quoted literal", start);
    }

    private static char unescape(char c) {
        switch (c) {
            case 'n':
                return '\n';
            case 't':
                return '\t';
            case 'r':
                return '\r';
            case '0':
                return '\0';
            default:
                // backslash, either quote, and anything else stand for themselves
                return c;
        }
    }

    private static ParsedValue parseBare(String text, int start) {
        int i = start;
        while (i < text.length() && text.charAt(i) != ',' && text.charAt(i) != ')') {
            i++;
        }
        return new ParsedValue(text.substring(start, i).trim(), i);
    }

    /**
     * Offset of the opening quote when {@code start} begins an introducer such
     * as {@code _utf8mb4'x'} or {@code _binary 'x'}, otherwise -1.
     */
    private static int introducedQuote(String text, int start) {
        if (text.charAt(start) != '_') {
            return -1;
        }
        int i = start + 1;
        while (i < text.length() && Character.isLetterOrDigit(text.charAt(i))) {
            i++;
        }
        if (i == start + 1) {
            return -1;
        }
        i = skipWhitespace(text, i);
        if (i < text.length() && (text.charAt(i) == '\'' || text.charAt(i) == '"')) {
            return i;
        }
        return -1;
    }
}
