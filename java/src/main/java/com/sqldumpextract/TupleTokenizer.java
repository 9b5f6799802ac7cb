package com.sqldumpextract;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one {@code (v1, v2, ...)} tuple into decoded fields.
 * <p>
 * All scanning inside literals is delegated to {@link ValueTokenizer}, so a
 * parenthesis or comma inside a quoted value never ends a field or the tuple.
 */
public final class TupleTokenizer {

    private TupleTokenizer() {
    }

    /**
     * Parse the tuple whose opening parenthesis is at {@code open}.
     *
     * @throws MalformedLiteralException if a value is malformed, a value is
     *                                   followed by anything but {@code ,} or
     *                                   {@code )}, or the tuple never closes
     */
    public static ParsedTuple parse(String text, int open) throws MalformedLiteralException {
        if (open >= text.length() || text.charAt(open) != '(') {
            throw new MalformedLiteralException("expected '('", open);
        }
        List<String> values = new ArrayList<>();
        int i = ValueTokenizer.skipWhitespace(text, open + 1);
        if (i < text.length() && text.charAt(i) == ')') {
            return ParsedTuple.of(values, open, i + 1);
        }
        while (true) {
            ParsedValue value = ValueTokenizer.parse(text, i);
            values.add(value.text());
            i = ValueTokenizer.skipWhitespace(text, value.end());
            if (i >= text.length()) {
                throw new MalformedLiteralException("unterminated tuple", open);
            }
            char c = text.charAt(i);
            if (c == ')') {
                return ParsedTuple.of(values, open, i + 1);
            }
            if (c != ',') {
                throw new MalformedLiteralException("unexpected '" + c + "' after value", i);
            }
            i++;
        }
    }
}
