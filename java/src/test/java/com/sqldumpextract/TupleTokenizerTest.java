package com.sqldumpextract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class TupleTokenizerTest {

    @Test
    void parse_parenthesisInsideQuotes_doesNotEndTuple() throws Exception {
        ParsedTuple tuple = TupleTokenizer.parse("('a)b', 2)", 0);
        assertEquals(List.of("a)b", "2"), tuple.values());
        assertEquals(10, tuple.end());
    }

    @Test
    void parse_keepsFieldOrderAndNulls() throws Exception {
        ParsedTuple tuple = TupleTokenizer.parse("( 1 , NULL ,'x, y' , '' )", 0);
        assertEquals(Arrays.asList("1", null, "x, y", ""), tuple.values());
        assertEquals(4, tuple.arity());
    }

    @Test
    void parse_emptyTuple_hasNoFields() throws Exception {
        ParsedTuple tuple = TupleTokenizer.parse("()", 0);
        assertTrue(tuple.values().isEmpty());
        assertEquals(2, tuple.end());
    }

    @Test
    void parse_startsAtGivenOffset() throws Exception {
        String clause = "(1,'x'),(2,'y')";
        ParsedTuple tuple = TupleTokenizer.parse(clause, 8);
        assertEquals(List.of("2", "y"), tuple.values());
        assertEquals(8, tuple.start());
        assertEquals(clause.length(), tuple.end());
    }

    @Test
    void parse_missingCloseParen_throws() {
        MalformedLiteralException ex = assertThrows(MalformedLiteralException.class,
                () -> TupleTokenizer.parse("(1, 2", 0));
        assertTrue(ex.getMessage().contains("unterminated tuple"));
    }

    @Test
    void parse_junkAfterQuotedValue_throwsAtJunkOffset() {
        MalformedLiteralException ex = assertThrows(MalformedLiteralException.class,
                () -> TupleTokenizer.parse("('a' b, 2)", 0));
        assertEquals(5, ex.getOffset());
    }

    @Test
    void parse_notAtOpenParen_throws() {
        assertThrows(MalformedLiteralException.class, () -> TupleTokenizer.parse("1, 2)", 0));
    }
}
