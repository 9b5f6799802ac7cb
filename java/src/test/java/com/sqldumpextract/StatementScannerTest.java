package com.sqldumpextract;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StatementScannerTest {

    @Test
    void feed_singleLineStatement_endsOnSemicolon() {
        StatementScanner scanner = new StatementScanner();
        assertTrue(scanner.feed("INSERT INTO `t` VALUES (1,'a'),(2,'b');"));
    }

    @Test
    void feed_semicolonInsideQuotedValue_doesNotEndStatement() {
        StatementScanner scanner = new StatementScanner();
        assertFalse(scanner.feed("INSERT INTO `t` VALUES (1,'first line;"));
        assertTrue(scanner.isInsideLiteral());
        assertTrue(scanner.feed("second line');"));
        assertFalse(scanner.isInsideLiteral());
    }

    @Test
    void feed_tuplesOnSeparateLines_endAfterLastTuple() {
        StatementScanner scanner = new StatementScanner();
        assertFalse(scanner.feed("INSERT INTO `t` VALUES"));
        assertFalse(scanner.feed("(1,'a'),"));
        assertTrue(scanner.feed("(2,'b');"));
    }

    @Test
    void feed_escapedQuote_keepsLiteralOpen() {
        StatementScanner scanner = new StatementScanner();
        assertFalse(scanner.feed("INSERT INTO `t` VALUES (1,'it\\'s;"));
        assertTrue(scanner.isInsideLiteral());
    }

    @Test
    void reset_clearsOpenLiteral() {
        StatementScanner scanner = new StatementScanner();
        scanner.feed("INSERT INTO `t` VALUES (1,'open");
        scanner.reset();
        assertFalse(scanner.isInsideLiteral());
        assertTrue(scanner.feed("INSERT INTO `t` VALUES (1);"));
    }
}
