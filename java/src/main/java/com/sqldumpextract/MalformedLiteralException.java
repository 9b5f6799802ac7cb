package com.sqldumpextract;

/**
 * Raised when a VALUES clause cannot be decoded at a given offset, e.g. an
 * unterminated quoted string or a tuple that never closes.
 */
public class MalformedLiteralException extends Exception {
    private final int offset;

    public MalformedLiteralException(String message, int offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
