package com.sqldumpextract;

/**
 * One decoded SQL literal and the offset just past it.
 * <p>
 * A {@code null} text is the SQL {@code NULL} keyword; {@code ''} decodes to
 * the empty string.
 */
public record ParsedValue(
        String text,
        int end) {

    public boolean isNull() {
        return text == null;
    }
}
