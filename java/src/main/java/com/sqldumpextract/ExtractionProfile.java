package com.sqldumpextract;

import java.util.ArrayList;
import java.util.List;

/**
 * One named set of extraction settings from a YAML profile file. Unset values
 * fall back to the command-line defaults.
 */
public class ExtractionProfile {
    private String format;
    private String charset;
    private List<String> tables = new ArrayList<>();
    private int max_warnings = ExtractionOptions.DEFAULT_MAX_WARNINGS;
    private SqliteProfile sqlite = new SqliteProfile();

    public ExtractionProfile() {
    }

    public String format() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public String charset() {
        return charset;
    }

    public void setCharset(String charset) {
        this.charset = charset;
    }

    public List<String> tables() {
        return tables;
    }

    public void setTables(List<String> tables) {
        this.tables = tables != null ? tables : new ArrayList<>();
    }

    public int max_warnings() {
        return max_warnings;
    }

    public void setMax_warnings(int max_warnings) {
        this.max_warnings = max_warnings;
    }

    public SqliteProfile sqlite() {
        return sqlite;
    }

    public void setSqlite(SqliteProfile sqlite) {
        this.sqlite = sqlite != null ? sqlite : new SqliteProfile();
    }
}
