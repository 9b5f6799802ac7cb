package com.sqldumpextract;

/**
 * SQLite tuning for the {@code sqlite} output format.
 */
public class SqliteProfile {
    private int cache_kb = 200000;
    private int mmap_mb = 128;
    private int batch = 1000;

    public SqliteProfile() {
    }

    public int cache_kb() {
        return cache_kb;
    }

    public void setCache_kb(int cache_kb) {
        this.cache_kb = cache_kb;
    }

    public int mmap_mb() {
        return mmap_mb;
    }

    public void setMmap_mb(int mmap_mb) {
        this.mmap_mb = mmap_mb;
    }

    public int batch() {
        return batch;
    }

    public void setBatch(int batch) {
        this.batch = batch;
    }
}
