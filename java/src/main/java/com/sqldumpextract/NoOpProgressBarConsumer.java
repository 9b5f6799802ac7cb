package com.sqldumpextract;

import me.tongfei.progressbar.ProgressBarConsumer;

/**
 * Swallows progress bar output; used in debug mode, where log lines go to the
 * console instead.
 */
public class NoOpProgressBarConsumer implements ProgressBarConsumer {
    @Override
    public int getMaxRenderedLength() {
        return 0;
    }

    @Override
    public void accept(String str) {
        // Do nothing
    }

    @Override
    public void close() {
        // Do nothing
    }
}
