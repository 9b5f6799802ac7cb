package com.sqldumpextract;

import java.io.InputStream;

import me.tongfei.progressbar.ProgressBar;
import me.tongfei.progressbar.ProgressBarBuilder;
import me.tongfei.progressbar.ProgressBarStyle;

/**
 * Factory for creating progress bars that respect debug mode.
 * In debug mode, progress bars are disabled.
 */
public class ProgressBarFactory {
    private final boolean debug;

    public ProgressBarFactory(boolean debug) {
        this.debug = debug;
    }

    public ProgressBarBuilder builder(String taskName, long maxValue, String unit) {
        ProgressBarBuilder builder = new ProgressBarBuilder()
                .setTaskName(taskName)
                .setInitialMax(maxValue)
                .setUnit(unit, 1)
                .setStyle(ProgressBarStyle.ASCII);
        if (debug) {
            builder.setConsumer(new NoOpProgressBarConsumer());
        }
        return builder;
    }

    /**
     * Wrap a dump stream so reading it advances a byte-count progress bar,
     * which closes with the stream.
     */
    public InputStream wrap(InputStream in, String taskName, long sizeBytes) {
        return ProgressBar.wrap(in, builder(taskName, sizeBytes, " bytes"));
    }
}
