package com.underscoreresearch.basebackup.session;

import static com.underscoreresearch.basebackup.utils.LogUtil.readableProgress;

import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

import com.google.common.base.Stopwatch;

/**
 * Reports copy progress at most once a second.
 */
@Slf4j
public class ProgressReporter {
    private static final long REPORT_INTERVAL_MILLIS = 1000;

    private final long totalSize;
    private final int tablespaces;
    private final Stopwatch sinceReport = Stopwatch.createStarted();
    private long completed;
    private int tablespacesDone;

    public ProgressReporter(long totalSize, int tablespaces) {
        this.totalSize = totalSize;
        this.tablespaces = tablespaces;
    }

    public void bytesCopied(long bytes) {
        completed += bytes;
        if (sinceReport.elapsed(TimeUnit.MILLISECONDS) >= REPORT_INTERVAL_MILLIS) {
            report();
        }
    }

    public void tablespaceDone() {
        tablespacesDone++;
        report();
    }

    public void report() {
        log.info(readableProgress(completed, Math.max(completed, totalSize), tablespacesDone, tablespaces));
        sinceReport.reset().start();
    }
}
