package com.underscoreresearch.basebackup.wal;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.underscoreresearch.basebackup.model.Lsn;
import com.underscoreresearch.basebackup.source.DataSource;
import com.underscoreresearch.basebackup.utils.BackupAbortedException;

/**
 * Streams WAL in the background while the data files are copied. The end of the stream is
 * published once through {@link #finish(Lsn)}.
 */
@Slf4j
public class WalCaptureManager {
    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    private final DataSource source;
    private final Lsn startLsn;
    private final int timeline;
    private final String slot;
    private final WalSegmentSink sink;
    private final CompletableFuture<Lsn> stopBarrier = new CompletableFuture<>();
    private ExecutorService executor;
    private Future<?> task;
    private Stopwatch stopwatch;

    public WalCaptureManager(DataSource source, Lsn startLsn, int timeline, String slot, WalSegmentSink sink) {
        this.source = source;
        this.startLsn = startLsn;
        this.timeline = timeline;
        this.slot = slot;
        this.sink = sink;
    }

    public synchronized void start() {
        if (task != null) {
            throw new IllegalStateException("WAL capture already started");
        }
        executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("WalStreamer-%d").setDaemon(true).build());
        stopwatch = Stopwatch.createStarted();
        task = executor.submit(() -> {
            source.streamWal(startLsn, timeline, slot, stopBarrier, sink);
            return null;
        });
        log.info("Started WAL streaming from {} on timeline {}", startLsn, timeline);
    }

    /**
     * True once the streaming task ended with an error before being told to stop.
     */
    public boolean isFailed() {
        return getFailure() != null;
    }

    /**
     * Publishes the end LSN and waits for the streaming task to write everything up to it.
     */
    public void finish(Lsn endLsn) throws IOException {
        Future<?> current;
        synchronized (this) {
            if (task == null) {
                throw new IllegalStateException("WAL capture not started");
            }
            current = task;
        }
        stopBarrier.complete(endLsn);
        try {
            current.get();
            log.info("WAL streaming completed at {} in {}", endLsn, stopwatch);
        } catch (ExecutionException exc) {
            Throwable cause = exc.getCause();
            if (cause instanceof IOException) {
                throw new IOException("WAL streaming failed: " + cause.getMessage(), cause);
            }
            throw new BackupAbortedException("WAL streaming failed: " + cause.getMessage(), cause);
        } catch (CancellationException exc) {
            throw new BackupAbortedException("WAL streaming was cancelled", exc);
        } catch (InterruptedException exc) {
            Thread.currentThread().interrupt();
            throw new BackupAbortedException("Interrupted waiting for WAL streaming", exc);
        } finally {
            shutdown();
        }
    }

    public synchronized Throwable getFailure() {
        if (task == null || !task.isDone() || task.isCancelled()) {
            return null;
        }
        try {
            task.get();
            return null;
        } catch (ExecutionException exc) {
            return exc.getCause();
        } catch (InterruptedException exc) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    public void cancel() {
        synchronized (this) {
            if (task == null) {
                return;
            }
            task.cancel(true);
        }
        shutdown();
        log.info("WAL streaming cancelled");
    }

    private void shutdown() {
        ExecutorService current;
        synchronized (this) {
            current = executor;
        }
        if (current == null) {
            return;
        }
        current.shutdownNow();
        try {
            if (!current.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("WAL streaming task did not stop in time");
            }
        } catch (InterruptedException exc) {
            Thread.currentThread().interrupt();
        }
    }
}
