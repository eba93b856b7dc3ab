package com.underscoreresearch.basebackup.wal;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.hamcrest.core.Is;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.underscoreresearch.basebackup.model.Lsn;
import com.underscoreresearch.basebackup.source.DataSource;

class WalCaptureManagerTest {
    private static final Lsn START = Lsn.parse("0/1000028");
    private static final Lsn END = Lsn.parse("0/2000000");
    private DataSource source;
    private WalSegmentSink sink;

    @BeforeEach
    public void setup() throws IOException {
        source = mock(DataSource.class);
        sink = mock(WalSegmentSink.class);
        when(sink.openSegment(any(), anyLong(), anyLong())).thenReturn(new ByteArrayOutputStream());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testStreamsUntilEnd() throws Exception {
        doAnswer(invocation -> {
            CompletableFuture<Lsn> stop = invocation.getArgument(3);
            WalSegmentSink target = invocation.getArgument(4);
            Lsn end = stop.get();
            WalSegmentName segment = WalSegmentName.containing(1, START, WalSegmentName.DEFAULT_SEGMENT_SIZE);
            while (segment.getStart().compareTo(end) < 0) {
                try (OutputStream out = target.openSegment(segment, 0, 0)) {
                    out.write(1);
                }
                segment = segment.next();
            }
            return null;
        }).when(source).streamWal(eq(START), eq(1), eq("slot1"), any(CompletableFuture.class), any());

        WalCaptureManager manager = new WalCaptureManager(source, START, 1, "slot1", sink);
        manager.start();
        assertThat(manager.isFailed(), Is.is(false));
        manager.finish(END);

        verify(sink).openSegment(eq(new WalSegmentName(1, 1, WalSegmentName.DEFAULT_SEGMENT_SIZE)), anyLong(),
                anyLong());
        assertThat(manager.isFailed(), Is.is(false));
    }

    @Test
    public void testFailureObserved() throws Exception {
        doAnswer(invocation -> {
            throw new IOException("connection lost");
        }).when(source).streamWal(any(), anyInt(), any(), any(), any());

        WalCaptureManager manager = new WalCaptureManager(source, START, 1, null, sink);
        manager.start();
        long deadline = System.currentTimeMillis() + 10000;
        while (!manager.isFailed() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(manager.isFailed(), Is.is(true));
        assertThat(manager.getFailure().getMessage(), Is.is("connection lost"));

        IOException exc = assertThrows(IOException.class, () -> manager.finish(END));
        assertThat(exc.getMessage(), Is.is("WAL streaming failed: connection lost"));
    }

    @Test
    public void testCancel() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        doAnswer(invocation -> {
            started.countDown();
            try {
                Thread.sleep(60000);
            } catch (InterruptedException exc) {
                interrupted.countDown();
                throw exc;
            }
            return null;
        }).when(source).streamWal(any(), anyInt(), any(), any(), any());

        WalCaptureManager manager = new WalCaptureManager(source, START, 1, null, sink);
        manager.start();
        assertThat(started.await(10, TimeUnit.SECONDS), Is.is(true));
        manager.cancel();

        assertThat(interrupted.await(10, TimeUnit.SECONDS), Is.is(true));
        assertThat(manager.isFailed(), Is.is(false));
    }

    @Test
    public void testFinishBeforeStart() {
        WalCaptureManager manager = new WalCaptureManager(source, START, 1, null, sink);
        assertThrows(IllegalStateException.class, () -> manager.finish(END));
    }
}
