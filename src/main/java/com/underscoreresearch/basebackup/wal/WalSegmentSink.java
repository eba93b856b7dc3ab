package com.underscoreresearch.basebackup.wal;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Destination of captured WAL segments.
 */
public interface WalSegmentSink {
    /**
     * Opens a stream for one segment. The caller writes exactly {@code size} bytes and closes it.
     */
    OutputStream openSegment(WalSegmentName segment, long size, long lastModified) throws IOException;
}
