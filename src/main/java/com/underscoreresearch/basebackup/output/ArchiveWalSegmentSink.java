package com.underscoreresearch.basebackup.output;

import java.io.IOException;
import java.io.OutputStream;

import com.underscoreresearch.basebackup.wal.WalSegmentName;
import com.underscoreresearch.basebackup.wal.WalSegmentSink;

/**
 * Stores WAL segments as files of an archive, optionally below a directory prefix.
 */
public class ArchiveWalSegmentSink implements WalSegmentSink {
    private final OutputArchive archive;
    private final String prefix;

    public ArchiveWalSegmentSink(OutputArchive archive, String prefix) {
        this.archive = archive;
        this.prefix = prefix;
    }

    @Override
    public OutputStream openSegment(WalSegmentName segment, long size, long lastModified) throws IOException {
        return archive.file(prefix + segment.toString(), size, lastModified);
    }
}
