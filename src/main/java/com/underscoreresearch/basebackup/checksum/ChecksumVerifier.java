package com.underscoreresearch.basebackup.checksum;

import static com.underscoreresearch.basebackup.utils.LogUtil.debug;

import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.basebackup.file.PathClassifier;
import com.underscoreresearch.basebackup.model.Lsn;

/**
 * Verifies the pages of one relation file as they are copied. Feed it the file in chunks of
 * exactly one block; a shorter chunk can only be the last one.
 */
@Slf4j
public class ChecksumVerifier {
    public static final long RELATION_SEGMENT_BYTES = 1024L * 1024 * 1024;

    private final ChecksumFailureCounter counter;
    private final String path;
    private final int blockSize;
    private final Lsn startLsn;
    private final long firstBlock;
    private long block;
    private boolean stopped;

    public ChecksumVerifier(ChecksumFailureCounter counter, String path, int blockSize, Lsn startLsn) {
        this.counter = counter;
        this.path = path;
        this.blockSize = blockSize;
        this.startLsn = startLsn;

        int segment = PathClassifier.segmentNumber(PathClassifier.fileName(path));
        if (segment < 0) {
            counter.recordUnverifiable(String.format("invalid segment number in file \"%s\"", path));
            stopped = true;
            firstBlock = 0;
        } else {
            firstBlock = segment * (RELATION_SEGMENT_BYTES / blockSize);
        }
    }

    public void verify(byte[] buffer, int length) {
        if (stopped) {
            return;
        }
        if (length != blockSize) {
            counter.recordUnverifiable(String.format(
                    "could not verify checksum in file \"%s\", block %d: read buffer size %d and page size %d differ",
                    path, block, length, blockSize));
            stopped = true;
            return;
        }

        long blockNumber = firstBlock + block;
        block++;

        if (PageChecksum.isAllZero(buffer, 0, blockSize)) {
            return;
        }
        if (Long.compareUnsigned(PageChecksum.pageLsn(buffer, 0), startLsn.getValue()) >= 0) {
            debug(() -> log.debug("Skipping page {} of \"{}\" modified during backup", blockNumber, path));
            return;
        }

        int expected = PageChecksum.storedChecksum(buffer, 0);
        int calculated = PageChecksum.compute(buffer, 0, blockSize, blockNumber);
        if (expected != calculated) {
            counter.recordFailure(path, blockNumber - firstBlock, calculated, expected);
        }
    }
}
