package com.underscoreresearch.basebackup.wal;

import java.util.regex.Pattern;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import com.underscoreresearch.basebackup.model.Lsn;

/**
 * Name of a WAL segment file, {@code TTTTTTTTXXXXXXXXYYYYYYYY} in upper case hex where
 * {@code T} is the timeline and {@code X/Y} split the segment number.
 */
@Getter
@EqualsAndHashCode
public final class WalSegmentName implements Comparable<WalSegmentName> {
    public static final long DEFAULT_SEGMENT_SIZE = 16 * 1024 * 1024;
    private static final Pattern FORMAT = Pattern.compile("^[0-9A-F]{24}$");
    private static final long LOG_ID_BYTES = 0x100000000L;

    private final int timeline;
    private final long segmentNumber;
    private final long segmentSize;

    public WalSegmentName(int timeline, long segmentNumber, long segmentSize) {
        this.timeline = timeline;
        this.segmentNumber = segmentNumber;
        this.segmentSize = segmentSize;
    }

    public static WalSegmentName containing(int timeline, Lsn lsn, long segmentSize) {
        return new WalSegmentName(timeline, Long.divideUnsigned(lsn.getValue(), segmentSize), segmentSize);
    }

    public static boolean isSegmentName(String name) {
        return FORMAT.matcher(name).matches();
    }

    public static WalSegmentName parse(String name, long segmentSize) {
        if (!isSegmentName(name)) {
            throw new IllegalArgumentException("Invalid WAL segment name \"" + name + "\"");
        }
        int timeline = (int) Long.parseLong(name.substring(0, 8), 16);
        long logId = Long.parseLong(name.substring(8, 16), 16);
        long segmentInLog = Long.parseLong(name.substring(16, 24), 16);
        return new WalSegmentName(timeline, logId * segmentsPerLogId(segmentSize) + segmentInLog, segmentSize);
    }

    private static long segmentsPerLogId(long segmentSize) {
        return LOG_ID_BYTES / segmentSize;
    }

    public Lsn getStart() {
        return Lsn.of(segmentNumber * segmentSize);
    }

    public WalSegmentName next() {
        return new WalSegmentName(timeline, segmentNumber + 1, segmentSize);
    }

    @Override
    public int compareTo(WalSegmentName other) {
        int ret = Integer.compareUnsigned(timeline, other.timeline);
        if (ret != 0) {
            return ret;
        }
        return Long.compare(segmentNumber, other.segmentNumber);
    }

    @Override
    public String toString() {
        long perLogId = segmentsPerLogId(segmentSize);
        return String.format("%08X%08X%08X", timeline, segmentNumber / perLogId, segmentNumber % perLogId);
    }
}
