package com.underscoreresearch.basebackup.checksum;

/**
 * PostgreSQL data page checksum. The page is processed as 32 parallel FNV-1a style sums over
 * little endian 32 bit words, with the {@code pd_checksum} field treated as zero and the block
 * number mixed into the result.
 */
public final class PageChecksum {
    public static final int CHECKSUM_OFFSET = 8;
    public static final int UPPER_OFFSET = 14;

    private static final int N_SUMS = 32;
    private static final int FNV_PRIME = 16777619;
    private static final int[] CHECKSUM_BASE_OFFSETS = {
            0x5B1F36E9, 0xB8525960, 0x02AB50AA, 0x1DE66D2A,
            0x79FF467A, 0x9BB9F8A3, 0x217E7CD2, 0x83E13D2C,
            0xF8D4474F, 0xE39EB970, 0x42C6AE16, 0x993216FA,
            0x7B093B5D, 0x98DAFF3C, 0xF718902A, 0x0B1C9CDB,
            0xE58F764B, 0x187636BC, 0x5D7B3BB1, 0xE73DE7DE,
            0x92BEC979, 0xCCA6C0B2, 0x304A0979, 0x85AA43D4,
            0x783125BB, 0x6CA8EAA2, 0xE407EAC6, 0x4B5CFC3E,
            0x9FBF8C76, 0x15CA20BE, 0xF2CA9FFF, 0x3ED2B84E
    };

    private PageChecksum() {
    }

    /**
     * Computes the checksum of the page stored at {@code offset}. The result is always in the
     * range 1 to 65535.
     */
    public static int compute(byte[] page, int offset, int blockSize, long blockNumber) {
        int[] sums = CHECKSUM_BASE_OFFSETS.clone();
        int rows = blockSize / (4 * N_SUMS);
        int checksumWord = CHECKSUM_OFFSET / 4;

        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < N_SUMS; j++) {
                int word = i * N_SUMS + j;
                int value = readInt(page, offset + word * 4);
                if (word == checksumWord) {
                    // pd_checksum occupies the low half of this word.
                    value &= 0xFFFF0000;
                }
                sums[j] = mix(sums[j], value);
            }
        }
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < N_SUMS; j++) {
                sums[j] = mix(sums[j], 0);
            }
        }

        int result = 0;
        for (int sum : sums) {
            result ^= sum;
        }
        result ^= (int) blockNumber;
        return (int) (Integer.toUnsignedLong(result) % 65535) + 1;
    }

    public static int storedChecksum(byte[] page, int offset) {
        return readShort(page, offset + CHECKSUM_OFFSET);
    }

    public static long pageLsn(byte[] page, int offset) {
        long high = Integer.toUnsignedLong(readInt(page, offset));
        long low = Integer.toUnsignedLong(readInt(page, offset + 4));
        return (high << 32) | low;
    }

    public static int pageUpper(byte[] page, int offset) {
        return readShort(page, offset + UPPER_OFFSET);
    }

    public static boolean isAllZero(byte[] page, int offset, int blockSize) {
        for (int i = offset; i < offset + blockSize; i++) {
            if (page[i] != 0) {
                return false;
            }
        }
        return true;
    }

    private static int mix(int sum, int value) {
        int tmp = sum ^ value;
        return (tmp * FNV_PRIME) ^ (tmp >>> 17);
    }

    private static int readInt(byte[] data, int offset) {
        return (data[offset] & 0xFF)
                | (data[offset + 1] & 0xFF) << 8
                | (data[offset + 2] & 0xFF) << 16
                | (data[offset + 3] & 0xFF) << 24;
    }

    private static int readShort(byte[] data, int offset) {
        return (data[offset] & 0xFF) | (data[offset + 1] & 0xFF) << 8;
    }
}
