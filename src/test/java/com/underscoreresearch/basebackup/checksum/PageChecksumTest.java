package com.underscoreresearch.basebackup.checksum;

import static org.hamcrest.MatcherAssert.assertThat;

import org.hamcrest.core.Is;
import org.junit.jupiter.api.Test;

class PageChecksumTest {
    static final int BLOCK_SIZE = 8192;

    static byte[] patternPage() {
        byte[] page = new byte[BLOCK_SIZE];
        for (int i = 10; i < BLOCK_SIZE; i++) {
            page[i] = (byte) ((i * 7 + 3) % 256);
        }
        return page;
    }

    static void storeChecksum(byte[] page, int checksum) {
        page[PageChecksum.CHECKSUM_OFFSET] = (byte) checksum;
        page[PageChecksum.CHECKSUM_OFFSET + 1] = (byte) (checksum >> 8);
    }

    @Test
    public void testKnownValues() {
        byte[] page = patternPage();
        assertThat(PageChecksum.compute(page, 0, BLOCK_SIZE, 0), Is.is(318));
        assertThat(PageChecksum.compute(page, 0, BLOCK_SIZE, 5), Is.is(315));

        byte[] sparse = new byte[BLOCK_SIZE];
        sparse[100] = 1;
        assertThat(PageChecksum.compute(sparse, 0, BLOCK_SIZE, 0), Is.is(44015));
    }

    @Test
    public void testStoredChecksumIgnored() {
        byte[] page = patternPage();
        int checksum = PageChecksum.compute(page, 0, BLOCK_SIZE, 3);
        storeChecksum(page, checksum);
        assertThat(PageChecksum.storedChecksum(page, 0), Is.is(checksum));
        assertThat(PageChecksum.compute(page, 0, BLOCK_SIZE, 3), Is.is(checksum));
    }

    @Test
    public void testHeaderFields() {
        byte[] page = new byte[BLOCK_SIZE];
        page[0] = 0x01;
        page[4] = 0x28;
        page[PageChecksum.UPPER_OFFSET] = 0x00;
        page[PageChecksum.UPPER_OFFSET + 1] = 0x20;
        assertThat(PageChecksum.pageLsn(page, 0), Is.is(0x100000028L));
        assertThat(PageChecksum.pageUpper(page, 0), Is.is(0x2000));
        assertThat(PageChecksum.isAllZero(page, 0, BLOCK_SIZE), Is.is(false));
        assertThat(PageChecksum.isAllZero(new byte[BLOCK_SIZE], 0, BLOCK_SIZE), Is.is(true));
    }
}
