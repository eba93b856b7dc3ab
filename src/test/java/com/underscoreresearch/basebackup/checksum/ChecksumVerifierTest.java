package com.underscoreresearch.basebackup.checksum;

import static com.underscoreresearch.basebackup.checksum.PageChecksumTest.BLOCK_SIZE;
import static com.underscoreresearch.basebackup.checksum.PageChecksumTest.patternPage;
import static com.underscoreresearch.basebackup.checksum.PageChecksumTest.storeChecksum;
import static org.hamcrest.MatcherAssert.assertThat;

import org.hamcrest.Matchers;
import org.hamcrest.core.Is;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.underscoreresearch.basebackup.model.Lsn;

class ChecksumVerifierTest {
    private static final Lsn START_LSN = Lsn.parse("0/1000028");
    private ChecksumFailureCounter counter;

    @BeforeEach
    public void setup() {
        counter = new ChecksumFailureCounter();
    }

    private static byte[] validPage(long blockNumber) {
        byte[] page = patternPage();
        storeChecksum(page, PageChecksum.compute(page, 0, BLOCK_SIZE, blockNumber));
        return page;
    }

    @Test
    public void testDetectsCorruption() {
        ChecksumVerifier verifier = new ChecksumVerifier(counter, "base/5/16384", BLOCK_SIZE, START_LSN);
        verifier.verify(validPage(0), BLOCK_SIZE);
        byte[] corrupt = validPage(1);
        corrupt[4000] ^= 0x55;
        verifier.verify(corrupt, BLOCK_SIZE);
        verifier.verify(new byte[BLOCK_SIZE], BLOCK_SIZE);

        assertThat(counter.getFailures(), Is.is(1L));
        assertThat(counter.getDiagnostics().get(0).getMessage(), Matchers.startsWith(
                "checksum verification failed in file \"base/5/16384\", block 1: calculated "));
    }

    @Test
    public void testPagesNewerThanBackupStartSkipped() {
        ChecksumVerifier verifier = new ChecksumVerifier(counter, "base/5/16384", BLOCK_SIZE, START_LSN);
        byte[] page = patternPage();
        page[0] = 0x01;
        storeChecksum(page, 1);
        verifier.verify(page, BLOCK_SIZE);

        assertThat(counter.getFailures(), Is.is(0L));
    }

    @Test
    public void testSegmentOffset() {
        ChecksumVerifier verifier = new ChecksumVerifier(counter, "base/5/16384.1", BLOCK_SIZE, START_LSN);
        verifier.verify(validPage(ChecksumVerifier.RELATION_SEGMENT_BYTES / BLOCK_SIZE), BLOCK_SIZE);

        assertThat(counter.getFailures(), Is.is(0L));
    }

    @Test
    public void testUnverifiable() {
        ChecksumVerifier verifier = new ChecksumVerifier(counter, "base/5/16384", BLOCK_SIZE, START_LSN);
        verifier.verify(validPage(0), 100);
        byte[] corrupt = validPage(1);
        corrupt[4000] ^= 0x55;
        verifier.verify(corrupt, BLOCK_SIZE);

        assertThat(counter.getFailures(), Is.is(0L));
        assertThat(counter.count(ChecksumDiagnostic.Kind.UNVERIFIABLE), Is.is(1L));

        new ChecksumVerifier(counter, "base/5/16384.x", BLOCK_SIZE, START_LSN).verify(corrupt, BLOCK_SIZE);
        assertThat(counter.count(ChecksumDiagnostic.Kind.UNVERIFIABLE), Is.is(2L));
        assertThat(counter.getFailures(), Is.is(0L));
    }

    @Test
    public void testReportingCapped() {
        for (int i = 0; i < 7; i++) {
            counter.recordFailure("base/5/16384", i, 1, 2);
        }
        counter.reportTotal();

        assertThat(counter.getFailures(), Is.is(7L));
        assertThat(counter.count(ChecksumDiagnostic.Kind.PAGE), Is.is((long) ChecksumFailureCounter.MAX_REPORTED_FAILURES));
        assertThat(counter.count(ChecksumDiagnostic.Kind.SUPPRESSED), Is.is(1L));
        assertThat(counter.getDiagnostics().get(counter.getDiagnostics().size() - 1).getMessage(),
                Is.is("7 total checksum verification failures"));
    }

    @Test
    public void testNoTotalWithoutFailures() {
        counter.reportTotal();
        assertThat(counter.getDiagnostics().isEmpty(), Is.is(true));
    }
}
