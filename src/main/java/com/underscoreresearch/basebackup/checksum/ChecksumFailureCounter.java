package com.underscoreresearch.basebackup.checksum;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.google.common.collect.ImmutableList;

/**
 * Counts page checksum failures for a whole backup session. Only the first few failures are
 * reported individually.
 */
@Slf4j
public class ChecksumFailureCounter {
    public static final int MAX_REPORTED_FAILURES = 5;

    private final List<ChecksumDiagnostic> diagnostics = new ArrayList<>();
    private long failures;

    public synchronized void recordFailure(String path, long block, int calculated, int expected) {
        failures++;
        if (failures <= MAX_REPORTED_FAILURES) {
            report(ChecksumDiagnostic.Kind.PAGE, String.format(
                    "checksum verification failed in file \"%s\", block %d: calculated %X but expected %X",
                    path, block, calculated, expected));
        } else if (failures == MAX_REPORTED_FAILURES + 1) {
            report(ChecksumDiagnostic.Kind.SUPPRESSED,
                    "further checksum verification failures in this backup will not be reported");
        }
    }

    public synchronized void recordUnverifiable(String message) {
        report(ChecksumDiagnostic.Kind.UNVERIFIABLE, message);
    }

    /**
     * Emits the session summary. Does nothing when no failure was seen.
     */
    public synchronized void reportTotal() {
        if (failures > 0) {
            report(ChecksumDiagnostic.Kind.TOTAL,
                    String.format("%d total checksum verification failures", failures));
        }
    }

    public synchronized long getFailures() {
        return failures;
    }

    public synchronized List<ChecksumDiagnostic> getDiagnostics() {
        return ImmutableList.copyOf(diagnostics);
    }

    public synchronized long count(ChecksumDiagnostic.Kind kind) {
        return diagnostics.stream().filter(diagnostic -> diagnostic.getKind() == kind).count();
    }

    private void report(ChecksumDiagnostic.Kind kind, String message) {
        diagnostics.add(new ChecksumDiagnostic(kind, message));
        log.warn(message);
    }
}
