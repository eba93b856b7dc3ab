package com.underscoreresearch.basebackup.checksum;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ChecksumDiagnostic {
    private final Kind kind;
    private final String message;

    public enum Kind {
        PAGE,
        SUPPRESSED,
        UNVERIFIABLE,
        TOTAL
    }
}
