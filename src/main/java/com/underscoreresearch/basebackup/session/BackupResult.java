package com.underscoreresearch.basebackup.session;

import lombok.Builder;
import lombok.Data;

import com.underscoreresearch.basebackup.model.Lsn;

@Data
@Builder
public class BackupResult {
    public static final int SUCCESS = 0;
    public static final int FAILURE = 1;

    private final int exitCode;
    private final Lsn startLsn;
    private final Lsn endLsn;
    private final int timeline;
    private final long checksumFailures;
    private final long totalSize;

    public boolean isSuccessful() {
        return exitCode == SUCCESS;
    }
}
