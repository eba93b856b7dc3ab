package com.underscoreresearch.basebackup.source;

import java.time.Instant;
import java.util.List;

import lombok.Builder;
import lombok.Data;

import com.underscoreresearch.basebackup.model.Lsn;
import com.underscoreresearch.basebackup.model.Tablespace;

@Data
@Builder
public class BackupStart {
    private final Lsn startLsn;
    private final Lsn checkpointLsn;
    private final int timeline;
    private final Instant startTime;
    private final List<Tablespace> tablespaces;
}
