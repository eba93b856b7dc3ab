package com.underscoreresearch.basebackup.model;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Validated and typed backup configuration. Only built by the configuration validator.
 */
@Data
@Builder(toBuilder = true)
public class BackupPlan {
    public static final String DEFAULT_LABEL = "basebackup base backup";

    private final Path directory;
    private final OutputFormat format;
    private final WalMode walMode;
    private final BackupTarget target;
    private final TablespaceMapping tablespaceMapping;
    private final CompressionSpec compression;
    private final String slot;
    private final boolean createSlot;
    private final boolean noSlot;
    private final boolean verifyChecksums;
    private final boolean writeRecoveryConf;
    private final boolean manifest;
    private final ManifestChecksumType manifestChecksums;
    private final Path walDirectory;
    private final boolean noClean;
    private final boolean noSync;
    private final CheckpointMode checkpoint;
    private final String label;
    private final boolean progress;
    private final String host;
    private final String port;
    private final String username;

    public boolean hasTarget() {
        return target != null;
    }

    /**
     * Compression applied to the produced archives. Server side compression in plain format is
     * undone before the files land on disk.
     */
    public CompressionSpec archiveCompression() {
        if (format == OutputFormat.PLAIN) {
            return CompressionSpec.NONE;
        }
        return compression;
    }
}
