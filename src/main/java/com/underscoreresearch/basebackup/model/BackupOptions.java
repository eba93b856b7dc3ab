package com.underscoreresearch.basebackup.model;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Backup configuration as given by the user. Values that matter when explicitly given, such as
 * the format or WAL method, stay {@code null} until set.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BackupOptions {
    private String directory;
    private String format;
    private String walMethod;
    private String target;
    private List<String> tablespaceMappings;
    private String compression;
    private boolean gzip;
    private String slot;
    private boolean createSlot;
    private boolean noSlot;
    private boolean noVerifyChecksums;
    private boolean writeRecoveryConf;
    private boolean noManifest;
    private String manifestChecksums;
    private String walDirectory;
    private boolean noClean;
    private boolean noSync;
    private String checkpoint;
    private String label;
    private boolean progress;
    private String host;
    private String port;
    private String username;
    private String sourceDirectory;
}
