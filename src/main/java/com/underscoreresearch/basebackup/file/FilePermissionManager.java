package com.underscoreresearch.basebackup.file;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Permission class of a backup. Every directory and file written gets the same mode, derived
 * from the source data directory.
 */
public interface FilePermissionManager {
    int getDirectoryMode();

    int getFileMode();

    void applyDirectory(Path path) throws IOException;

    void applyFile(Path path) throws IOException;
}
