package com.underscoreresearch.basebackup.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * One entry discovered while walking a source tree. {@code path} is relative to the root of the
 * tree being walked and always uses {@code /} as separator. {@code sourcePath} is the same
 * location as the source file system names it, which keeps names that do not decode cleanly.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
public class FileEntry {
    private final String path;
    private final Path sourcePath;
    private final Path physicalPath;
    private final FileType type;
    private final FileClassification classification;
    private final String tablespaceOid;
    private final long size;
    private final long lastModified;
    private final String linkTarget;

    public boolean isDirectory() {
        return type == FileType.DIRECTORY;
    }

    public boolean isTablespaceLink() {
        return type == FileType.SYMLINK && tablespaceOid != null;
    }
}
