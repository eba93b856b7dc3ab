package com.underscoreresearch.basebackup.model;

public enum FileType {
    REGULAR,
    SYMLINK,
    DIRECTORY
}
