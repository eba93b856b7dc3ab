package com.underscoreresearch.basebackup.utils;

public class BackupAbortedException extends BackupException {
    public static final int EXIT_CODE = 1;

    public BackupAbortedException(String message) {
        super(message, EXIT_CODE);
    }

    public BackupAbortedException(String message, Throwable cause) {
        super(message, cause, EXIT_CODE);
    }
}
