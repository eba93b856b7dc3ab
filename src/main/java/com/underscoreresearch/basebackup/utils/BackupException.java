package com.underscoreresearch.basebackup.utils;

import lombok.Getter;

@Getter
public abstract class BackupException extends RuntimeException {
    private final int exitCode;

    protected BackupException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    protected BackupException(String message, Throwable cause, int exitCode) {
        super(message, cause);
        this.exitCode = exitCode;
    }
}
