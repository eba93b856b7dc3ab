package com.underscoreresearch.basebackup.utils;

/**
 * The data source or the output location can not support the requested backup.
 */
public class PreconditionException extends BackupException {
    public static final int EXIT_CODE = 1;

    public PreconditionException(String message) {
        super(message, EXIT_CODE);
    }

    public PreconditionException(String message, Throwable cause) {
        super(message, cause, EXIT_CODE);
    }
}
