package com.underscoreresearch.basebackup.utils;

import java.util.List;

import lombok.Getter;

import com.google.common.collect.ImmutableList;

/**
 * Invalid option or option combination. Raised before the data source is contacted.
 */
@Getter
public class UsageException extends BackupException {
    public static final int EXIT_CODE = 2;
    private final List<String> violations;

    public UsageException(String message) {
        super(message, EXIT_CODE);
        this.violations = ImmutableList.of(message);
    }

    public UsageException(List<String> violations) {
        super(String.join("; ", violations), EXIT_CODE);
        this.violations = ImmutableList.copyOf(violations);
    }
}
