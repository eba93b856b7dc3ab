package com.underscoreresearch.basebackup.cli;

import java.util.List;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import com.google.common.collect.ImmutableList;
import com.underscoreresearch.basebackup.model.BackupPlan;
import com.underscoreresearch.basebackup.utils.UsageException;

/**
 * Either a plan ready to run or every problem found in the options.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {
    private final BackupPlan plan;
    private final List<String> violations;

    public static ValidationResult valid(BackupPlan plan) {
        return new ValidationResult(plan, ImmutableList.of());
    }

    public static ValidationResult invalid(List<String> violations) {
        return new ValidationResult(null, ImmutableList.copyOf(violations));
    }

    public boolean isValid() {
        return plan != null;
    }

    public BackupPlan planOrThrow() {
        if (!isValid()) {
            throw new UsageException(violations);
        }
        return plan;
    }
}
