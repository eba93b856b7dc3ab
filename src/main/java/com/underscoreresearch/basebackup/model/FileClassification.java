package com.underscoreresearch.basebackup.model;

public enum FileClassification {
    INCLUDE,
    EXCLUDE_DIR,
    EXCLUDE_FILE,
    TEMP_RELATION,
    UNLOGGED_NONINIT_FORK;

    public boolean isIncluded() {
        return this == INCLUDE;
    }
}
