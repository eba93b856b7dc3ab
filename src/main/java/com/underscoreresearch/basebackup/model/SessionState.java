package com.underscoreresearch.basebackup.model;

import java.util.EnumSet;
import java.util.Set;

public enum SessionState {
    INIT,
    VALIDATED,
    BACKUP_STARTED,
    STREAMING,
    BACKUP_STOPPED,
    MANIFEST_WRITTEN,
    DONE,
    ABORTED;

    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }

    public boolean canTransitionTo(SessionState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == ABORTED) {
            return true;
        }
        return successors().contains(next);
    }

    private Set<SessionState> successors() {
        return switch (this) {
            case INIT -> EnumSet.of(VALIDATED);
            case VALIDATED -> EnumSet.of(BACKUP_STARTED);
            case BACKUP_STARTED -> EnumSet.of(STREAMING);
            case STREAMING -> EnumSet.of(BACKUP_STOPPED);
            // Manifest writing is skipped when suppressed.
            case BACKUP_STOPPED -> EnumSet.of(MANIFEST_WRITTEN, DONE);
            case MANIFEST_WRITTEN -> EnumSet.of(DONE);
            default -> EnumSet.noneOf(SessionState.class);
        };
    }
}
