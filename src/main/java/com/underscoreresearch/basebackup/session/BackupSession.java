package com.underscoreresearch.basebackup.session;

import static com.underscoreresearch.basebackup.utils.LogUtil.debug;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.basebackup.checksum.ChecksumFailureCounter;
import com.underscoreresearch.basebackup.model.BackupPlan;
import com.underscoreresearch.basebackup.model.Lsn;
import com.underscoreresearch.basebackup.model.SessionState;

/**
 * State of one backup run.
 */
@Slf4j
@Getter
public class BackupSession {
    private final BackupPlan plan;
    private final ChecksumFailureCounter checksumFailures = new ChecksumFailureCounter();
    private SessionState state = SessionState.INIT;
    private Lsn startLsn;
    private Lsn endLsn;
    private int timeline;

    public BackupSession(BackupPlan plan) {
        this.plan = plan;
    }

    public synchronized void transition(SessionState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(String.format("Invalid backup state transition from %s to %s",
                    state, next));
        }
        SessionState previous = state;
        state = next;
        debug(() -> log.debug("Backup state {} -> {}", previous, next));
    }

    synchronized void started(Lsn startLsn, int timeline) {
        this.startLsn = startLsn;
        this.timeline = timeline;
    }

    synchronized void stopped(Lsn endLsn) {
        this.endLsn = endLsn;
    }
}
