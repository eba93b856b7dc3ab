package com.underscoreresearch.basebackup.output;

import com.underscoreresearch.basebackup.file.FilePermissionManager;
import com.underscoreresearch.basebackup.model.BackupPlan;
import com.underscoreresearch.basebackup.output.implementation.BlackholeTarget;
import com.underscoreresearch.basebackup.output.implementation.LocalDirectoryTarget;
import com.underscoreresearch.basebackup.output.implementation.ServerDirectoryTarget;
import com.underscoreresearch.basebackup.source.DataSource;

public final class OutputTargetFactory {
    private OutputTargetFactory() {
    }

    public static OutputTarget create(BackupPlan plan, DataSource source, FilePermissionManager permissions) {
        if (!plan.hasTarget()) {
            return new LocalDirectoryTarget(plan, permissions);
        }
        return switch (plan.getTarget().getType()) {
            case BLACKHOLE -> new BlackholeTarget();
            case SERVER -> new ServerDirectoryTarget(source, plan.getTarget().getDetail(),
                    plan.getCompression(), permissions);
        };
    }
}
