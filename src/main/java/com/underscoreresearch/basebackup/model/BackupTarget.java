package com.underscoreresearch.basebackup.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class BackupTarget {
    public static final String BLACKHOLE = "blackhole";
    public static final String SERVER = "server";

    private final TargetType type;
    private final String detail;

    /**
     * Parses {@code NAME[:DETAIL]}. Only the target name is checked here, detail requirements
     * are reported by the configuration validator.
     */
    public static BackupTarget parse(String value) {
        String name = value;
        String detail = null;
        int separator = value.indexOf(':');
        if (separator >= 0) {
            name = value.substring(0, separator);
            detail = value.substring(separator + 1);
        }
        switch (name) {
            case BLACKHOLE:
                return new BackupTarget(TargetType.BLACKHOLE, detail);
            case SERVER:
                return new BackupTarget(TargetType.SERVER, detail);
            default:
                throw new IllegalArgumentException("unrecognized target: \"" + name + "\"");
        }
    }

    public enum TargetType {
        BLACKHOLE,
        SERVER
    }
}
