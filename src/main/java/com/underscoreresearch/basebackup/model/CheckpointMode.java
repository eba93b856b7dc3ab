package com.underscoreresearch.basebackup.model;

public enum CheckpointMode {
    FAST,
    SPREAD;

    public static CheckpointMode fromOption(String value) {
        if (value == null) {
            return SPREAD;
        }
        switch (value) {
            case "fast":
                return FAST;
            case "spread":
                return SPREAD;
            default:
                throw new IllegalArgumentException("invalid checkpoint argument \"" + value
                        + "\", must be \"fast\" or \"spread\"");
        }
    }
}
