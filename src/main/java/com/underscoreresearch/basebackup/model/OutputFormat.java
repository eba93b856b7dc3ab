package com.underscoreresearch.basebackup.model;

public enum OutputFormat {
    PLAIN,
    TAR;

    public static OutputFormat fromOption(String value) {
        if (value == null) {
            return null;
        }
        switch (value) {
            case "p":
            case "plain":
                return PLAIN;
            case "t":
            case "tar":
                return TAR;
            default:
                throw new IllegalArgumentException("invalid output format \"" + value
                        + "\", must be \"plain\" or \"tar\"");
        }
    }
}
