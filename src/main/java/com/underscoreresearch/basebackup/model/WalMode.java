package com.underscoreresearch.basebackup.model;

public enum WalMode {
    NONE,
    FETCH,
    STREAM;

    public static WalMode fromOption(String value) {
        if (value == null) {
            return null;
        }
        switch (value) {
            case "n":
            case "none":
                return NONE;
            case "f":
            case "fetch":
                return FETCH;
            case "s":
            case "stream":
                return STREAM;
            default:
                throw new IllegalArgumentException("invalid wal-method option \"" + value
                        + "\", must be \"fetch\", \"stream\", or \"none\"");
        }
    }
}
