package com.underscoreresearch.basebackup.model;

import lombok.Getter;

@Getter
public enum CompressionMethod {
    NONE("none", "", 0, 0, 0),
    GZIP("gzip", ".gz", 1, 9, 6),
    LZ4("lz4", ".lz4", 1, 12, 1),
    ZSTD("zstd", ".zst", 1, 22, 3);

    private final String optionName;
    private final String extension;
    private final int minimumLevel;
    private final int maximumLevel;
    private final int defaultLevel;

    CompressionMethod(String optionName, String extension, int minimumLevel, int maximumLevel, int defaultLevel) {
        this.optionName = optionName;
        this.extension = extension;
        this.minimumLevel = minimumLevel;
        this.maximumLevel = maximumLevel;
        this.defaultLevel = defaultLevel;
    }

    public static CompressionMethod fromName(String name) {
        for (CompressionMethod method : values()) {
            if (method.optionName.equals(name)) {
                return method;
            }
        }
        return null;
    }
}
