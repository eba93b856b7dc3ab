package com.underscoreresearch.basebackup.model;

import java.util.Locale;

import lombok.Getter;

@Getter
public enum ManifestChecksumType {
    NONE("NONE"),
    CRC32C("CRC32C"),
    SHA256("SHA256"),
    SHA384("SHA384"),
    SHA512("SHA512");

    private final String manifestName;

    ManifestChecksumType(String manifestName) {
        this.manifestName = manifestName;
    }

    public static ManifestChecksumType fromOption(String value) {
        if (value == null) {
            return CRC32C;
        }
        String upper = value.toUpperCase(Locale.ROOT).replace("-", "");
        for (ManifestChecksumType type : values()) {
            if (type.manifestName.equals(upper)) {
                return type;
            }
        }
        throw new IllegalArgumentException("invalid checksum algorithm \"" + value + "\"");
    }
}
