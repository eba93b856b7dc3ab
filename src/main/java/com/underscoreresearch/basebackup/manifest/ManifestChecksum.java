package com.underscoreresearch.basebackup.manifest;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.underscoreresearch.basebackup.model.ManifestChecksumType;

public final class ManifestChecksum {
    private ManifestChecksum() {
    }

    /**
     * Hash function of a checksum type, {@code null} for {@link ManifestChecksumType#NONE}.
     * CRC-32C is rendered in little endian byte order, the same as the server does.
     */
    public static HashFunction hashFunction(ManifestChecksumType type) {
        return switch (type) {
            case NONE -> null;
            case CRC32C -> Hashing.crc32c();
            case SHA256 -> Hashing.sha256();
            case SHA384 -> Hashing.sha384();
            case SHA512 -> Hashing.sha512();
        };
    }
}
