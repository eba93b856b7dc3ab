package com.underscoreresearch.basebackup.manifest;

import static com.underscoreresearch.basebackup.utils.SerializationUtils.MANIFEST_FILE_ENTRY_WRITER;
import static com.underscoreresearch.basebackup.utils.SerializationUtils.MANIFEST_WAL_RANGE_WRITER;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import lombok.Getter;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import com.underscoreresearch.basebackup.model.Lsn;
import com.underscoreresearch.basebackup.model.ManifestChecksumType;

/**
 * Collects the files of a backup and renders the {@code backup_manifest} document.
 */
public class BackupManifestBuilder {
    public static final int VERSION = 1;
    static final String CHECKSUM_PREFIX = "\"Manifest-Checksum\": \"";
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm:ss 'GMT'", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    @Getter
    private final ManifestChecksumType checksumType;
    private final List<ManifestFileEntry> files = new ArrayList<>();
    private final List<ManifestWalRange> walRanges = new ArrayList<>();

    public BackupManifestBuilder(ManifestChecksumType checksumType) {
        this.checksumType = checksumType;
    }

    public static String formatTimestamp(long lastModified) {
        return TIMESTAMP_FORMAT.format(Instant.ofEpochMilli(lastModified));
    }

    public synchronized void addFile(String path, long size, long lastModified, String checksum) {
        files.add(ManifestFileEntry.builder()
                .path(path)
                .size(size)
                .lastModified(formatTimestamp(lastModified))
                .checksumAlgorithm(checksumType == ManifestChecksumType.NONE ? null : checksumType.getManifestName())
                .checksum(checksum)
                .build());
    }

    public synchronized void addWalRange(int timeline, Lsn start, Lsn end) {
        walRanges.add(new ManifestWalRange(timeline, start, end));
    }

    public synchronized List<ManifestFileEntry> getFiles() {
        return ImmutableList.copyOf(files);
    }

    public synchronized byte[] build() throws IOException {
        StringBuilder builder = new StringBuilder();
        builder.append("{ \"PostgreSQL-Backup-Manifest-Version\": ").append(VERSION).append(",\n");
        builder.append("\"Files\": [");
        for (int i = 0; i < files.size(); i++) {
            builder.append(i == 0 ? "\n" : ",\n");
            builder.append(MANIFEST_FILE_ENTRY_WRITER.writeValueAsString(files.get(i)));
        }
        builder.append(" ],\n");
        builder.append("\"WAL-Ranges\": [");
        for (int i = 0; i < walRanges.size(); i++) {
            builder.append(i == 0 ? "\n" : ",\n");
            builder.append(MANIFEST_WAL_RANGE_WRITER.writeValueAsString(walRanges.get(i)));
        }
        builder.append("\n],\n");

        String checksum = Hashing.sha256().hashString(builder, StandardCharsets.UTF_8).toString();
        builder.append(CHECKSUM_PREFIX).append(checksum).append("\"}\n");
        return builder.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Checks the trailing manifest checksum against the text that precedes it.
     */
    public static boolean verifyChecksum(byte[] manifest) {
        String text = new String(manifest, StandardCharsets.UTF_8);
        int index = text.lastIndexOf(CHECKSUM_PREFIX);
        if (index < 0) {
            return false;
        }
        int start = index + CHECKSUM_PREFIX.length();
        int end = text.indexOf('"', start);
        if (end < 0) {
            return false;
        }
        String expected = text.substring(start, end);
        String actual = Hashing.sha256().hashString(text.substring(0, index), StandardCharsets.UTF_8).toString();
        return actual.equals(expected);
    }
}
