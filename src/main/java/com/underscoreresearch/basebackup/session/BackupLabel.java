package com.underscoreresearch.basebackup.session;

import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import com.underscoreresearch.basebackup.model.Tablespace;
import com.underscoreresearch.basebackup.source.BackupStart;
import com.underscoreresearch.basebackup.wal.WalSegmentName;

/**
 * Contents of the {@code backup_label} and {@code tablespace_map} files placed in the main
 * archive.
 */
public final class BackupLabel {
    private static final DateTimeFormatter START_TIME_FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm:ss zzz", Locale.ROOT);

    private BackupLabel() {
    }

    public static byte[] render(BackupStart start, String label, long walSegmentSize) {
        WalSegmentName segment = WalSegmentName.containing(start.getTimeline(), start.getStartLsn(), walSegmentSize);
        StringBuilder builder = new StringBuilder();
        builder.append(String.format("START WAL LOCATION: %s (file %s)\n", start.getStartLsn(), segment));
        builder.append(String.format("CHECKPOINT LOCATION: %s\n", start.getCheckpointLsn()));
        builder.append("BACKUP METHOD: streamed\n");
        builder.append("BACKUP FROM: primary\n");
        builder.append(String.format("START TIME: %s\n",
                START_TIME_FORMAT.format(start.getStartTime().atZone(ZoneId.systemDefault()))));
        builder.append(String.format("LABEL: %s\n", label));
        builder.append(String.format("START TIMELINE: %d\n", start.getTimeline()));
        return builder.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * One {@code <oid> <location>} line per tablespace. Backslashes and line breaks in the
     * location are escaped.
     */
    public static byte[] renderTablespaceMap(List<Tablespace> tablespaces) {
        StringBuilder builder = new StringBuilder();
        for (Tablespace tablespace : tablespaces) {
            builder.append(tablespace.getOid()).append(' ')
                    .append(escapeLocation(tablespace.getLocation().toString()))
                    .append('\n');
        }
        return builder.toString().getBytes(StandardCharsets.UTF_8);
    }

    static String escapeLocation(String location) {
        StringBuilder builder = new StringBuilder();
        for (char ch : location.toCharArray()) {
            switch (ch) {
                case '\\' -> builder.append("\\\\");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                default -> builder.append(ch);
            }
        }
        return builder.toString();
    }
}
