package com.underscoreresearch.basebackup.file;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.AllArgsConstructor;
import lombok.Getter;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.underscoreresearch.basebackup.model.FileClassification;

/**
 * Decides which entries of a data directory or tablespace tree belong in a base backup. Paths
 * are relative to the tree root and use {@code /} as separator.
 */
public final class PathClassifier {
    public static final String PATH_SEPARATOR = "/";
    public static final String WAL_DIRECTORY = "pg_wal";
    public static final String ARCHIVE_STATUS_DIRECTORY = WAL_DIRECTORY + PATH_SEPARATOR + "archive_status";
    public static final String TABLESPACE_DIRECTORY = "pg_tblspc";
    public static final String BACKUP_LABEL = "backup_label";
    public static final String TABLESPACE_MAP = "tablespace_map";
    public static final String BACKUP_MANIFEST = "backup_manifest";
    public static final String AUTO_CONF = "postgresql.auto.conf";
    public static final String STANDBY_SIGNAL = "standby.signal";

    private static final List<ExclusionRule> EXCLUSIONS = ImmutableList.of(
            ExclusionRule.file("postmaster.pid"),
            ExclusionRule.file("postmaster.opts"),
            ExclusionRule.file("postgresql.auto.conf.tmp"),
            ExclusionRule.file("current_logfiles.tmp"),
            ExclusionRule.filePrefix("pg_internal.init"),
            ExclusionRule.file(BACKUP_LABEL),
            ExclusionRule.file(TABLESPACE_MAP),
            ExclusionRule.file(BACKUP_MANIFEST),
            ExclusionRule.filePrefix("pgsql_tmp"),
            ExclusionRule.contents("pg_dynshmem"),
            ExclusionRule.contents("pg_notify"),
            ExclusionRule.contents("pg_replslot"),
            ExclusionRule.contents("pg_serial"),
            ExclusionRule.contents("pg_snapshots"),
            ExclusionRule.contents("pg_stat_tmp"),
            ExclusionRule.contents("pg_subtrans"),
            ExclusionRule.contents(WAL_DIRECTORY));

    private static final Set<String> NO_CHECKSUM_FILES = ImmutableSet.of(
            "pg_control",
            "pg_filenode.map",
            "pg_internal.init",
            "PG_VERSION");

    private static final Pattern TEMP_RELATION = Pattern.compile("^t\\d+_\\d+(_(fsm|vm|init))?(\\.\\d+)?$");
    private static final Pattern RELATION_FILE = Pattern.compile("^(\\d+)(_(fsm|vm|init))?(\\.\\d+)?$");
    private static final Pattern TABLESPACE_VERSION_DIRECTORY = Pattern.compile("^PG_\\d+_\\d+$");
    private static final Pattern NUMERIC = Pattern.compile("^\\d+$");
    private static final String INIT_FORK = "init";

    private PathClassifier() {
    }

    /**
     * Classifies one entry.
     *
     * @param relativePath  Path of the entry relative to the tree root.
     * @param dataDirectory {@code true} for the main data directory, {@code false} for a
     *                      tablespace tree.
     * @param siblingExists Tells whether a name exists in the same directory as the entry.
     */
    public static FileClassification classify(String relativePath, boolean dataDirectory,
                                              Predicate<String> siblingExists) {
        String name = fileName(relativePath);
        String parent = parent(relativePath);

        for (ExclusionRule rule : EXCLUSIONS) {
            if (rule.getType() == ExclusionType.CONTENTS) {
                if (dataDirectory && rule.getName().equals(parent)) {
                    return FileClassification.EXCLUDE_DIR;
                }
            } else if (rule.matches(name)) {
                return FileClassification.EXCLUDE_FILE;
            }
        }

        if (isDatabaseDirectory(parent, dataDirectory)) {
            if (isTemporaryRelation(name)) {
                return FileClassification.TEMP_RELATION;
            }
            Matcher matcher = RELATION_FILE.matcher(name);
            if (matcher.matches() && !INIT_FORK.equals(matcher.group(3))
                    && siblingExists.test(matcher.group(1) + "_" + INIT_FORK)) {
                return FileClassification.UNLOGGED_NONINIT_FORK;
            }
        }
        return FileClassification.INCLUDE;
    }

    /**
     * Directories that are kept in the backup but whose contents never are.
     */
    public static boolean skipsContents(String relativePath, boolean dataDirectory) {
        if (!dataDirectory) {
            return false;
        }
        for (ExclusionRule rule : EXCLUSIONS) {
            if (rule.getType() == ExclusionType.CONTENTS && rule.getName().equals(relativePath)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isTemporaryRelation(String name) {
        return TEMP_RELATION.matcher(name).matches();
    }

    /**
     * A numeric directory directly under {@code base/}, or under the version directory of a
     * tablespace.
     */
    public static boolean isDatabaseDirectory(String relativePath, boolean dataDirectory) {
        if (relativePath == null) {
            return false;
        }
        String[] parts = relativePath.split(PATH_SEPARATOR);
        if (parts.length != 2 || !NUMERIC.matcher(parts[1]).matches()) {
            return false;
        }
        if (dataDirectory) {
            return "base".equals(parts[0]);
        }
        return TABLESPACE_VERSION_DIRECTORY.matcher(parts[0]).matches();
    }

    public static boolean isChecksummed(String relativePath, boolean dataDirectory) {
        String name = fileName(relativePath);
        if (NO_CHECKSUM_FILES.contains(name)) {
            return false;
        }
        if (!dataDirectory) {
            return true;
        }
        return relativePath.startsWith("global" + PATH_SEPARATOR) || relativePath.startsWith("base" + PATH_SEPARATOR);
    }

    /**
     * Segment number of a relation file, 0 without a segment suffix and -1 when the suffix is
     * not a valid segment number.
     */
    public static int segmentNumber(String name) {
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return 0;
        }
        String suffix = name.substring(dot + 1);
        if (!NUMERIC.matcher(suffix).matches()) {
            return -1;
        }
        try {
            int segment = Integer.parseInt(suffix);
            return segment == 0 ? -1 : segment;
        } catch (NumberFormatException exc) {
            return -1;
        }
    }

    public static String fileName(String relativePath) {
        int index = relativePath.lastIndexOf(PATH_SEPARATOR);
        return index < 0 ? relativePath : relativePath.substring(index + 1);
    }

    public static String parent(String relativePath) {
        int index = relativePath.lastIndexOf(PATH_SEPARATOR);
        return index < 0 ? null : relativePath.substring(0, index);
    }

    public static String child(String parent, String name) {
        if (parent == null || parent.isEmpty()) {
            return name;
        }
        return parent + PATH_SEPARATOR + name;
    }

    private enum ExclusionType {
        FILE,
        FILE_PREFIX,
        CONTENTS
    }

    @Getter
    @AllArgsConstructor
    private static class ExclusionRule {
        private final String name;
        private final ExclusionType type;

        static ExclusionRule file(String name) {
            return new ExclusionRule(name, ExclusionType.FILE);
        }

        static ExclusionRule filePrefix(String name) {
            return new ExclusionRule(name, ExclusionType.FILE_PREFIX);
        }

        static ExclusionRule contents(String name) {
            return new ExclusionRule(name, ExclusionType.CONTENTS);
        }

        boolean matches(String fileName) {
            return switch (type) {
                case FILE -> name.equals(fileName);
                case FILE_PREFIX -> fileName.startsWith(name);
                case CONTENTS -> false;
            };
        }
    }
}
