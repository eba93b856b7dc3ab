package com.underscoreresearch.basebackup.output;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.basebackup.io.IOUtils;
import com.underscoreresearch.basebackup.utils.PreconditionException;

/**
 * Remembers which local directories a backup created or took over while empty, so that a failed
 * backup can leave them the way it found them.
 */
@Slf4j
public class OutputDirectoryTracker {
    private final List<TrackedDirectory> directories = new ArrayList<>();
    private boolean tablespacesTouched;

    /**
     * Creates {@code path} unless it exists as an empty directory.
     *
     * @param description Human readable kind of directory, such as {@code data} or {@code WAL}.
     * @param cleanable   Whether the directory is removed again when the backup fails.
     */
    public synchronized void createEmptyOrAbsent(Path path, String description, boolean cleanable)
            throws IOException {
        boolean created;
        if (Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            if (!Files.isDirectory(path)) {
                throw new PreconditionException(String.format("could not create directory \"%s\": File exists", path));
            }
            if (!IOUtils.isEmptyDirectory(path)) {
                throw new PreconditionException(String.format("directory \"%s\" exists but is not empty", path));
            }
            created = false;
        } else {
            try {
                Files.createDirectories(path);
            } catch (IOException exc) {
                throw new IOException(String.format("could not create directory \"%s\": %s", path,
                        exc.getMessage()), exc);
            }
            created = true;
        }
        if (cleanable) {
            directories.add(new TrackedDirectory(path, description, created));
        } else {
            tablespacesTouched = true;
        }
    }

    /**
     * Undoes the effect of the backup on the tracked directories.
     *
     * @param keep Leave everything in place and just report it.
     */
    public synchronized void cleanup(boolean keep) {
        for (TrackedDirectory directory : directories) {
            if (keep) {
                log.info("{} directory \"{}\" not removed at user's request", directory.getDescription(),
                        directory.getPath());
                continue;
            }
            try {
                if (directory.isCreated()) {
                    log.info("removing {} directory \"{}\"", directory.getDescription(), directory.getPath());
                    IOUtils.deleteRecursively(directory.getPath());
                } else {
                    log.info("removing contents of {} directory \"{}\"", directory.getDescription(),
                            directory.getPath());
                    IOUtils.deleteContents(directory.getPath());
                }
            } catch (IOException exc) {
                log.error("Failed to clean up {} directory \"{}\"", directory.getDescription(),
                        directory.getPath(), exc);
            }
        }
        if (tablespacesTouched) {
            log.warn("changes to tablespace directories will not be undone");
        }
    }

    @Getter
    @AllArgsConstructor
    private static class TrackedDirectory {
        private final Path path;
        private final String description;
        private final boolean created;
    }
}
