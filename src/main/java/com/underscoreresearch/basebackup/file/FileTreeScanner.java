package com.underscoreresearch.basebackup.file;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

import com.underscoreresearch.basebackup.model.FileEntry;
import com.underscoreresearch.basebackup.model.Tablespace;

public interface FileTreeScanner {
    /**
     * Walks the main data directory depth first in name order. Only entries that belong in the
     * backup are passed on. Symbolic links under {@code pg_tblspc} named by
     * {@code tablespaceOids} are reported as tablespace links and not followed.
     */
    void scanDataDirectory(Path root, Set<String> tablespaceOids, EntryConsumer consumer) throws IOException;

    void scanTablespace(Tablespace tablespace, EntryConsumer consumer) throws IOException;

    @FunctionalInterface
    interface EntryConsumer {
        void accept(FileEntry entry) throws IOException;
    }
}
