package com.underscoreresearch.basebackup.output;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * One archive of a backup: the main data directory, a tablespace or the streamed WAL. Entries
 * are added in order and paths are relative to the archive root.
 */
public interface OutputArchive extends Closeable {
    String getName();

    void directory(String path, long lastModified) throws IOException;

    /**
     * Adds a directory copied from the source. {@code sourcePath} names the same location relative
     * to the source tree and may be {@code null}.
     */
    default void directory(String path, Path sourcePath, long lastModified) throws IOException {
        directory(path, lastModified);
    }

    void symbolicLink(String path, String target, long lastModified) throws IOException;

    /**
     * Starts a file entry. Exactly {@code size} bytes must be written before the returned stream
     * is closed. Closing the stream does not close the archive.
     */
    OutputStream file(String path, long size, long lastModified) throws IOException;

    default OutputStream file(String path, Path sourcePath, long size, long lastModified) throws IOException {
        return file(path, size, lastModified);
    }
}
