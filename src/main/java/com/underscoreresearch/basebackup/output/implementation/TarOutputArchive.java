package com.underscoreresearch.basebackup.output.implementation;

import static com.underscoreresearch.basebackup.utils.LogUtil.debug;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.tar.TarConstants;

import com.underscoreresearch.basebackup.file.FilePermissionManager;
import com.underscoreresearch.basebackup.model.CompressionSpec;
import com.underscoreresearch.basebackup.output.CompressionStreams;
import com.underscoreresearch.basebackup.output.OutputArchive;

/**
 * Writes an archive as a ustar stream, optionally compressed. Entry names are limited to the
 * 99 bytes the classic tar header can hold.
 */
@Slf4j
public class TarOutputArchive implements OutputArchive {
    public static final int MAX_NAME_LENGTH = 99;
    private static final int FILE_TYPE = 0100000;
    private static final int DIRECTORY_TYPE = 040000;
    private static final int SYMLINK_MODE = 0120777;
    private static final int BUFFER_SIZE = 65536;

    @Getter
    private final String name;
    private final TarArchiveOutputStream out;
    private final FilePermissionManager permissions;
    private boolean entryOpen;

    public TarOutputArchive(String name, OutputStream destination, CompressionSpec compression,
                            FilePermissionManager permissions) throws IOException {
        this.name = name;
        this.permissions = permissions;
        this.out = new TarArchiveOutputStream(
                CompressionStreams.compress(new BufferedOutputStream(destination, BUFFER_SIZE), compression),
                StandardCharsets.UTF_8.name());
        this.out.setLongFileMode(TarArchiveOutputStream.LONGFILE_ERROR);
        this.out.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
    }

    public static void checkName(String entryName) throws IOException {
        if (entryName.getBytes(StandardCharsets.UTF_8).length > MAX_NAME_LENGTH) {
            throw new IOException(String.format("file name too long for tar format: \"%s\"", entryName));
        }
    }

    @Override
    public synchronized void directory(String path, long lastModified) throws IOException {
        checkName(path);
        // A name of the full 99 bytes leaves no room for the trailing slash, the type flag marks it.
        String entryName = path + "/";
        TarArchiveEntry entry = entryName.getBytes(StandardCharsets.UTF_8).length > MAX_NAME_LENGTH
                ? new TarArchiveEntry(path, TarConstants.LF_DIR)
                : new TarArchiveEntry(entryName);
        entry.setMode(DIRECTORY_TYPE | permissions.getDirectoryMode());
        entry.setModTime(lastModified);
        out.putArchiveEntry(entry);
        out.closeArchiveEntry();
    }

    @Override
    public synchronized void symbolicLink(String path, String target, long lastModified) throws IOException {
        checkName(path);
        if (target.getBytes(StandardCharsets.UTF_8).length > MAX_NAME_LENGTH) {
            throw new IOException(String.format("symbolic link target too long for tar format: file name \"%s\", "
                    + "target \"%s\"", path, target));
        }
        TarArchiveEntry entry = new TarArchiveEntry(path, TarArchiveEntry.LF_SYMLINK);
        entry.setLinkName(target);
        entry.setMode(SYMLINK_MODE);
        entry.setModTime(lastModified);
        out.putArchiveEntry(entry);
        out.closeArchiveEntry();
    }

    @Override
    public synchronized OutputStream file(String path, long size, long lastModified) throws IOException {
        checkName(path);
        if (entryOpen) {
            throw new IllegalStateException("Previous entry of " + name + " is still open");
        }
        TarArchiveEntry entry = new TarArchiveEntry(path);
        entry.setMode(FILE_TYPE | permissions.getFileMode());
        entry.setSize(size);
        entry.setModTime(lastModified);
        out.putArchiveEntry(entry);
        entryOpen = true;
        return new EntryOutputStream();
    }

    @Override
    public synchronized void close() throws IOException {
        try {
            out.finish();
        } finally {
            out.close();
        }
        debug(() -> log.debug("Closed archive {}", name));
    }

    private class EntryOutputStream extends OutputStream {
        private boolean closed;

        @Override
        public void write(int b) throws IOException {
            out.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
            if (!closed) {
                closed = true;
                synchronized (TarOutputArchive.this) {
                    entryOpen = false;
                    out.closeArchiveEntry();
                }
            }
        }
    }
}
