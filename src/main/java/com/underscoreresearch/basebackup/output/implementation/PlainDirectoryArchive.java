package com.underscoreresearch.basebackup.output.implementation;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;

import lombok.Getter;

import com.underscoreresearch.basebackup.file.FilePermissionManager;
import com.underscoreresearch.basebackup.output.OutputArchive;

/**
 * Extracts an archive directly into a directory.
 */
public class PlainDirectoryArchive implements OutputArchive {
    @Getter
    private final String name;
    @Getter
    private final Path root;
    private final FilePermissionManager permissions;

    public PlainDirectoryArchive(String name, Path root, FilePermissionManager permissions) {
        this.name = name;
        this.root = root;
        this.permissions = permissions;
    }

    private Path resolve(String path, Path sourcePath) {
        if (sourcePath != null) {
            return root.resolve(sourcePath);
        }
        return root.resolve(path);
    }

    @Override
    public void directory(String path, long lastModified) throws IOException {
        directory(path, null, lastModified);
    }

    @Override
    public void directory(String path, Path sourcePath, long lastModified) throws IOException {
        Path directory = resolve(path, sourcePath);
        Files.createDirectories(directory);
        permissions.applyDirectory(directory);
    }

    @Override
    public void symbolicLink(String path, String target, long lastModified) throws IOException {
        Path link = resolve(path, null);
        Files.createDirectories(link.getParent());
        Files.createSymbolicLink(link, Paths.get(target));
    }

    @Override
    public OutputStream file(String path, long size, long lastModified) throws IOException {
        return file(path, null, size, lastModified);
    }

    @Override
    public OutputStream file(String path, Path sourcePath, long size, long lastModified) throws IOException {
        Path file = resolve(path, sourcePath);
        if (!Files.isDirectory(file.getParent())) {
            Files.createDirectories(file.getParent());
        }
        OutputStream stream = Files.newOutputStream(file, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        return new FilterOutputStream(stream) {
            private boolean closed;

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                out.write(b, off, len);
            }

            @Override
            public void close() throws IOException {
                if (!closed) {
                    closed = true;
                    super.close();
                    permissions.applyFile(file);
                    Files.setLastModifiedTime(file, FileTime.fromMillis(lastModified));
                }
            }
        };
    }

    @Override
    public void close() {
    }
}
