package com.underscoreresearch.basebackup.output;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

public abstract class ForwardingOutputArchive implements OutputArchive {
    protected final OutputArchive delegate;

    protected ForwardingOutputArchive(OutputArchive delegate) {
        this.delegate = delegate;
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public void directory(String path, long lastModified) throws IOException {
        delegate.directory(path, lastModified);
    }

    @Override
    public void directory(String path, Path sourcePath, long lastModified) throws IOException {
        delegate.directory(path, sourcePath, lastModified);
    }

    @Override
    public void symbolicLink(String path, String target, long lastModified) throws IOException {
        delegate.symbolicLink(path, target, lastModified);
    }

    @Override
    public OutputStream file(String path, long size, long lastModified) throws IOException {
        return delegate.file(path, size, lastModified);
    }

    @Override
    public OutputStream file(String path, Path sourcePath, long size, long lastModified) throws IOException {
        return delegate.file(path, sourcePath, size, lastModified);
    }

    @Override
    public void close() throws IOException {
        delegate.close();
    }
}
