package com.underscoreresearch.basebackup.output.implementation;

import java.io.OutputStream;

import lombok.Getter;

import com.underscoreresearch.basebackup.output.OutputArchive;

/**
 * Discards everything written to it.
 */
public class NullOutputArchive implements OutputArchive {
    @Getter
    private final String name;

    public NullOutputArchive(String name) {
        this.name = name;
    }

    @Override
    public void directory(String path, long lastModified) {
    }

    @Override
    public void symbolicLink(String path, String target, long lastModified) {
    }

    @Override
    public OutputStream file(String path, long size, long lastModified) {
        return OutputStream.nullOutputStream();
    }

    @Override
    public void close() {
    }
}
