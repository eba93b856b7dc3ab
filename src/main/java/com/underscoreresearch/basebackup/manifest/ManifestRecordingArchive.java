package com.underscoreresearch.basebackup.manifest;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

import com.google.common.hash.HashFunction;
import com.google.common.hash.HashingOutputStream;
import com.underscoreresearch.basebackup.output.ForwardingOutputArchive;
import com.underscoreresearch.basebackup.output.OutputArchive;

/**
 * Adds every file written through it to the manifest, with its size and checksum.
 */
public class ManifestRecordingArchive extends ForwardingOutputArchive {
    private final BackupManifestBuilder manifest;
    private final String pathPrefix;
    private final HashFunction hashFunction;

    public ManifestRecordingArchive(OutputArchive delegate, BackupManifestBuilder manifest, String pathPrefix) {
        super(delegate);
        this.manifest = manifest;
        this.pathPrefix = pathPrefix;
        this.hashFunction = ManifestChecksum.hashFunction(manifest.getChecksumType());
    }

    @Override
    public OutputStream file(String path, long size, long lastModified) throws IOException {
        return record(path, lastModified, delegate.file(path, size, lastModified));
    }

    @Override
    public OutputStream file(String path, Path sourcePath, long size, long lastModified) throws IOException {
        return record(path, lastModified, delegate.file(path, sourcePath, size, lastModified));
    }

    private OutputStream record(String path, long lastModified, OutputStream stream) {
        HashingOutputStream hashing = hashFunction != null ? new HashingOutputStream(hashFunction, stream) : null;

        return new FilterOutputStream(hashing != null ? hashing : stream) {
            private long written;
            private boolean closed;

            @Override
            public void write(int b) throws IOException {
                out.write(b);
                written++;
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                out.write(b, off, len);
                written += len;
            }

            @Override
            public void close() throws IOException {
                if (!closed) {
                    closed = true;
                    super.close();
                    manifest.addFile(pathPrefix + path, written, lastModified,
                            hashing != null ? hashing.hash().toString() : null);
                }
            }
        };
    }
}
