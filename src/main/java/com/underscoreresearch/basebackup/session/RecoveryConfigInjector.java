package com.underscoreresearch.basebackup.session;

import static com.underscoreresearch.basebackup.file.PathClassifier.AUTO_CONF;
import static com.underscoreresearch.basebackup.file.PathClassifier.STANDBY_SIGNAL;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.basebackup.output.ForwardingOutputArchive;
import com.underscoreresearch.basebackup.output.OutputArchive;

/**
 * Appends the recovery settings to {@code postgresql.auto.conf} as it passes through and adds
 * {@code standby.signal} when the archive is closed.
 */
@Slf4j
public class RecoveryConfigInjector extends ForwardingOutputArchive {
    private final byte[] settings;
    private boolean autoConfSeen;

    public RecoveryConfigInjector(OutputArchive delegate, byte[] settings) {
        super(delegate);
        this.settings = settings;
    }

    @Override
    public OutputStream file(String path, long size, long lastModified) throws IOException {
        if (!AUTO_CONF.equals(path)) {
            return delegate.file(path, size, lastModified);
        }
        autoConfSeen = true;
        return new FilterOutputStream(delegate.file(path, size + settings.length, lastModified)) {
            private boolean closed;

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                out.write(b, off, len);
            }

            @Override
            public void close() throws IOException {
                if (!closed) {
                    closed = true;
                    out.write(settings);
                    super.close();
                }
            }
        };
    }

    @Override
    public OutputStream file(String path, Path sourcePath, long size, long lastModified) throws IOException {
        if (AUTO_CONF.equals(path)) {
            return file(path, size, lastModified);
        }
        return delegate.file(path, sourcePath, size, lastModified);
    }

    @Override
    public void close() throws IOException {
        try {
            long now = System.currentTimeMillis();
            if (!autoConfSeen) {
                try (OutputStream stream = delegate.file(AUTO_CONF, settings.length, now)) {
                    stream.write(settings);
                }
            }
            delegate.file(STANDBY_SIGNAL, 0, now).close();
            log.info("Wrote recovery configuration to {}", delegate.getName());
        } finally {
            delegate.close();
        }
    }
}
