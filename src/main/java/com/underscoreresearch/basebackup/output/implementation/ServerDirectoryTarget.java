package com.underscoreresearch.basebackup.output.implementation;

import static com.underscoreresearch.basebackup.file.PathClassifier.BACKUP_MANIFEST;
import static com.underscoreresearch.basebackup.file.PathClassifier.WAL_DIRECTORY;
import static com.underscoreresearch.basebackup.output.implementation.LocalDirectoryTarget.BASE_ARCHIVE;
import static com.underscoreresearch.basebackup.output.implementation.LocalDirectoryTarget.TAR_EXTENSION;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.basebackup.file.FilePermissionManager;
import com.underscoreresearch.basebackup.model.CompressionSpec;
import com.underscoreresearch.basebackup.model.OutputFormat;
import com.underscoreresearch.basebackup.model.Tablespace;
import com.underscoreresearch.basebackup.output.OutputArchive;
import com.underscoreresearch.basebackup.output.OutputTarget;
import com.underscoreresearch.basebackup.source.DataSource;

/**
 * Tar archives written into a directory on the data source side.
 */
@Slf4j
public class ServerDirectoryTarget implements OutputTarget {
    private final DataSource source;
    private final String directory;
    private final CompressionSpec compression;
    private final FilePermissionManager permissions;

    public ServerDirectoryTarget(DataSource source, String directory, CompressionSpec compression,
                                 FilePermissionManager permissions) {
        this.source = source;
        this.directory = directory;
        this.compression = compression;
        this.permissions = permissions;
    }

    @Override
    public void prepare(List<Tablespace> tablespaces) throws IOException {
        source.prepareServerDirectory(directory);
        log.info("Writing backup to server directory \"{}\"", directory);
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.TAR;
    }

    private OutputArchive tarArchive(String name) throws IOException {
        String fileName = name + TAR_EXTENSION + compression.getMethod().getExtension();
        OutputStream stream = source.openServerFile(directory, fileName);
        try {
            return new TarOutputArchive(fileName, stream, compression, permissions);
        } catch (IOException exc) {
            stream.close();
            throw exc;
        }
    }

    @Override
    public OutputArchive openBaseArchive() throws IOException {
        return tarArchive(BASE_ARCHIVE);
    }

    @Override
    public OutputArchive openTablespaceArchive(Tablespace tablespace) throws IOException {
        return tarArchive(tablespace.getOid());
    }

    @Override
    public OutputArchive openWalArchive() throws IOException {
        return tarArchive(WAL_DIRECTORY);
    }

    @Override
    public String tablespaceLinkTarget(Tablespace tablespace) {
        return tablespace.getLocation().toString();
    }

    @Override
    public boolean writesManifest() {
        return true;
    }

    @Override
    public void writeManifest(byte[] manifest) throws IOException {
        try (OutputStream stream = source.openServerFile(directory, BACKUP_MANIFEST)) {
            stream.write(manifest);
        }
    }

    @Override
    public void sync() {
        // Durability of server side files is up to the server.
    }

    @Override
    public void cleanup(boolean keep) {
        // Nothing local to clean up.
    }
}
