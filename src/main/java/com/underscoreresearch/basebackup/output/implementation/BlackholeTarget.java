package com.underscoreresearch.basebackup.output.implementation;

import static com.underscoreresearch.basebackup.file.PathClassifier.WAL_DIRECTORY;
import static com.underscoreresearch.basebackup.output.implementation.LocalDirectoryTarget.BASE_ARCHIVE;

import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.basebackup.model.OutputFormat;
import com.underscoreresearch.basebackup.model.Tablespace;
import com.underscoreresearch.basebackup.output.OutputArchive;
import com.underscoreresearch.basebackup.output.OutputTarget;

/**
 * Reads the whole backup and throws it away, useful to test the source side.
 */
@Slf4j
public class BlackholeTarget implements OutputTarget {
    @Override
    public void prepare(List<Tablespace> tablespaces) {
        log.info("Backup output is discarded");
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.TAR;
    }

    @Override
    public OutputArchive openBaseArchive() {
        return new NullOutputArchive(BASE_ARCHIVE);
    }

    @Override
    public OutputArchive openTablespaceArchive(Tablespace tablespace) {
        return new NullOutputArchive(tablespace.getOid());
    }

    @Override
    public OutputArchive openWalArchive() {
        return new NullOutputArchive(WAL_DIRECTORY);
    }

    @Override
    public String tablespaceLinkTarget(Tablespace tablespace) {
        return tablespace.getLocation().toString();
    }

    @Override
    public boolean writesManifest() {
        return false;
    }

    @Override
    public void writeManifest(byte[] manifest) {
    }

    @Override
    public void sync() {
    }

    @Override
    public void cleanup(boolean keep) {
    }
}
