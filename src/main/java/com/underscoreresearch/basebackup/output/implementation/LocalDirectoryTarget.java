package com.underscoreresearch.basebackup.output.implementation;

import static com.underscoreresearch.basebackup.file.PathClassifier.ARCHIVE_STATUS_DIRECTORY;
import static com.underscoreresearch.basebackup.file.PathClassifier.BACKUP_MANIFEST;
import static com.underscoreresearch.basebackup.file.PathClassifier.WAL_DIRECTORY;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.basebackup.file.FilePermissionManager;
import com.underscoreresearch.basebackup.io.IOUtils;
import com.underscoreresearch.basebackup.model.BackupPlan;
import com.underscoreresearch.basebackup.model.CompressionSpec;
import com.underscoreresearch.basebackup.model.OutputFormat;
import com.underscoreresearch.basebackup.model.Tablespace;
import com.underscoreresearch.basebackup.output.OutputArchive;
import com.underscoreresearch.basebackup.output.OutputDirectoryTracker;
import com.underscoreresearch.basebackup.output.OutputTarget;

/**
 * Backup into a local directory, either extracted (plain) or as one tar file per archive.
 */
@Slf4j
public class LocalDirectoryTarget implements OutputTarget {
    public static final String TAR_EXTENSION = ".tar";
    public static final String BASE_ARCHIVE = "base";

    private final BackupPlan plan;
    private final FilePermissionManager permissions;
    private final OutputDirectoryTracker tracker = new OutputDirectoryTracker();
    private final List<Path> syncRoots = new ArrayList<>();

    public LocalDirectoryTarget(BackupPlan plan, FilePermissionManager permissions) {
        this.plan = plan;
        this.permissions = permissions;
    }

    @Override
    public OutputFormat getFormat() {
        return plan.getFormat();
    }

    @Override
    public void prepare(List<Tablespace> tablespaces) throws IOException {
        Path directory = plan.getDirectory();
        tracker.createEmptyOrAbsent(directory, "data", true);
        permissions.applyDirectory(directory);
        syncRoots.add(directory);

        if (plan.getFormat() != OutputFormat.PLAIN) {
            return;
        }

        for (Tablespace tablespace : tablespaces) {
            Path destination = plan.getTablespaceMapping().map(tablespace.getLocation());
            tracker.createEmptyOrAbsent(destination, "tablespace", false);
            permissions.applyDirectory(destination);
            syncRoots.add(destination);
        }

        Path walLink = directory.resolve(WAL_DIRECTORY);
        if (plan.getWalDirectory() != null) {
            tracker.createEmptyOrAbsent(plan.getWalDirectory(), "WAL", true);
            permissions.applyDirectory(plan.getWalDirectory());
            Files.createSymbolicLink(walLink, plan.getWalDirectory());
            syncRoots.add(plan.getWalDirectory());
        } else {
            Files.createDirectories(walLink);
            permissions.applyDirectory(walLink);
        }
        Path archiveStatus = directory.resolve(ARCHIVE_STATUS_DIRECTORY);
        Files.createDirectories(archiveStatus);
        permissions.applyDirectory(archiveStatus);
    }

    private CompressionSpec compression() {
        return plan.archiveCompression();
    }

    private OutputArchive tarArchive(String name) throws IOException {
        String fileName = name + TAR_EXTENSION + compression().getMethod().getExtension();
        Path file = plan.getDirectory().resolve(fileName);
        OutputStream stream = Files.newOutputStream(file);
        try {
            OutputArchive archive = new TarOutputArchive(fileName, stream, compression(), permissions);
            permissions.applyFile(file);
            return archive;
        } catch (IOException exc) {
            stream.close();
            throw exc;
        }
    }

    @Override
    public OutputArchive openBaseArchive() throws IOException {
        if (plan.getFormat() == OutputFormat.PLAIN) {
            return new PlainDirectoryArchive(BASE_ARCHIVE, plan.getDirectory(), permissions);
        }
        return tarArchive(BASE_ARCHIVE);
    }

    @Override
    public OutputArchive openTablespaceArchive(Tablespace tablespace) throws IOException {
        if (plan.getFormat() == OutputFormat.PLAIN) {
            return new PlainDirectoryArchive(tablespace.getOid(), plan.getTablespaceMapping()
                    .map(tablespace.getLocation()), permissions);
        }
        return tarArchive(tablespace.getOid());
    }

    @Override
    public OutputArchive openWalArchive() throws IOException {
        if (plan.getFormat() == OutputFormat.PLAIN) {
            return new PlainDirectoryArchive(WAL_DIRECTORY, plan.getDirectory().resolve(WAL_DIRECTORY), permissions);
        }
        return tarArchive(WAL_DIRECTORY);
    }

    @Override
    public String tablespaceLinkTarget(Tablespace tablespace) {
        return plan.getTablespaceMapping().map(tablespace.getLocation()).toString();
    }

    @Override
    public boolean writesManifest() {
        return true;
    }

    @Override
    public void writeManifest(byte[] manifest) throws IOException {
        Path file = plan.getDirectory().resolve(BACKUP_MANIFEST);
        Files.write(file, manifest);
        permissions.applyFile(file);
    }

    @Override
    public void sync() throws IOException {
        for (Path root : syncRoots) {
            IOUtils.fsyncTree(root);
        }
    }

    @Override
    public void cleanup(boolean keep) {
        tracker.cleanup(keep);
    }
}
