package com.underscoreresearch.basebackup.session;

import static com.underscoreresearch.basebackup.file.PathClassifier.BACKUP_LABEL;
import static com.underscoreresearch.basebackup.file.PathClassifier.PATH_SEPARATOR;
import static com.underscoreresearch.basebackup.file.PathClassifier.TABLESPACE_DIRECTORY;
import static com.underscoreresearch.basebackup.file.PathClassifier.TABLESPACE_MAP;
import static com.underscoreresearch.basebackup.file.PathClassifier.WAL_DIRECTORY;
import static com.underscoreresearch.basebackup.utils.LogUtil.debug;
import static com.underscoreresearch.basebackup.utils.LogUtil.readableDuration;
import static com.underscoreresearch.basebackup.utils.LogUtil.readableSize;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.google.inject.Inject;
import com.underscoreresearch.basebackup.checksum.ChecksumFailureCounter;
import com.underscoreresearch.basebackup.checksum.ChecksumVerifier;
import com.underscoreresearch.basebackup.file.FilePermissionManager;
import com.underscoreresearch.basebackup.file.FileTreeScanner;
import com.underscoreresearch.basebackup.file.PathClassifier;
import com.underscoreresearch.basebackup.file.implementation.PosixPermissionManager;
import com.underscoreresearch.basebackup.io.IOUtils;
import com.underscoreresearch.basebackup.manifest.BackupManifestBuilder;
import com.underscoreresearch.basebackup.manifest.ManifestRecordingArchive;
import com.underscoreresearch.basebackup.model.BackupPlan;
import com.underscoreresearch.basebackup.model.FileEntry;
import com.underscoreresearch.basebackup.model.Lsn;
import com.underscoreresearch.basebackup.model.OutputFormat;
import com.underscoreresearch.basebackup.model.SessionState;
import com.underscoreresearch.basebackup.model.Tablespace;
import com.underscoreresearch.basebackup.model.TablespaceMapping;
import com.underscoreresearch.basebackup.model.WalMode;
import com.underscoreresearch.basebackup.output.ArchiveWalSegmentSink;
import com.underscoreresearch.basebackup.output.OutputArchive;
import com.underscoreresearch.basebackup.output.OutputTarget;
import com.underscoreresearch.basebackup.output.OutputTargetFactory;
import com.underscoreresearch.basebackup.source.BackupStart;
import com.underscoreresearch.basebackup.source.DataSource;
import com.underscoreresearch.basebackup.utils.BackupAbortedException;
import com.underscoreresearch.basebackup.utils.PreconditionException;
import com.underscoreresearch.basebackup.wal.WalCaptureManager;

/**
 * Runs a backup from start marker to manifest. A failed backup is aborted on the source, its
 * WAL streaming cancelled, and its local output removed unless asked to keep it.
 */
@Slf4j
public class BackupSessionController {
    public static final String TEMPORARY_SLOT_PREFIX = "basebackup_";

    private final DataSource source;
    private final FileTreeScanner scanner;

    @Inject
    public BackupSessionController(DataSource source, FileTreeScanner scanner) {
        this.source = source;
        this.scanner = scanner;
    }

    public BackupResult run(BackupPlan plan) throws IOException {
        return run(new BackupSession(plan));
    }

    public BackupResult run(BackupSession session) throws IOException {
        return new Run(session).execute();
    }

    private class Run {
        private final BackupSession session;
        private final BackupPlan plan;
        private final ChecksumFailureCounter checksumFailures;
        private final AtomicLong totalSize = new AtomicLong();
        private OutputTarget target;
        private WalCaptureManager walCapture;
        private OutputArchive walArchive;
        private String streamingSlot;
        private String temporarySlot;
        private boolean backupInProgress;
        private BackupStart start;
        private Map<String, Tablespace> tablespaces;
        private boolean verifyChecksums;
        private int blockSize;
        private ProgressReporter progress;

        Run(BackupSession session) {
            this.session = session;
            this.plan = session.getPlan();
            this.checksumFailures = session.getChecksumFailures();
        }

        BackupResult execute() throws IOException {
            Stopwatch stopwatch = Stopwatch.createStarted();
            session.transition(SessionState.VALIDATED);
            try {
                begin();
                copy();
                finish();
            } catch (IOException | RuntimeException exc) {
                abort(exc);
                throw exc;
            }

            checksumFailures.reportTotal();
            session.transition(SessionState.DONE);
            log.info("Base backup of {} completed in {}", readableSize(totalSize.get()),
                    readableDuration(stopwatch.elapsed()));

            return BackupResult.builder()
                    .exitCode(checksumFailures.getFailures() > 0 ? BackupResult.FAILURE : BackupResult.SUCCESS)
                    .startLsn(session.getStartLsn())
                    .endLsn(session.getEndLsn())
                    .timeline(session.getTimeline())
                    .checksumFailures(checksumFailures.getFailures())
                    .totalSize(totalSize.get())
                    .build();
        }

        private void begin() throws IOException {
            source.connect();
            source.checkWalConfiguration(plan.getWalMode());
            resolveSlot();

            start = source.beginBackup(plan.getLabel(), plan.getCheckpoint());
            backupInProgress = true;
            session.started(start.getStartLsn(), start.getTimeline());
            log.info("Write-ahead log start point: {} on timeline {}", start.getStartLsn(), start.getTimeline());

            tablespaces = new LinkedHashMap<>();
            for (Tablespace tablespace : start.getTablespaces()) {
                tablespaces.put(tablespace.getOid(), tablespace);
            }
            verifyTablespaceMapping(plan.getTablespaceMapping(), start.getTablespaces());

            FilePermissionManager permissions = PosixPermissionManager.forDataDirectory(source.getDataDirectory());
            target = OutputTargetFactory.create(plan, source, permissions);
            target.prepare(start.getTablespaces());
            session.transition(SessionState.BACKUP_STARTED);

            if (plan.getWalMode() == WalMode.STREAM) {
                walArchive = target.openWalArchive();
                walCapture = new WalCaptureManager(source, start.getStartLsn(), start.getTimeline(), streamingSlot,
                        new ArchiveWalSegmentSink(walArchive, ""));
                walCapture.start();
            }
            session.transition(SessionState.STREAMING);
        }

        private void resolveSlot() throws IOException {
            if (plan.getWalMode() != WalMode.STREAM) {
                return;
            }
            if (plan.getSlot() != null) {
                if (plan.isCreateSlot()) {
                    source.createReplicationSlot(plan.getSlot(), false);
                } else if (source.findReplicationSlot(plan.getSlot()).isEmpty()) {
                    throw new PreconditionException(String.format("replication slot \"%s\" does not exist",
                            plan.getSlot()));
                }
                streamingSlot = plan.getSlot();
            } else if (!plan.isNoSlot()) {
                temporarySlot = TEMPORARY_SLOT_PREFIX + ProcessHandle.current().pid();
                source.createReplicationSlot(temporarySlot, true);
                streamingSlot = temporarySlot;
            }
        }

        private void copy() throws IOException {
            blockSize = source.settings().getBlockSize();
            verifyChecksums = plan.isVerifyChecksums() && source.settings().isDataChecksums();
            if (plan.isVerifyChecksums() && !verifyChecksums) {
                debug(() -> log.debug("Data checksums are disabled on the source, pages are not verified"));
            }

            BackupManifestBuilder manifest = plan.isManifest() && target.writesManifest()
                    ? new BackupManifestBuilder(plan.getManifestChecksums()) : null;

            if (plan.isProgress()) {
                progress = new ProgressReporter(estimateSize(), tablespaces.size() + 1);
            }

            for (Tablespace tablespace : tablespaces.values()) {
                String prefix = TABLESPACE_DIRECTORY + PATH_SEPARATOR + tablespace.getOid() + PATH_SEPARATOR;
                OutputArchive actual = target.openTablespaceArchive(tablespace);
                OutputArchive archive = manifest != null ? new ManifestRecordingArchive(actual, manifest, prefix)
                        : actual;
                try {
                    scanner.scanTablespace(tablespace, entry -> copyEntry(entry, archive, prefix, false));
                } catch (IOException | RuntimeException exc) {
                    closeQuietly(actual, exc);
                    throw exc;
                }
                archive.close();
                if (progress != null) {
                    progress.tablespaceDone();
                }
            }

            OutputArchive actual = target.openBaseArchive();
            OutputArchive injected = actual;
            if (plan.isWriteRecoveryConf()) {
                injected = new RecoveryConfigInjector(actual, RecoveryConfiguration.render(connectionParameters(),
                        plan.getSlot()));
            }
            OutputArchive base = manifest != null ? new ManifestRecordingArchive(injected, manifest, "") : injected;
            try {
                writeBytes(base, BACKUP_LABEL, BackupLabel.render(start, plan.getLabel(),
                        source.settings().getWalSegmentSize()));
                if (target.getFormat() == OutputFormat.TAR && !tablespaces.isEmpty()) {
                    writeBytes(base, TABLESPACE_MAP, BackupLabel.renderTablespaceMap(start.getTablespaces()));
                }
                scanner.scanDataDirectory(source.getDataDirectory(), tablespaces.keySet(),
                        entry -> copyEntry(entry, base, "", true));
                checkWalCapture();
                end(injected);
            } catch (IOException | RuntimeException exc) {
                closeQuietly(actual, exc);
                throw exc;
            }
            base.close();
            if (progress != null) {
                progress.tablespaceDone();
            }

            if (manifest != null) {
                manifest.addWalRange(session.getTimeline(), session.getStartLsn(), session.getEndLsn());
                target.writeManifest(manifest.build());
                session.transition(SessionState.MANIFEST_WRITTEN);
            }
        }

        private void end(OutputArchive baseArchive) throws IOException {
            Lsn endLsn = source.endBackup();
            backupInProgress = false;
            session.stopped(endLsn);
            log.info("Write-ahead log end point: {}", endLsn);

            if (walCapture != null) {
                walCapture.finish(endLsn);
                walArchive.close();
                walArchive = null;
            }
            if (plan.getWalMode() == WalMode.FETCH) {
                // Not recorded in the manifest, its WAL range covers these segments.
                source.fetchWal(start.getStartLsn(), endLsn, start.getTimeline(),
                        new ArchiveWalSegmentSink(baseArchive, WAL_DIRECTORY + PATH_SEPARATOR));
            }
            if (streamingSlot != null && temporarySlot == null) {
                source.advanceReplicationSlot(streamingSlot, endLsn);
            }
            dropTemporarySlot();
            session.transition(SessionState.BACKUP_STOPPED);
        }

        private void finish() throws IOException {
            if (!plan.isNoSync()) {
                Stopwatch stopwatch = Stopwatch.createStarted();
                target.sync();
                debug(() -> log.debug("Synced backup to disk in {}", stopwatch));
            }
        }

        private void copyEntry(FileEntry entry, OutputArchive archive, String displayPrefix,
                               boolean dataDirectory) throws IOException {
            checkWalCapture();
            switch (entry.getType()) {
                case DIRECTORY -> archive.directory(entry.getPath(), entry.getSourcePath(), entry.getLastModified());
                case SYMLINK -> {
                    if (target.getFormat() == OutputFormat.PLAIN) {
                        Tablespace tablespace = tablespaces.get(entry.getTablespaceOid());
                        archive.symbolicLink(entry.getPath(), target.tablespaceLinkTarget(tablespace),
                                entry.getLastModified());
                    }
                }
                case REGULAR -> copyFile(entry, archive, displayPrefix + entry.getPath(), dataDirectory);
                default -> throw new IllegalArgumentException("Unexpected entry type " + entry.getType());
            }
        }

        private void copyFile(FileEntry entry, OutputArchive archive, String displayPath,
                              boolean dataDirectory) throws IOException {
            InputStream in;
            try {
                in = Files.newInputStream(entry.getPhysicalPath());
            } catch (NoSuchFileException exc) {
                debug(() -> log.debug("File \"{}\" removed before it was copied", displayPath));
                return;
            }

            ChecksumVerifier verifier = verifyChecksums && PathClassifier.isChecksummed(entry.getPath(), dataDirectory)
                    ? new ChecksumVerifier(checksumFailures, displayPath, blockSize, start.getStartLsn()) : null;

            try (InputStream input = in;
                 OutputStream out = archive.file(entry.getPath(), entry.getSourcePath(), entry.getSize(),
                         entry.getLastModified())) {
                byte[] buffer = new byte[blockSize];
                long remaining = entry.getSize();
                while (remaining > 0) {
                    int wanted = (int) Math.min(buffer.length, remaining);
                    int read = IOUtils.readFully(input, buffer, wanted);
                    if (read > 0) {
                        if (verifier != null) {
                            verifier.verify(buffer, read);
                        }
                        out.write(buffer, 0, read);
                        remaining -= read;
                        if (progress != null) {
                            progress.bytesCopied(read);
                        }
                    }
                    if (read < wanted) {
                        long missing = remaining;
                        debug(() -> log.debug("File \"{}\" shrank during backup, padding {} bytes", displayPath,
                                missing));
                        IOUtils.writeZeros(out, remaining);
                        remaining = 0;
                    }
                }
            }
            totalSize.addAndGet(entry.getSize());
        }

        private void writeBytes(OutputArchive archive, String path, byte[] data) throws IOException {
            try (OutputStream out = archive.file(path, data.length, System.currentTimeMillis())) {
                out.write(data);
            }
            totalSize.addAndGet(data.length);
        }

        private long estimateSize() throws IOException {
            AtomicLong size = new AtomicLong();
            for (Tablespace tablespace : tablespaces.values()) {
                scanner.scanTablespace(tablespace, entry -> size.addAndGet(entry.getSize()));
            }
            scanner.scanDataDirectory(source.getDataDirectory(), tablespaces.keySet(),
                    entry -> size.addAndGet(entry.getSize()));
            return size.get();
        }

        private Map<String, String> connectionParameters() {
            Map<String, String> parameters = new LinkedHashMap<>(source.connectionParameters());
            if (!Strings.isNullOrEmpty(plan.getUsername())) {
                parameters.put("user", plan.getUsername());
            }
            if (!Strings.isNullOrEmpty(plan.getHost())) {
                parameters.put("host", plan.getHost());
            }
            if (!Strings.isNullOrEmpty(plan.getPort())) {
                parameters.put("port", plan.getPort());
            }
            return parameters;
        }

        private void checkWalCapture() {
            if (walCapture != null && walCapture.isFailed()) {
                Throwable failure = walCapture.getFailure();
                throw new BackupAbortedException("WAL streaming failed: " + failure.getMessage(), failure);
            }
        }

        private void dropTemporarySlot() throws IOException {
            if (temporarySlot != null) {
                String slot = temporarySlot;
                temporarySlot = null;
                source.dropReplicationSlot(slot);
            }
        }

        private void abort(Exception cause) {
            debug(() -> log.debug("Aborting backup: {}", cause.getMessage()));
            if (walCapture != null) {
                walCapture.cancel();
            }
            if (walArchive != null) {
                closeQuietly(walArchive, cause);
            }
            if (backupInProgress) {
                source.abortBackup();
            }
            try {
                dropTemporarySlot();
            } catch (IOException | RuntimeException exc) {
                cause.addSuppressed(exc);
                log.warn("Failed to drop temporary replication slot", exc);
            }
            if (!session.getState().isTerminal()) {
                session.transition(SessionState.ABORTED);
            }
            if (target != null) {
                target.cleanup(plan.isNoClean());
            }
        }

        private void closeQuietly(OutputArchive archive, Exception cause) {
            try {
                archive.close();
            } catch (IOException | RuntimeException exc) {
                cause.addSuppressed(exc);
            }
        }
    }

    /**
     * Every tablespace mapping must name the location of an existing tablespace.
     */
    static void verifyTablespaceMapping(TablespaceMapping mapping, List<Tablespace> tablespaces) {
        Set<java.nio.file.Path> locations = tablespaces.stream()
                .map(tablespace -> tablespace.getLocation().normalize())
                .collect(Collectors.toSet());
        for (TablespaceMapping.Entry entry : mapping.getEntries()) {
            if (!locations.contains(entry.getSource())) {
                throw new PreconditionException(String.format(
                        "tablespace mapping for \"%s\" does not match any tablespace", entry.getSource()));
            }
        }
    }
}
