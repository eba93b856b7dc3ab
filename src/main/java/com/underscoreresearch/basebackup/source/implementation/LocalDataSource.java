package com.underscoreresearch.basebackup.source.implementation;

import static com.underscoreresearch.basebackup.utils.LogUtil.debug;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.google.common.base.Strings;
import com.underscoreresearch.basebackup.io.IOUtils;
import com.underscoreresearch.basebackup.model.CheckpointMode;
import com.underscoreresearch.basebackup.model.Lsn;
import com.underscoreresearch.basebackup.model.ReplicationSlot;
import com.underscoreresearch.basebackup.model.Tablespace;
import com.underscoreresearch.basebackup.model.WalMode;
import com.underscoreresearch.basebackup.source.BackupStart;
import com.underscoreresearch.basebackup.source.DataSource;
import com.underscoreresearch.basebackup.source.ServerSettings;
import com.underscoreresearch.basebackup.utils.PreconditionException;
import com.underscoreresearch.basebackup.wal.WalSegmentName;
import com.underscoreresearch.basebackup.wal.WalSegmentSink;

/**
 * Data source backed by a data directory on the local file system. The start of a backup is
 * placed in the newest WAL segment present and its end is the start of the following segment.
 */
@Slf4j
public class LocalDataSource implements DataSource {
    public static final String VERSION_FILE = "PG_VERSION";
    public static final String WAL_DIRECTORY = "pg_wal";
    public static final String SLOT_DIRECTORY = "pg_replslot";
    public static final String TABLESPACE_DIRECTORY = "pg_tblspc";
    // Size of the long page header that precedes the first record of a segment.
    private static final long FIRST_RECORD_OFFSET = 40;
    private static final long CHECKPOINT_RECORD_OFFSET = 0x38;
    private static final long DEFAULT_POLL_INTERVAL = 100;

    @Getter
    private final Path dataDirectory;
    private final long pollInterval;
    private ServerSettings settings;
    private ReplicationSlotRegistry slots;
    private BackupStart activeBackup;

    public LocalDataSource(Path dataDirectory) {
        this(dataDirectory, DEFAULT_POLL_INTERVAL);
    }

    public LocalDataSource(Path dataDirectory, long pollInterval) {
        this.dataDirectory = dataDirectory;
        this.pollInterval = pollInterval;
    }

    @Override
    public synchronized void connect() throws IOException {
        if (settings != null) {
            return;
        }
        if (!Files.isRegularFile(dataDirectory.resolve(VERSION_FILE))) {
            throw new PreconditionException(String.format(
                    "directory \"%s\" is not a database cluster directory", dataDirectory));
        }
        try {
            settings = ServerSettings.load(dataDirectory);
        } catch (IllegalArgumentException exc) {
            throw new PreconditionException(exc.getMessage(), exc);
        }
        slots = new ReplicationSlotRegistry(dataDirectory.resolve(SLOT_DIRECTORY), settings.getMaxReplicationSlots());
        slots.load();
        debug(() -> log.debug("Connected to data directory \"{}\"", dataDirectory));
    }

    @Override
    public ServerSettings settings() {
        return connected().settings;
    }

    private LocalDataSource connected() {
        if (settings == null) {
            throw new IllegalStateException("Data source is not connected");
        }
        return this;
    }

    @Override
    public void checkWalConfiguration(WalMode mode) {
        ServerSettings current = settings();
        if (!current.isWalLevelSufficient()) {
            throw new PreconditionException(String.format(
                    "WAL level not sufficient for making an online backup, wal_level is \"%s\" but must be "
                            + "\"replica\" or \"logical\"", current.getWalLevel()));
        }
        int required = mode == WalMode.STREAM ? 2 : 1;
        if (current.getMaxWalSenders() < required) {
            throw new PreconditionException(String.format(
                    "number of requested standby connections exceeds max_wal_senders (currently %d)",
                    current.getMaxWalSenders()));
        }
    }

    @Override
    public synchronized BackupStart beginBackup(String label, CheckpointMode checkpoint) throws IOException {
        connected();
        if (activeBackup != null) {
            throw new IllegalStateException("A backup is already in progress");
        }
        log.info("Initiating base backup \"{}\", waiting for {} checkpoint to complete", label,
                checkpoint.name().toLowerCase());

        WalSegmentName newest = newestSegment();
        Lsn startLsn = newest.getStart().plus(FIRST_RECORD_OFFSET);
        activeBackup = BackupStart.builder()
                .startLsn(startLsn)
                .checkpointLsn(startLsn.plus(CHECKPOINT_RECORD_OFFSET))
                .timeline(newest.getTimeline())
                .startTime(Instant.now())
                .tablespaces(listTablespaces())
                .build();
        return activeBackup;
    }

    @Override
    public synchronized Lsn endBackup() throws IOException {
        if (activeBackup == null) {
            throw new IllegalStateException("No backup in progress");
        }
        WalSegmentName newest = newestSegment();
        Lsn startLsn = activeBackup.getStartLsn();
        Lsn endLsn = newest.next().getStart();
        if (endLsn.compareTo(startLsn) <= 0) {
            endLsn = WalSegmentName.containing(activeBackup.getTimeline(), startLsn, walSegmentSize())
                    .next().getStart();
        }
        activeBackup = null;
        return endLsn;
    }

    @Override
    public synchronized void abortBackup() {
        if (activeBackup != null) {
            log.info("Aborting backup started at {}", activeBackup.getStartLsn());
            activeBackup = null;
        }
    }

    List<Tablespace> listTablespaces() throws IOException {
        List<Tablespace> tablespaces = new ArrayList<>();
        Path directory = dataDirectory.resolve(TABLESPACE_DIRECTORY);
        if (!Files.isDirectory(directory)) {
            return tablespaces;
        }
        List<Path> links = new ArrayList<>();
        try (DirectoryStream<Path> children = Files.newDirectoryStream(directory)) {
            for (Path child : children) {
                if (Files.isSymbolicLink(child)) {
                    links.add(child);
                }
            }
        }
        links.sort(null);
        for (Path link : links) {
            Path target = directory.resolve(Files.readSymbolicLink(link)).normalize();
            tablespaces.add(new Tablespace(link.getFileName().toString(), target));
        }
        return tablespaces;
    }

    private long walSegmentSize() {
        return settings().getWalSegmentSize();
    }

    private Path walDirectory() {
        return dataDirectory.resolve(WAL_DIRECTORY);
    }

    private WalSegmentName newestSegment() throws IOException {
        WalSegmentName newest = null;
        Path directory = walDirectory();
        if (Files.isDirectory(directory)) {
            try (DirectoryStream<Path> children = Files.newDirectoryStream(directory)) {
                for (Path child : children) {
                    String name = child.getFileName().toString();
                    if (WalSegmentName.isSegmentName(name) && Files.isRegularFile(child)) {
                        WalSegmentName segment = WalSegmentName.parse(name, walSegmentSize());
                        if (newest == null || segment.compareTo(newest) > 0) {
                            newest = segment;
                        }
                    }
                }
            }
        }
        if (newest == null) {
            return new WalSegmentName(1, 1, walSegmentSize());
        }
        return newest;
    }

    @Override
    public ReplicationSlot createReplicationSlot(String name, boolean temporary) throws IOException {
        return connected().slots.create(name, temporary);
    }

    @Override
    public Optional<ReplicationSlot> findReplicationSlot(String name) {
        return connected().slots.find(name);
    }

    @Override
    public void advanceReplicationSlot(String name, Lsn lsn) throws IOException {
        connected().slots.advance(name, lsn);
    }

    @Override
    public void dropReplicationSlot(String name) throws IOException {
        connected().slots.drop(name);
    }

    @Override
    public void streamWal(Lsn from, int timeline, String slot, CompletableFuture<Lsn> stopBarrier,
                          WalSegmentSink sink) throws IOException, InterruptedException {
        if (slot != null && findReplicationSlot(slot).isEmpty()) {
            throw new PreconditionException(String.format("replication slot \"%s\" does not exist", slot));
        }
        WalSegmentName segment = WalSegmentName.containing(timeline, from, walSegmentSize());
        debug(() -> log.debug("Starting WAL streaming at {} on timeline {}", from, timeline));

        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException("WAL streaming cancelled");
            }
            Lsn stop = stopBarrier.getNow(null);
            if (stop != null && segment.getStart().compareTo(stop) >= 0) {
                debug(() -> log.debug("WAL streaming stopped at {}", stop));
                return;
            }

            if (copySegment(segment, sink)) {
                segment = segment.next();
                continue;
            }
            if (stop != null) {
                throw new IOException(String.format("could not find WAL segment \"%s\"", segment));
            }

            try {
                stopBarrier.get(pollInterval, TimeUnit.MILLISECONDS);
            } catch (TimeoutException ignored) {
                // Poll again for new segments.
            } catch (ExecutionException exc) {
                throw new IOException("WAL streaming was aborted", exc.getCause());
            }
        }
    }

    @Override
    public void fetchWal(Lsn from, Lsn to, int timeline, WalSegmentSink sink) throws IOException {
        WalSegmentName segment = WalSegmentName.containing(timeline, from, walSegmentSize());
        while (segment.getStart().compareTo(to) < 0) {
            if (!copySegment(segment, sink)) {
                throw new IOException(String.format("could not find WAL segment \"%s\"", segment));
            }
            segment = segment.next();
        }
    }

    private boolean copySegment(WalSegmentName segment, WalSegmentSink sink) throws IOException {
        Path file = walDirectory().resolve(segment.toString());
        if (!Files.isRegularFile(file)) {
            return false;
        }
        long size = Files.size(file);
        try (InputStream in = Files.newInputStream(file);
             OutputStream out = sink.openSegment(segment, size, Files.getLastModifiedTime(file).toMillis())) {
            long copied = IOUtils.copyStream(in, out);
            if (copied != size) {
                throw new IOException(String.format("WAL segment \"%s\" changed size while being copied", segment));
            }
        }
        debug(() -> log.debug("Copied WAL segment {}", segment));
        return true;
    }

    @Override
    public void prepareServerDirectory(String directory) throws IOException {
        Path path = Paths.get(directory);
        if (!path.isAbsolute()) {
            throw new PreconditionException("relative path not allowed for backup stored on server");
        }
        if (Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            if (!Files.isDirectory(path) || !IOUtils.isEmptyDirectory(path)) {
                throw new PreconditionException(String.format("directory \"%s\" exists but is not empty", directory));
            }
        } else {
            Files.createDirectories(path);
        }
    }

    @Override
    public OutputStream openServerFile(String directory, String name) throws IOException {
        return Files.newOutputStream(Paths.get(directory).resolve(name));
    }

    @Override
    public Map<String, String> connectionParameters() {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("user", System.getProperty("user.name"));
        String host = settings().getListenAddresses();
        if (!Strings.isNullOrEmpty(host)) {
            host = host.split(",")[0].trim();
            if (!host.equals("*") && !host.isEmpty()) {
                parameters.put("host", host);
            }
        }
        parameters.put("port", Integer.toString(settings().getPort()));
        return parameters;
    }
}
