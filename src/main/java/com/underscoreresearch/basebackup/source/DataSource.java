package com.underscoreresearch.basebackup.source;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import com.underscoreresearch.basebackup.model.CheckpointMode;
import com.underscoreresearch.basebackup.model.Lsn;
import com.underscoreresearch.basebackup.model.ReplicationSlot;
import com.underscoreresearch.basebackup.model.WalMode;
import com.underscoreresearch.basebackup.wal.WalSegmentSink;

/**
 * The database cluster being backed up. Besides the backup start and stop markers it serves
 * the files of the data directory, its WAL and its replication slots.
 */
public interface DataSource {
    void connect() throws IOException;

    ServerSettings settings();

    Path getDataDirectory();

    /**
     * Fails with a {@link com.underscoreresearch.basebackup.utils.PreconditionException} when
     * the WAL configuration of the source can not support a backup with the given WAL mode.
     */
    void checkWalConfiguration(WalMode mode);

    BackupStart beginBackup(String label, CheckpointMode checkpoint) throws IOException;

    Lsn endBackup() throws IOException;

    /**
     * Ends a backup that will not be completed. Does nothing when no backup is in progress.
     */
    void abortBackup();

    ReplicationSlot createReplicationSlot(String name, boolean temporary) throws IOException;

    Optional<ReplicationSlot> findReplicationSlot(String name);

    void advanceReplicationSlot(String name, Lsn lsn) throws IOException;

    void dropReplicationSlot(String name) throws IOException;

    /**
     * Streams WAL segments from the segment containing {@code from} until the segment that starts
     * at or after the LSN published through {@code stopBarrier}. Blocks until done. Interrupting
     * the calling thread cancels the stream.
     */
    void streamWal(Lsn from, int timeline, String slot, CompletableFuture<Lsn> stopBarrier,
                   WalSegmentSink sink) throws IOException, InterruptedException;

    /**
     * Copies the segments covering {@code [from, to)}.
     */
    void fetchWal(Lsn from, Lsn to, int timeline, WalSegmentSink sink) throws IOException;

    void prepareServerDirectory(String directory) throws IOException;

    OutputStream openServerFile(String directory, String name) throws IOException;

    Map<String, String> connectionParameters();
}
