package com.underscoreresearch.basebackup.source.implementation;

import static com.underscoreresearch.basebackup.utils.LogUtil.debug;
import static com.underscoreresearch.basebackup.utils.SerializationUtils.REPLICATION_SLOT_READER;
import static com.underscoreresearch.basebackup.utils.SerializationUtils.REPLICATION_SLOT_WRITER;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.basebackup.io.IOUtils;
import com.underscoreresearch.basebackup.model.Lsn;
import com.underscoreresearch.basebackup.model.ReplicationSlot;
import com.underscoreresearch.basebackup.utils.PreconditionException;

/**
 * Physical replication slots of a local data directory. Persistent slots are stored as
 * {@code pg_replslot/<name>/state}; temporary slots only live as long as this registry.
 */
@Slf4j
public class ReplicationSlotRegistry {
    public static final String STATE_FILE = "state";
    private static final Pattern VALID_NAME = Pattern.compile("^[a-z0-9_]+$");
    private static final int MAX_NAME_LENGTH = 63;

    private final Path slotDirectory;
    private final int maxSlots;
    private final ConcurrentMap<String, ReplicationSlot> slots = new ConcurrentHashMap<>();

    public ReplicationSlotRegistry(Path slotDirectory, int maxSlots) {
        this.slotDirectory = slotDirectory;
        this.maxSlots = maxSlots;
    }

    public void load() throws IOException {
        if (!Files.isDirectory(slotDirectory)) {
            return;
        }
        try (DirectoryStream<Path> children = Files.newDirectoryStream(slotDirectory)) {
            for (Path child : children) {
                Path state = child.resolve(STATE_FILE);
                if (Files.isRegularFile(state)) {
                    ReplicationSlot slot = REPLICATION_SLOT_READER.readValue(state.toFile());
                    slots.put(slot.getName(), slot);
                    debug(() -> log.debug("Loaded replication slot \"{}\"", slot.getName()));
                }
            }
        }
    }

    public static void validateName(String name) {
        if (name.isEmpty()) {
            throw new PreconditionException("replication slot name \"\" is too short");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new PreconditionException(String.format("replication slot name \"%s\" is too long", name));
        }
        if (!VALID_NAME.matcher(name).matches()) {
            throw new PreconditionException(String.format(
                    "replication slot name \"%s\" contains invalid character", name));
        }
    }

    public synchronized ReplicationSlot create(String name, boolean temporary) throws IOException {
        validateName(name);
        if (slots.containsKey(name)) {
            throw new PreconditionException(String.format("replication slot \"%s\" already exists", name));
        }
        if (slots.size() >= maxSlots) {
            throw new PreconditionException("all replication slots are in use");
        }

        ReplicationSlot slot = ReplicationSlot.builder()
                .name(name)
                .temporary(temporary)
                .created(System.currentTimeMillis())
                .build();

        if (!temporary) {
            Path directory = slotDirectory.resolve(name);
            try {
                Files.createDirectories(slotDirectory);
                Files.createDirectory(directory);
            } catch (FileAlreadyExistsException exc) {
                throw new PreconditionException(String.format("replication slot \"%s\" already exists", name));
            }
            writeState(slot);
        }

        if (slots.putIfAbsent(name, slot) != null) {
            throw new PreconditionException(String.format("replication slot \"%s\" already exists", name));
        }
        log.info("Created {} replication slot \"{}\"", temporary ? "temporary" : "persistent", name);
        return slot;
    }

    public Optional<ReplicationSlot> find(String name) {
        return Optional.ofNullable(slots.get(name));
    }

    public synchronized void advance(String name, Lsn lsn) throws IOException {
        ReplicationSlot slot = slots.get(name);
        if (slot == null) {
            throw new PreconditionException(String.format("replication slot \"%s\" does not exist", name));
        }
        if (slot.getRestartLsn() != null && slot.getRestartLsn().compareTo(lsn) >= 0) {
            return;
        }
        ReplicationSlot advanced = slot.toBuilder().restartLsn(lsn).build();
        if (!advanced.isTemporary()) {
            writeState(advanced);
        }
        slots.put(name, advanced);
        debug(() -> log.debug("Advanced replication slot \"{}\" to {}", name, lsn));
    }

    public synchronized void drop(String name) throws IOException {
        ReplicationSlot slot = slots.remove(name);
        if (slot == null) {
            throw new PreconditionException(String.format("replication slot \"%s\" does not exist", name));
        }
        if (!slot.isTemporary()) {
            IOUtils.deleteRecursively(slotDirectory.resolve(name));
        }
        debug(() -> log.debug("Dropped replication slot \"{}\"", name));
    }

    private void writeState(ReplicationSlot slot) throws IOException {
        Path state = slotDirectory.resolve(slot.getName()).resolve(STATE_FILE);
        Path temp = state.resolveSibling(STATE_FILE + ".tmp");
        REPLICATION_SLOT_WRITER.writeValue(temp.toFile(), slot);
        Files.move(temp, state, StandardCopyOption.REPLACE_EXISTING,
                StandardCopyOption.ATOMIC_MOVE);
    }
}
