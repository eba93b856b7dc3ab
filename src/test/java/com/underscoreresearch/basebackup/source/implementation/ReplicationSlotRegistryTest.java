package com.underscoreresearch.basebackup.source.implementation;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.hamcrest.core.Is;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.underscoreresearch.basebackup.io.IOUtils;
import com.underscoreresearch.basebackup.model.Lsn;
import com.underscoreresearch.basebackup.model.ReplicationSlot;
import com.underscoreresearch.basebackup.utils.PreconditionException;

class ReplicationSlotRegistryTest {
    private File tempDir;
    private Path slotDirectory;
    private ReplicationSlotRegistry registry;

    @AfterEach
    public void teardown() throws IOException {
        IOUtils.deleteRecursively(tempDir.toPath());
    }

    @BeforeEach
    public void setup() throws IOException {
        tempDir = Files.createTempDirectory("replication-slot-registry").toFile();
        slotDirectory = tempDir.toPath().resolve("pg_replslot");
        registry = new ReplicationSlotRegistry(slotDirectory, 2);
        registry.load();
    }

    @Test
    public void testPersistentSlotSurvivesReload() throws IOException {
        registry.create("standby_1", false);
        registry.advance("standby_1", Lsn.parse("0/3000000"));
        assertThat(Files.isRegularFile(slotDirectory.resolve("standby_1").resolve(ReplicationSlotRegistry.STATE_FILE)),
                Is.is(true));

        ReplicationSlotRegistry reloaded = new ReplicationSlotRegistry(slotDirectory, 2);
        reloaded.load();
        ReplicationSlot slot = reloaded.find("standby_1").get();
        assertThat(slot.isTemporary(), Is.is(false));
        assertThat(slot.getRestartLsn(), Is.is(Lsn.parse("0/3000000")));

        reloaded.drop("standby_1");
        assertThat(Files.exists(slotDirectory.resolve("standby_1")), Is.is(false));
        assertThat(reloaded.find("standby_1").isPresent(), Is.is(false));
    }

    @Test
    public void testTemporarySlotNotPersisted() throws IOException {
        registry.create("basebackup_42", true);
        assertThat(registry.find("basebackup_42").get().isTemporary(), Is.is(true));
        assertThat(Files.exists(slotDirectory.resolve("basebackup_42")), Is.is(false));
        registry.drop("basebackup_42");
        assertThat(registry.find("basebackup_42").isPresent(), Is.is(false));
    }

    @Test
    public void testAdvanceNeverMovesBackwards() throws IOException {
        registry.create("slot", true);
        registry.advance("slot", Lsn.parse("0/5000000"));
        registry.advance("slot", Lsn.parse("0/4000000"));
        assertThat(registry.find("slot").get().getRestartLsn(), Is.is(Lsn.parse("0/5000000")));
    }

    @Test
    public void testErrors() throws IOException {
        registry.create("one", false);
        PreconditionException exc = assertThrows(PreconditionException.class, () -> registry.create("one", true));
        assertThat(exc.getMessage(), Is.is("replication slot \"one\" already exists"));

        registry.create("two", true);
        exc = assertThrows(PreconditionException.class, () -> registry.create("three", true));
        assertThat(exc.getMessage(), Is.is("all replication slots are in use"));

        exc = assertThrows(PreconditionException.class, () -> registry.drop("missing"));
        assertThat(exc.getMessage(), Is.is("replication slot \"missing\" does not exist"));

        exc = assertThrows(PreconditionException.class, () -> registry.advance("missing", Lsn.parse("0/1")));
        assertThat(exc.getMessage(), Is.is("replication slot \"missing\" does not exist"));
    }

    @Test
    public void testNameValidation() {
        PreconditionException exc = assertThrows(PreconditionException.class,
                () -> ReplicationSlotRegistry.validateName("Bad-Name"));
        assertThat(exc.getMessage(), Is.is("replication slot name \"Bad-Name\" contains invalid character"));

        exc = assertThrows(PreconditionException.class, () -> ReplicationSlotRegistry.validateName("x".repeat(64)));
        assertThat(exc.getMessage(), Is.is("replication slot name \"" + "x".repeat(64) + "\" is too long"));

        ReplicationSlotRegistry.validateName("x".repeat(63));
    }
}
