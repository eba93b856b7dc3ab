package com.underscoreresearch.basebackup.output.implementation;

import static org.hamcrest.MatcherAssert.assertThat;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;

import org.hamcrest.core.Is;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.underscoreresearch.basebackup.file.implementation.PosixPermissionManager;
import com.underscoreresearch.basebackup.io.IOUtils;

class PlainDirectoryArchiveTest {
    private static final long MODIFIED = 1700000000000L;
    private File tempDir;

    @BeforeEach
    public void setup() throws IOException {
        tempDir = Files.createTempDirectory("plain-directory-archive").toFile();
    }

    @AfterEach
    public void teardown() throws IOException {
        IOUtils.deleteRecursively(tempDir.toPath());
    }

    @Test
    public void testExtract() throws IOException {
        Path root = tempDir.toPath().resolve("out");
        PlainDirectoryArchive archive = new PlainDirectoryArchive("base", root, new PosixPermissionManager(false));

        archive.directory("global", MODIFIED);
        try (OutputStream out = archive.file("base/1/1259", 4, MODIFIED)) {
            out.write("data".getBytes(StandardCharsets.UTF_8));
        }
        archive.symbolicLink("pg_tblspc/16400", "/srv/space", MODIFIED);
        archive.close();

        assertThat(Files.isDirectory(root.resolve("global")), Is.is(true));
        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(root.resolve("global"))),
                Is.is("rwx------"));

        Path file = root.resolve("base/1/1259");
        assertThat(Files.readString(file), Is.is("data"));
        assertThat(Files.getLastModifiedTime(file).toMillis(), Is.is(MODIFIED));
        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(file)), Is.is("rw-------"));

        assertThat(Files.readSymbolicLink(root.resolve("pg_tblspc/16400")), Is.is(Paths.get("/srv/space")));
    }

    @Test
    public void testExistingDirectoryKept() throws IOException {
        Path root = tempDir.toPath();
        Files.createDirectories(root.resolve("pg_wal"));
        Files.write(root.resolve("pg_wal").resolve("segment"), new byte[1]);

        PlainDirectoryArchive archive = new PlainDirectoryArchive("base", root, new PosixPermissionManager(true));
        archive.directory("pg_wal", MODIFIED);

        assertThat(Files.exists(root.resolve("pg_wal").resolve("segment")), Is.is(true));
        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(root.resolve("pg_wal"))),
                Is.is("rwxr-x---"));
    }
}
