package com.underscoreresearch.basebackup.output.implementation;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.hamcrest.core.Is;
import org.junit.jupiter.api.Test;

import com.underscoreresearch.basebackup.file.implementation.PosixPermissionManager;
import com.underscoreresearch.basebackup.model.CompressionSpec;

class TarOutputArchiveTest {
    private static final long MODIFIED = 1700000000000L;

    private void writeSample(TarOutputArchive archive) throws IOException {
        archive.directory("base", MODIFIED);
        try (OutputStream out = archive.file("base/1", 5, MODIFIED)) {
            out.write("hello".getBytes(StandardCharsets.UTF_8));
        }
        archive.symbolicLink("pg_tblspc/16400", "/srv/space", MODIFIED);
        archive.close();
    }

    private void verifySample(InputStream stream) throws IOException {
        try (TarArchiveInputStream in = new TarArchiveInputStream(stream)) {
            TarArchiveEntry entry = in.getNextTarEntry();
            assertThat(entry.getName(), Is.is("base/"));
            assertThat(entry.isDirectory(), Is.is(true));
            assertThat(entry.getMode() & 0777, Is.is(0700));

            entry = in.getNextTarEntry();
            assertThat(entry.getName(), Is.is("base/1"));
            assertThat(entry.getSize(), Is.is(5L));
            assertThat(entry.getMode() & 0777, Is.is(0600));
            assertThat(entry.getModTime().getTime(), Is.is(MODIFIED));
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8), Is.is("hello"));

            entry = in.getNextTarEntry();
            assertThat(entry.getName(), Is.is("pg_tblspc/16400"));
            assertThat(entry.isSymbolicLink(), Is.is(true));
            assertThat(entry.getLinkName(), Is.is("/srv/space"));

            assertThat(in.getNextTarEntry() == null, Is.is(true));
        }
    }

    @Test
    public void testUncompressed() throws IOException {
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        writeSample(new TarOutputArchive("base.tar", stream, CompressionSpec.NONE,
                new PosixPermissionManager(false)));
        assertThat(stream.size() % 512, Is.is(0));
        verifySample(new ByteArrayInputStream(stream.toByteArray()));
    }

    @Test
    public void testGzip() throws IOException {
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        writeSample(new TarOutputArchive("base.tar.gz", stream, CompressionSpec.parse("gzip:1"),
                new PosixPermissionManager(false)));
        verifySample(new GzipCompressorInputStream(new ByteArrayInputStream(stream.toByteArray())));
    }

    @Test
    public void testGroupAccess() throws IOException {
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        TarOutputArchive archive = new TarOutputArchive("base.tar", stream, CompressionSpec.NONE,
                new PosixPermissionManager(true));
        archive.file("PG_VERSION", 0, MODIFIED).close();
        archive.close();
        try (TarArchiveInputStream in = new TarArchiveInputStream(new ByteArrayInputStream(stream.toByteArray()))) {
            assertThat(in.getNextTarEntry().getMode() & 0777, Is.is(0640));
        }
    }

    @Test
    public void testNameTooLong() throws IOException {
        TarOutputArchive archive = new TarOutputArchive("base.tar", new ByteArrayOutputStream(),
                CompressionSpec.NONE, new PosixPermissionManager(false));
        String name = "x".repeat(100);
        IOException exc = assertThrows(IOException.class, () -> archive.file(name, 0, MODIFIED));
        assertThat(exc.getMessage(), Is.is("file name too long for tar format: \"" + name + "\""));

        TarOutputArchive.checkName("y".repeat(99));

        exc = assertThrows(IOException.class, () -> archive.symbolicLink("pg_tblspc/1", "/" + name, MODIFIED));
        assertThat(exc.getMessage(), Is.is("symbolic link target too long for tar format: file name "
                + "\"pg_tblspc/1\", target \"/" + name + "\""));
    }

    @Test
    public void testDirectoryNameLimit() throws IOException {
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        TarOutputArchive archive = new TarOutputArchive("base.tar", stream, CompressionSpec.NONE,
                new PosixPermissionManager(false));
        String longest = "d".repeat(99);
        archive.directory(longest, MODIFIED);
        archive.directory("e".repeat(98), MODIFIED);

        String name = "x".repeat(100);
        IOException exc = assertThrows(IOException.class, () -> archive.directory(name, MODIFIED));
        assertThat(exc.getMessage(), Is.is("file name too long for tar format: \"" + name + "\""));
        archive.close();

        try (TarArchiveInputStream in = new TarArchiveInputStream(new ByteArrayInputStream(stream.toByteArray()))) {
            TarArchiveEntry entry = in.getNextTarEntry();
            assertThat(entry.getName(), Is.is(longest));
            assertThat(entry.isDirectory(), Is.is(true));
            assertThat(entry.getMode() & 0777, Is.is(0700));

            entry = in.getNextTarEntry();
            assertThat(entry.getName(), Is.is("e".repeat(98) + "/"));
            assertThat(entry.isDirectory(), Is.is(true));

            assertThat(in.getNextTarEntry() == null, Is.is(true));
        }
    }

    @Test
    public void testSingleOpenEntry() throws IOException {
        TarOutputArchive archive = new TarOutputArchive("base.tar", new ByteArrayOutputStream(),
                CompressionSpec.NONE, new PosixPermissionManager(false));
        archive.file("a", 0, MODIFIED);
        assertThrows(IllegalStateException.class, () -> archive.file("b", 0, MODIFIED));
    }
}
