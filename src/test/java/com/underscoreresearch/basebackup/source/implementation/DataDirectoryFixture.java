package com.underscoreresearch.basebackup.source.implementation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.stream.Stream;

import com.underscoreresearch.basebackup.checksum.PageChecksum;

/**
 * Builds a small data directory that looks enough like a database cluster for a backup. WAL
 * segments are 1MB and the files inside them are kept tiny.
 */
public final class DataDirectoryFixture {
    public static final int BLOCK_SIZE = 8192;
    public static final String FIRST_SEGMENT = "000000010000000000000002";
    public static final String RELATION = "base/1/1259";

    private DataDirectoryFixture() {
    }

    public static Path create(Path root) throws IOException {
        Files.createDirectories(root);
        write(root.resolve("PG_VERSION"), "16\n");
        write(root.resolve("postgresql.conf"), "wal_level = replica\nwal_segment_size = 1MB\n");
        write(root.resolve("postmaster.pid"), "4242\n");
        write(root.resolve("pg_stat_tmp").resolve("global.stat"), "stats");
        Files.createDirectories(root.resolve("pg_replslot"));
        Files.createDirectories(root.resolve("pg_tblspc"));
        Files.write(mkParents(root.resolve("global").resolve("pg_control")), new byte[64]);
        writeRelation(root.resolve(RELATION), 2);
        Files.createDirectories(root.resolve("pg_wal").resolve("archive_status"));
        addWalSegment(root, FIRST_SEGMENT);
        return root;
    }

    public static void addWalSegment(Path root, String name) throws IOException {
        byte[] data = new byte[1024];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) (i + name.hashCode());
        }
        // Written aside and moved so a concurrent reader never sees a partial segment.
        Path segment = mkParents(root.resolve("pg_wal").resolve(name));
        Path temp = segment.resolveSibling(name + ".tmp");
        Files.write(temp, data);
        Files.move(temp, segment, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Adds a tablespace whose link lives in {@code pg_tblspc} and whose files live in
     * {@code location}, with one relation.
     */
    public static void addTablespace(Path root, String oid, Path location) throws IOException {
        writeRelation(location.resolve("PG_16_202307071").resolve("1").resolve("16500"), 1);
        Files.createSymbolicLink(root.resolve("pg_tblspc").resolve(oid), location);
    }

    /**
     * Creates {@code FOO\xe0\xe0\xe0BAR} in {@code directory}. The name is not valid UTF-8, so it is
     * made through the shell and looked up again by listing the directory.
     */
    public static Path addNonUtf8File(Path directory, String contents) throws IOException {
        Process process = new ProcessBuilder("sh", "-c",
                "printf '%s' \"$1\" > \"$(printf 'FOO\\340\\340\\340BAR')\"", "sh", contents)
                .directory(directory.toFile())
                .redirectErrorStream(true)
                .start();
        try {
            if (process.waitFor() != 0) {
                throw new IOException("Could not create file: "
                        + new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8));
            }
        } catch (InterruptedException exc) {
            Thread.currentThread().interrupt();
            throw new IOException(exc);
        }
        return findNonUtf8File(directory);
    }

    public static Path findNonUtf8File(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(file -> {
                        String name = file.getFileName().toString();
                        return name.startsWith("FOO") && name.endsWith("BAR") && name.length() > 6;
                    })
                    .findFirst()
                    .orElseThrow(() -> new IOException("No FOO...BAR file in " + directory));
        }
    }

    public static void writeRelation(Path file, int pages) throws IOException {
        byte[] data = new byte[BLOCK_SIZE * pages];
        for (int block = 0; block < pages; block++) {
            int offset = block * BLOCK_SIZE;
            for (int i = 24; i < BLOCK_SIZE; i++) {
                data[offset + i] = (byte) ((i * 13 + block) % 251);
            }
            data[offset + PageChecksum.UPPER_OFFSET] = 0x00;
            data[offset + PageChecksum.UPPER_OFFSET + 1] = 0x10;
            int checksum = PageChecksum.compute(data, offset, BLOCK_SIZE, block);
            data[offset + PageChecksum.CHECKSUM_OFFSET] = (byte) checksum;
            data[offset + PageChecksum.CHECKSUM_OFFSET + 1] = (byte) (checksum >> 8);
        }
        Files.write(mkParents(file), data);
    }

    public static void corruptPage(Path file, int block) throws IOException {
        byte[] data = Files.readAllBytes(file);
        data[block * BLOCK_SIZE + 4000] ^= 0x55;
        Files.write(file, data);
    }

    private static void write(Path file, String content) throws IOException {
        Files.writeString(mkParents(file), content, StandardCharsets.UTF_8);
    }

    private static Path mkParents(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        return file;
    }
}
