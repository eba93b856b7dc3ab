package com.underscoreresearch.basebackup.io;

import static com.underscoreresearch.basebackup.utils.LogUtil.debug;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.stream.Stream;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class IOUtils {
    private static final int DEFAULT_BUFFER_SIZE = 8192;

    private IOUtils() {
    }

    public static long copyStream(InputStream in, OutputStream out) throws IOException {
        long transferred = 0;
        byte[] buffer = new byte[DEFAULT_BUFFER_SIZE];
        int read;
        while ((read = in.read(buffer, 0, DEFAULT_BUFFER_SIZE)) >= 0) {
            out.write(buffer, 0, read);
            transferred += read;
        }
        return transferred;
    }

    /**
     * Reads as much of {@code buffer} as the stream provides. Returns fewer bytes than the
     * buffer length only at the end of the stream.
     */
    public static int readFully(InputStream in, byte[] buffer) throws IOException {
        return readFully(in, buffer, buffer.length);
    }

    public static int readFully(InputStream in, byte[] buffer, int length) throws IOException {
        int total = 0;
        while (total < length) {
            int read = in.read(buffer, total, length - total);
            if (read < 0) {
                break;
            }
            total += read;
        }
        return total;
    }

    /**
     * Writes exactly {@code length} zero bytes, used when a file shrank while it was copied.
     */
    public static void writeZeros(OutputStream out, long length) throws IOException {
        byte[] buffer = new byte[DEFAULT_BUFFER_SIZE];
        while (length > 0) {
            int chunk = (int) Math.min(buffer.length, length);
            out.write(buffer, 0, chunk);
            length -= chunk;
        }
    }

    public static boolean isEmptyDirectory(Path path) throws IOException {
        try (Stream<Path> children = Files.list(path)) {
            return children.findAny().isEmpty();
        }
    }

    /**
     * Creates the directory and any missing parents. Returns {@code true} if the directory did
     * not exist before.
     */
    public static boolean createDirectory(Path path) throws IOException {
        if (Files.isDirectory(path)) {
            return false;
        }
        Files.createDirectories(path);
        return true;
    }

    public static void deleteFileException(Path path) throws IOException {
        if (Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            try {
                Files.delete(path);
            } catch (IOException exc) {
                throw new IOException("Failed to delete " + path, exc);
            }
        }
    }

    public static void deleteRecursively(Path path) throws IOException {
        if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            deleteContents(path);
        }
        deleteFileException(path);
    }

    public static void deleteContents(Path path) throws IOException {
        if (!Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        try (DirectoryStream<Path> children = Files.newDirectoryStream(path)) {
            for (Path child : children) {
                deleteRecursively(child);
            }
        }
    }

    /**
     * Flushes every file and directory below {@code root} to stable storage. Symbolic links are
     * not followed.
     */
    public static void fsyncTree(Path root) throws IOException {
        if (Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS)) {
            Path[] children;
            try (Stream<Path> list = Files.list(root)) {
                children = list.toArray(Path[]::new);
            }
            Arrays.sort(children);
            for (Path child : children) {
                fsyncTree(child);
            }
            fsyncDirectory(root);
        } else if (Files.isRegularFile(root, LinkOption.NOFOLLOW_LINKS)) {
            fsyncFile(root);
        }
    }

    public static void fsyncFile(Path file) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            channel.force(true);
        }
    }

    public static void fsyncDirectory(Path directory) {
        // Not every platform can open a directory for syncing.
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException exc) {
            debug(() -> log.debug("Could not sync directory \"{}\": {}", directory, exc.getMessage()));
        }
    }
}
