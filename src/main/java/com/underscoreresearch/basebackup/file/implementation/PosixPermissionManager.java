package com.underscoreresearch.basebackup.file.implementation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.basebackup.file.FilePermissionManager;

@Slf4j
@Getter
public class PosixPermissionManager implements FilePermissionManager {
    public static final int OWNER_DIRECTORY_MODE = 0700;
    public static final int OWNER_FILE_MODE = 0600;
    public static final int GROUP_DIRECTORY_MODE = 0750;
    public static final int GROUP_FILE_MODE = 0640;

    private final int directoryMode;
    private final int fileMode;

    public PosixPermissionManager(boolean groupAccess) {
        if (groupAccess) {
            directoryMode = GROUP_DIRECTORY_MODE;
            fileMode = GROUP_FILE_MODE;
        } else {
            directoryMode = OWNER_DIRECTORY_MODE;
            fileMode = OWNER_FILE_MODE;
        }
    }

    /**
     * Group access is granted to the backup when the data directory itself is group readable.
     */
    public static PosixPermissionManager forDataDirectory(Path dataDirectory) throws IOException {
        PosixFileAttributeView view = Files.getFileAttributeView(dataDirectory, PosixFileAttributeView.class);
        if (view == null) {
            return new PosixPermissionManager(false);
        }
        Set<PosixFilePermission> permissions = view.readAttributes().permissions();
        return new PosixPermissionManager(permissions.contains(PosixFilePermission.GROUP_READ));
    }

    public static int encodePermissions(Set<PosixFilePermission> permissions) {
        return permissions.stream().mapToInt(PosixPermissionManager::encodePermission)
                .reduce(0, (a, b) -> a | b);
    }

    private static int encodePermission(PosixFilePermission permission) {
        return switch (permission) {
            case OWNER_READ -> 0400;
            case OWNER_WRITE -> 0200;
            case OWNER_EXECUTE -> 0100;
            case GROUP_READ -> 040;
            case GROUP_WRITE -> 020;
            case GROUP_EXECUTE -> 010;
            case OTHERS_READ -> 04;
            case OTHERS_WRITE -> 02;
            case OTHERS_EXECUTE -> 01;
        };
    }

    public static Set<PosixFilePermission> decodePermissions(int permissions) {
        Set<PosixFilePermission> result = EnumSet.noneOf(PosixFilePermission.class);
        for (PosixFilePermission permission : PosixFilePermission.values()) {
            if ((permissions & encodePermission(permission)) != 0) {
                result.add(permission);
            }
        }
        return result;
    }

    @Override
    public void applyDirectory(Path path) throws IOException {
        apply(path, directoryMode);
    }

    @Override
    public void applyFile(Path path) throws IOException {
        apply(path, fileMode);
    }

    private void apply(Path path, int mode) throws IOException {
        PosixFileAttributeView view = Files.getFileAttributeView(path, PosixFileAttributeView.class);
        if (view != null) {
            view.setPermissions(decodePermissions(mode));
        }
    }
}
