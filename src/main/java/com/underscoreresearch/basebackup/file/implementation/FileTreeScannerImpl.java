package com.underscoreresearch.basebackup.file.implementation;

import static com.underscoreresearch.basebackup.file.PathClassifier.ARCHIVE_STATUS_DIRECTORY;
import static com.underscoreresearch.basebackup.file.PathClassifier.TABLESPACE_DIRECTORY;
import static com.underscoreresearch.basebackup.file.PathClassifier.WAL_DIRECTORY;
import static com.underscoreresearch.basebackup.file.PathClassifier.child;
import static com.underscoreresearch.basebackup.utils.LogUtil.debug;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import lombok.extern.slf4j.Slf4j;

import com.underscoreresearch.basebackup.file.FileTreeScanner;
import com.underscoreresearch.basebackup.file.PathClassifier;
import com.underscoreresearch.basebackup.model.FileClassification;
import com.underscoreresearch.basebackup.model.FileEntry;
import com.underscoreresearch.basebackup.model.FileType;
import com.underscoreresearch.basebackup.model.Tablespace;

@Slf4j
public class FileTreeScannerImpl implements FileTreeScanner {

    @Override
    public void scanDataDirectory(Path root, Set<String> tablespaceOids, EntryConsumer consumer) throws IOException {
        walk(root, "", null, true, null, tablespaceOids, consumer);
    }

    @Override
    public void scanTablespace(Tablespace tablespace, EntryConsumer consumer) throws IOException {
        walk(tablespace.getLocation(), "", null, false, tablespace.getOid(), Collections.emptySet(), consumer);
    }

    private void walk(Path directory, String relative, Path relativeSource, boolean dataDirectory,
                      String tablespaceOid, Set<String> tablespaceOids, EntryConsumer consumer) throws IOException {
        // Names that are not valid in the platform encoding only survive as the listed Path.
        Map<String, Path> children = new TreeMap<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path child : stream) {
                children.put(child.getFileName().toString(), child);
            }
        }

        for (Map.Entry<String, Path> listed : children.entrySet()) {
            String name = listed.getKey();
            String childPath = child(relative, name);
            Path physical = listed.getValue();
            Path sourcePath = relativeSource == null ? physical.getFileName()
                    : relativeSource.resolve(physical.getFileName());

            FileClassification classification = PathClassifier.classify(childPath, dataDirectory,
                    children::containsKey);
            if (!classification.isIncluded()) {
                debug(() -> log.debug("Skipping \"{}\" ({})", childPath, classification));
                continue;
            }

            BasicFileAttributes linkAttributes;
            try {
                linkAttributes = Files.readAttributes(physical, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            } catch (NoSuchFileException exc) {
                debug(() -> log.debug("File \"{}\" removed during scan", childPath));
                continue;
            }

            if (linkAttributes.isSymbolicLink() && dataDirectory && TABLESPACE_DIRECTORY.equals(relative)
                    && tablespaceOids.contains(name)) {
                consumer.accept(FileEntry.builder()
                        .path(childPath)
                        .sourcePath(sourcePath)
                        .physicalPath(physical)
                        .type(FileType.SYMLINK)
                        .classification(classification)
                        .tablespaceOid(name)
                        .lastModified(linkAttributes.lastModifiedTime().toMillis())
                        .linkTarget(Files.readSymbolicLink(physical).toString())
                        .build());
                continue;
            }

            BasicFileAttributes attributes = linkAttributes;
            if (linkAttributes.isSymbolicLink()) {
                try {
                    attributes = Files.readAttributes(physical, BasicFileAttributes.class);
                } catch (NoSuchFileException exc) {
                    log.warn("Skipping dangling symbolic link \"{}\"", physical);
                    continue;
                }
            }

            if (attributes.isDirectory()) {
                FileEntry entry = FileEntry.builder()
                        .path(childPath)
                        .sourcePath(sourcePath)
                        .physicalPath(physical)
                        .type(FileType.DIRECTORY)
                        .classification(classification)
                        .tablespaceOid(tablespaceOid)
                        .lastModified(attributes.lastModifiedTime().toMillis())
                        .build();
                consumer.accept(entry);

                if (PathClassifier.skipsContents(childPath, dataDirectory)) {
                    if (WAL_DIRECTORY.equals(childPath)) {
                        consumer.accept(entry.toBuilder()
                                .path(ARCHIVE_STATUS_DIRECTORY)
                                .sourcePath(sourcePath.resolve("archive_status"))
                                .physicalPath(physical.resolve("archive_status"))
                                .build());
                    }
                } else {
                    walk(physical, childPath, sourcePath, dataDirectory, tablespaceOid, tablespaceOids, consumer);
                }
            } else if (attributes.isRegularFile()) {
                consumer.accept(FileEntry.builder()
                        .path(childPath)
                        .sourcePath(sourcePath)
                        .physicalPath(physical)
                        .type(FileType.REGULAR)
                        .classification(classification)
                        .tablespaceOid(tablespaceOid)
                        .size(attributes.size())
                        .lastModified(attributes.lastModifiedTime().toMillis())
                        .build());
            } else {
                log.warn("Skipping special file \"{}\"", physical);
            }
        }
    }
}
