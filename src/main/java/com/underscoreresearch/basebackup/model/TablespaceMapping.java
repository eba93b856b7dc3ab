package com.underscoreresearch.basebackup.model;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Ordered {@code OLD=NEW} relocation table for tablespaces. Either side may contain a literal
 * {@code =} written as {@code \=}.
 */
@EqualsAndHashCode
public class TablespaceMapping {
    @Getter
    private final List<Entry> entries;

    public TablespaceMapping(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static TablespaceMapping empty() {
        return new TablespaceMapping(Collections.emptyList());
    }

    public static TablespaceMapping parse(List<String> values) {
        List<Entry> entries = new ArrayList<>();
        if (values != null) {
            for (String value : values) {
                Entry entry = parseEntry(value);
                for (Entry existing : entries) {
                    if (existing.getSource().equals(entry.getSource())) {
                        throw new IllegalArgumentException("duplicate tablespace mapping for \""
                                + entry.getSource() + "\"");
                    }
                }
                entries.add(entry);
            }
        }
        return new TablespaceMapping(entries);
    }

    static Entry parseEntry(String value) {
        StringBuilder oldDir = new StringBuilder();
        StringBuilder newDir = new StringBuilder();
        StringBuilder current = oldDir;
        boolean separatorFound = false;

        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '\\' && i + 1 < value.length() && value.charAt(i + 1) == '=') {
                current.append('=');
                i++;
            } else if (ch == '=') {
                if (separatorFound) {
                    throw new IllegalArgumentException("multiple \"=\" signs in tablespace mapping \"" + value + "\"");
                }
                separatorFound = true;
                current = newDir;
            } else {
                current.append(ch);
            }
        }

        if (!separatorFound || oldDir.length() == 0 || newDir.length() == 0) {
            throw new IllegalArgumentException("invalid tablespace mapping format \"" + value
                    + "\", must be \"OLDDIR=NEWDIR\"");
        }

        Path source = Paths.get(oldDir.toString());
        Path destination = Paths.get(newDir.toString());
        if (!source.isAbsolute()) {
            throw new IllegalArgumentException("old directory is not an absolute path in tablespace mapping: "
                    + oldDir);
        }
        if (!destination.isAbsolute()) {
            throw new IllegalArgumentException("new directory is not an absolute path in tablespace mapping: "
                    + newDir);
        }
        return new Entry(source.normalize(), destination.normalize());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Entry find(Path location) {
        Path normalized = location.normalize();
        for (Entry entry : entries) {
            if (entry.getSource().equals(normalized)) {
                return entry;
            }
        }
        return null;
    }

    /**
     * Destination for a tablespace location, the location itself when no mapping applies.
     */
    public Path map(Path location) {
        Entry entry = find(location);
        if (entry != null) {
            return entry.getDestination();
        }
        return location;
    }

    @Data
    @AllArgsConstructor
    public static class Entry {
        private final Path source;
        private final Path destination;
    }
}
