package com.underscoreresearch.basebackup.source;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import lombok.Builder;
import lombok.Data;

import com.google.common.base.Strings;
import com.underscoreresearch.basebackup.wal.WalSegmentName;

/**
 * Server parameters that matter to a base backup, read from {@code postgresql.conf} and then
 * {@code postgresql.auto.conf} so that the latter wins.
 */
@Data
@Builder
public class ServerSettings {
    public static final String CONFIG_FILE = "postgresql.conf";
    public static final String AUTO_CONFIG_FILE = "postgresql.auto.conf";

    private final String walLevel;
    private final int maxWalSenders;
    private final int maxReplicationSlots;
    private final boolean dataChecksums;
    private final int blockSize;
    private final long walSegmentSize;
    private final int port;
    private final String listenAddresses;

    public static ServerSettings load(Path dataDirectory) throws IOException {
        Map<String, String> values = new HashMap<>();
        readConfigFile(dataDirectory.resolve(CONFIG_FILE), values);
        readConfigFile(dataDirectory.resolve(AUTO_CONFIG_FILE), values);
        return fromValues(values);
    }

    public static ServerSettings fromValues(Map<String, String> values) {
        return ServerSettings.builder()
                .walLevel(values.getOrDefault("wal_level", "replica").toLowerCase(Locale.ROOT))
                .maxWalSenders(parseInteger(values, "max_wal_senders", 10))
                .maxReplicationSlots(parseInteger(values, "max_replication_slots", 10))
                .dataChecksums(parseBoolean(values, "data_checksums", true))
                .blockSize(parseInteger(values, "block_size", 8192))
                .walSegmentSize(parseSize(values, "wal_segment_size", WalSegmentName.DEFAULT_SEGMENT_SIZE))
                .port(parseInteger(values, "port", 5432))
                .listenAddresses(values.getOrDefault("listen_addresses", "localhost"))
                .build();
    }

    static void readConfigFile(Path file, Map<String, String> values) throws IOException {
        if (!Files.isRegularFile(file)) {
            return;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                parseLine(line, values);
            }
        }
    }

    static void parseLine(String line, Map<String, String> values) {
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return;
        }

        int nameEnd = 0;
        while (nameEnd < trimmed.length() && !Character.isWhitespace(trimmed.charAt(nameEnd))
                && trimmed.charAt(nameEnd) != '=') {
            nameEnd++;
        }
        String name = trimmed.substring(0, nameEnd).toLowerCase(Locale.ROOT);
        String rest = trimmed.substring(nameEnd).trim();
        if (rest.startsWith("=")) {
            rest = rest.substring(1).trim();
        }

        String value;
        if (rest.startsWith("'")) {
            StringBuilder builder = new StringBuilder();
            int i = 1;
            while (i < rest.length()) {
                char ch = rest.charAt(i);
                if (ch == '\'' && i + 1 < rest.length() && rest.charAt(i + 1) == '\'') {
                    builder.append('\'');
                    i += 2;
                } else if (ch == '\\' && i + 1 < rest.length()) {
                    builder.append(rest.charAt(i + 1));
                    i += 2;
                } else if (ch == '\'') {
                    break;
                } else {
                    builder.append(ch);
                    i++;
                }
            }
            value = builder.toString();
        } else {
            int comment = rest.indexOf('#');
            value = (comment >= 0 ? rest.substring(0, comment) : rest).trim();
        }

        if (!name.isEmpty()) {
            values.put(name, value);
        }
    }

    private static int parseInteger(Map<String, String> values, String name, int defaultValue) {
        String value = values.get(name);
        if (Strings.isNullOrEmpty(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException exc) {
            throw new IllegalArgumentException(String.format("invalid value for parameter \"%s\": \"%s\"",
                    name, value));
        }
    }

    private static boolean parseBoolean(Map<String, String> values, String name, boolean defaultValue) {
        String value = values.get(name);
        if (Strings.isNullOrEmpty(value)) {
            return defaultValue;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "on":
            case "true":
            case "yes":
            case "1":
                return true;
            case "off":
            case "false":
            case "no":
            case "0":
                return false;
            default:
                throw new IllegalArgumentException(String.format("parameter \"%s\" requires a Boolean value",
                        name));
        }
    }

    static long parseSize(Map<String, String> values, String name, long defaultValue) {
        String value = values.get(name);
        if (Strings.isNullOrEmpty(value)) {
            return defaultValue;
        }
        String number = value.trim();
        long multiplier = 1;
        String upper = number.toUpperCase(Locale.ROOT);
        if (upper.endsWith("KB")) {
            multiplier = 1024;
        } else if (upper.endsWith("MB")) {
            multiplier = 1024 * 1024;
        } else if (upper.endsWith("GB")) {
            multiplier = 1024 * 1024 * 1024;
        }
        if (multiplier != 1) {
            number = number.substring(0, number.length() - 2).trim();
        }
        try {
            return Long.parseLong(number) * multiplier;
        } catch (NumberFormatException exc) {
            throw new IllegalArgumentException(String.format("invalid value for parameter \"%s\": \"%s\"",
                    name, value));
        }
    }

    public boolean isWalLevelSufficient() {
        return "replica".equals(walLevel) || "logical".equals(walLevel);
    }
}
