package com.underscoreresearch.basebackup.session;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Settings that make a restored backup start as a standby of the source.
 */
public final class RecoveryConfiguration {
    private RecoveryConfiguration() {
    }

    public static String connectionString(Map<String, String> parameters) {
        StringBuilder builder = new StringBuilder();
        for (Map.Entry<String, String> entry : parameters.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(entry.getKey()).append('=').append(quoteConnectionValue(entry.getValue()));
        }
        return builder.toString();
    }

    static String quoteConnectionValue(String value) {
        boolean plain = !value.isEmpty();
        for (char ch : value.toCharArray()) {
            if (!(Character.isLetterOrDigit(ch) || ch == '_' || ch == '.')) {
                plain = false;
                break;
            }
        }
        if (plain) {
            return value;
        }
        StringBuilder builder = new StringBuilder("'");
        for (char ch : value.toCharArray()) {
            if (ch == '\'' || ch == '\\') {
                builder.append('\\');
            }
            builder.append(ch);
        }
        return builder.append('\'').toString();
    }

    /**
     * Quotes a configuration file value. Single quotes and backslashes are doubled.
     */
    static String quoteSetting(String value) {
        StringBuilder builder = new StringBuilder("'");
        for (char ch : value.toCharArray()) {
            if (ch == '\'' || ch == '\\') {
                builder.append(ch);
            }
            builder.append(ch);
        }
        return builder.append('\'').toString();
    }

    /**
     * Lines appended to {@code postgresql.auto.conf}.
     *
     * @param slot Replication slot to use, {@code null} for none.
     */
    public static byte[] render(Map<String, String> connectionParameters, String slot) {
        StringBuilder builder = new StringBuilder();
        builder.append("primary_conninfo = ").append(quoteSetting(connectionString(connectionParameters)))
                .append('\n');
        if (slot != null) {
            builder.append("primary_slot_name = ").append(quoteSetting(slot)).append('\n');
        }
        return builder.toString().getBytes(StandardCharsets.UTF_8);
    }
}
