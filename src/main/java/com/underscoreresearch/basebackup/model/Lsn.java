package com.underscoreresearch.basebackup.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Write-ahead log position. Printed and parsed in the {@code HIGH/LOW} hexadecimal form.
 */
@Getter
@EqualsAndHashCode
public final class Lsn implements Comparable<Lsn> {
    public static final Lsn INVALID = new Lsn(0);
    private static final Pattern FORMAT = Pattern.compile("^([0-9A-Fa-f]{1,8})/([0-9A-Fa-f]{1,8})$");

    private final long value;

    private Lsn(long value) {
        this.value = value;
    }

    public static Lsn of(long value) {
        return new Lsn(value);
    }

    @JsonCreator
    public static Lsn parse(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = FORMAT.matcher(text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid WAL location \"" + text + "\"");
        }
        long high = Long.parseLong(matcher.group(1), 16);
        long low = Long.parseLong(matcher.group(2), 16);
        return new Lsn((high << 32) | low);
    }

    public Lsn plus(long bytes) {
        return new Lsn(value + bytes);
    }

    public boolean isValid() {
        return value != 0;
    }

    @Override
    public int compareTo(Lsn other) {
        return Long.compareUnsigned(value, other.value);
    }

    @JsonValue
    @Override
    public String toString() {
        return String.format("%X/%X", value >>> 32, value & 0xFFFFFFFFL);
    }
}
