package com.underscoreresearch.basebackup.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import com.google.common.base.Strings;

/**
 * Parsed form of the {@code [client-|server-]METHOD[:LEVEL]} compression option. A bare integer
 * selects gzip at that level, or no compression for 0.
 */
@Data
@AllArgsConstructor
public class CompressionSpec {
    public static final CompressionSpec NONE = new CompressionSpec(CompressionMethod.NONE, null,
            CompressionLocation.CLIENT);
    private static final String OPTION = "--compress";

    private final CompressionMethod method;
    private final Integer level;
    private final CompressionLocation location;

    public static CompressionSpec gzipDefault() {
        return new CompressionSpec(CompressionMethod.GZIP, null, CompressionLocation.CLIENT);
    }

    public static CompressionSpec parse(String value) {
        if (Strings.isNullOrEmpty(value)) {
            throw new IllegalArgumentException("invalid value \"\" for option " + OPTION);
        }

        Integer bareLevel = parseInteger(value);
        if (bareLevel != null) {
            if (bareLevel == 0) {
                return NONE;
            }
            return withLevel(CompressionMethod.GZIP, bareLevel, CompressionLocation.CLIENT);
        }

        String methodName = value;
        String detail = null;
        int separator = value.indexOf(':');
        if (separator >= 0) {
            methodName = value.substring(0, separator);
            detail = value.substring(separator + 1);
        }

        CompressionLocation location = CompressionLocation.CLIENT;
        if (methodName.startsWith("client-")) {
            methodName = methodName.substring("client-".length());
        } else if (methodName.startsWith("server-")) {
            methodName = methodName.substring("server-".length());
            location = CompressionLocation.SERVER;
        }

        CompressionMethod method = CompressionMethod.fromName(methodName);
        if (method == null) {
            throw new IllegalArgumentException("invalid value \"" + value + "\" for option " + OPTION);
        }

        if (detail == null) {
            return new CompressionSpec(method, null, location);
        }
        if (detail.isEmpty()) {
            throw new IllegalArgumentException("no compression level defined for method " + method.getOptionName());
        }

        String levelText = detail.startsWith("level=") ? detail.substring("level=".length()) : detail;
        Integer level = parseInteger(levelText);
        if (level == null) {
            throw new IllegalArgumentException("invalid compression specification \"" + detail
                    + "\" for method " + method.getOptionName());
        }
        if (method == CompressionMethod.NONE) {
            throw new IllegalArgumentException("cannot use compression level with method none");
        }
        return withLevel(method, level, location);
    }

    private static CompressionSpec withLevel(CompressionMethod method, int level, CompressionLocation location) {
        if (level < method.getMinimumLevel() || level > method.getMaximumLevel()) {
            throw new IllegalArgumentException(String.format(
                    "compression algorithm \"%s\" expects a compression level between %d and %d",
                    method.getOptionName(), method.getMinimumLevel(), method.getMaximumLevel()));
        }
        return new CompressionSpec(method, level, location);
    }

    private static Integer parseInteger(String value) {
        if (value.isEmpty()) {
            return null;
        }
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (!(Character.isDigit(ch) || (i == 0 && ch == '-' && value.length() > 1))) {
                return null;
            }
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException exc) {
            return null;
        }
    }

    public boolean isCompressed() {
        return method != CompressionMethod.NONE;
    }

    public int effectiveLevel() {
        return level != null ? level : method.getDefaultLevel();
    }

    @Override
    public String toString() {
        if (level == null) {
            return method.getOptionName();
        }
        return method.getOptionName() + ":" + level;
    }
}
