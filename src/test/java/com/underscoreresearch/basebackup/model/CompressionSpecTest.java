package com.underscoreresearch.basebackup.model;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.hamcrest.core.Is;
import org.hamcrest.core.IsNull;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CompressionSpecTest {
    @Test
    public void testBareLevel() {
        CompressionSpec spec = CompressionSpec.parse("5");
        assertThat(spec.getMethod(), Is.is(CompressionMethod.GZIP));
        assertThat(spec.getLevel(), Is.is(5));
        assertThat(CompressionSpec.parse("0"), Is.is(CompressionSpec.NONE));
    }

    @Test
    public void testMethodAndLocation() {
        CompressionSpec spec = CompressionSpec.parse("server-zstd:level=7");
        assertThat(spec.getMethod(), Is.is(CompressionMethod.ZSTD));
        assertThat(spec.getLocation(), Is.is(CompressionLocation.SERVER));
        assertThat(spec.getLevel(), Is.is(7));

        spec = CompressionSpec.parse("client-lz4");
        assertThat(spec.getMethod(), Is.is(CompressionMethod.LZ4));
        assertThat(spec.getLocation(), Is.is(CompressionLocation.CLIENT));
        assertThat(spec.getLevel(), IsNull.nullValue());
        assertThat(spec.effectiveLevel(), Is.is(1));
        assertThat(spec.isCompressed(), Is.is(true));

        assertThat(CompressionSpec.parse("none").isCompressed(), Is.is(false));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "xz|invalid value \"xz\" for option --compress",
            "gzip;9|invalid value \"gzip;9\" for option --compress",
            "gzip:|no compression level defined for method gzip",
            "gzip:10|compression algorithm \"gzip\" expects a compression level between 1 and 9",
            "none:1|cannot use compression level with method none",
            "zstd:fast|invalid compression specification \"fast\" for method zstd"
    })
    public void testInvalid(String value, String message) {
        IllegalArgumentException exc = assertThrows(IllegalArgumentException.class,
                () -> CompressionSpec.parse(value));
        assertThat(exc.getMessage(), Is.is(message));
    }
}
