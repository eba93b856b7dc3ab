package com.underscoreresearch.basebackup.output;

import java.io.IOException;
import java.io.OutputStream;

import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;
import org.apache.commons.compress.compressors.lz4.BlockLZ4CompressorOutputStream;
import org.apache.commons.compress.compressors.lz4.FramedLZ4CompressorOutputStream;

import com.github.luben.zstd.ZstdOutputStream;
import com.underscoreresearch.basebackup.model.CompressionSpec;

public final class CompressionStreams {
    // Levels from here on trade speed for a better lz4 ratio.
    private static final int LZ4_HIGH_COMPRESSION_LEVEL = 3;

    private CompressionStreams() {
    }

    public static OutputStream compress(OutputStream out, CompressionSpec compression) throws IOException {
        int level = compression.effectiveLevel();
        switch (compression.getMethod()) {
            case NONE:
                return out;
            case GZIP: {
                GzipParameters parameters = new GzipParameters();
                parameters.setCompressionLevel(level);
                return new GzipCompressorOutputStream(out, parameters);
            }
            case LZ4: {
                org.apache.commons.compress.compressors.lz77support.Parameters.Builder builder =
                        BlockLZ4CompressorOutputStream.createParameterBuilder();
                FramedLZ4CompressorOutputStream.Parameters parameters = new FramedLZ4CompressorOutputStream.Parameters(
                        FramedLZ4CompressorOutputStream.BlockSize.M4,
                        level >= LZ4_HIGH_COMPRESSION_LEVEL
                                ? builder.tunedForCompressionRatio().build()
                                : builder.tunedForSpeed().build());
                return new FramedLZ4CompressorOutputStream(out, parameters);
            }
            case ZSTD:
                return new ZstdOutputStream(out, level);
            default:
                throw new IllegalArgumentException("Unsupported compression method " + compression.getMethod());
        }
    }
}
