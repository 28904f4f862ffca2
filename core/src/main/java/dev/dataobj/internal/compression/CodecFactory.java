/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.compression;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.EnumSet;
import java.util.Set;

import dev.dataobj.metadata.CompressionCodec;

/**
 * Factory for compressor and decompressor instances based on compression codec.
 * <p>
 * Codecs are stateless apart from their configuration and may be shared by builders and readers
 * on different threads.
 * </p>
 */
public final class CodecFactory {

    static final String ZSTD_LEVEL_PROPERTY = "dataobj.zstd.level";

    private static final int DEFAULT_ZSTD_LEVEL = 3;

    private static final Logger LOG = System.getLogger(CodecFactory.class.getName());

    private static final Set<CompressionCodec> LOGGED = EnumSet.noneOf(CompressionCodec.class);

    private static final CodecFactory INSTANCE = new CodecFactory(zstdLevelFromProperty());

    private final int zstdLevel;

    CodecFactory(int zstdLevel) {
        this.zstdLevel = zstdLevel;
    }

    /**
     * Returns the shared factory, configured from system properties on first use.
     */
    public static CodecFactory getInstance() {
        return INSTANCE;
    }

    /**
     * Get a compressor for the given compression codec.
     *
     * @throws UnsupportedOperationException if the required library is missing
     */
    public Compressor getCompressor(CompressionCodec codec) {
        return create(codec);
    }

    /**
     * Get a decompressor for the given compression codec.
     *
     * @throws UnsupportedOperationException if the required library is missing
     */
    public Decompressor getDecompressor(CompressionCodec codec) {
        return create(codec);
    }

    /**
     * Get a codec able to both compress and decompress with the given compression codec.
     *
     * @throws UnsupportedOperationException if the required library is missing
     */
    public PageCodec getCodec(CompressionCodec codec) {
        return create(codec);
    }

    private PageCodec create(CompressionCodec codec) {
        PageCodec created = switch (codec) {
            case SNAPPY -> {
                checkClassAvailable("org.xerial.snappy.Snappy",
                        "SNAPPY",
                        "org.xerial.snappy:snappy-java");
                yield new SnappyCodec();
            }
            case ZSTD -> {
                checkClassAvailable("com.github.luben.zstd.Zstd",
                        "ZSTD",
                        "com.github.luben:zstd-jni");
                yield new ZstdCodec(zstdLevel);
            }
            case LZ4 -> {
                checkClassAvailable("net.jpountz.lz4.LZ4Factory",
                        "LZ4",
                        "org.lz4:lz4-java");
                yield new Lz4Codec();
            }
            case GZIP -> new GzipCodec();
            case NONE -> new UncompressedCodec();
        };
        if (codec != CompressionCodec.NONE) {
            logFirstUse(codec);
        }
        return created;
    }

    private static void checkClassAvailable(String className, String codecName, String dependency) {
        try {
            Class.forName(className);
        }
        catch (ClassNotFoundException e) {
            throw new UnsupportedOperationException(
                    "Cannot use " + codecName + " compression: required library not found. " +
                            "Add the following dependency to your project: " + dependency);
        }
    }

    private void logFirstUse(CompressionCodec codec) {
        synchronized (LOGGED) {
            if (!LOGGED.add(codec)) {
                return;
            }
        }
        if (codec == CompressionCodec.ZSTD) {
            LOG.log(Level.INFO, "Using ZSTD codec at level {0}", zstdLevel);
        }
        else {
            LOG.log(Level.INFO, "Using {0} codec", codec);
        }
    }

    static int zstdLevelFromProperty() {
        String value = System.getProperty(ZSTD_LEVEL_PROPERTY);
        if (value == null || value.isBlank()) {
            return DEFAULT_ZSTD_LEVEL;
        }
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            LOG.log(Level.WARNING, "Ignoring invalid value ''{0}'' for {1}, using level {2}",
                    value, ZSTD_LEVEL_PROPERTY, DEFAULT_ZSTD_LEVEL);
            return DEFAULT_ZSTD_LEVEL;
        }
    }
}
