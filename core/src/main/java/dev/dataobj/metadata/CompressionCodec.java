/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.metadata;

/**
 * Compression codecs a column's pages can be written with.
 */
public enum CompressionCodec {
    NONE(0),
    SNAPPY(1),
    ZSTD(2),
    LZ4(3),
    GZIP(4);

    private final int id;

    CompressionCodec(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public static CompressionCodec fromId(int id) {
        for (CompressionCodec codec : values()) {
            if (codec.id == id) {
                return codec;
            }
        }
        throw new IllegalArgumentException("Unknown compression codec: " + id);
    }
}
