/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.compression;

import java.io.IOException;
import java.util.Arrays;

import org.xerial.snappy.Snappy;

/**
 * Codec for Snappy compressed data.
 */
public class SnappyCodec implements PageCodec {

    @Override
    public byte[] compress(byte[] data, int offset, int length) throws IOException {
        byte[] out = new byte[Snappy.maxCompressedLength(length)];
        int written = Snappy.compress(data, offset, length, out, 0);
        return Arrays.copyOf(out, written);
    }

    @Override
    public byte[] decompress(byte[] compressed, int offset, int length, int uncompressedSize) throws IOException {
        if (!Snappy.isValidCompressedBuffer(compressed, offset, length)) {
            throw new IOException("Invalid Snappy compressed data");
        }
        int declaredSize = Snappy.uncompressedLength(compressed, offset, length);
        if (declaredSize != uncompressedSize) {
            throw new IOException(
                    "Snappy decompression size mismatch: expected " + uncompressedSize + ", got " + declaredSize);
        }
        byte[] uncompressed = new byte[uncompressedSize];
        Snappy.uncompress(compressed, offset, length, uncompressed, 0);
        return uncompressed;
    }

    @Override
    public String getName() {
        return "SNAPPY";
    }
}
