/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.compression;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Codec for GZIP compressed data using the JDK's deflate implementation.
 */
public class GzipCodec implements PageCodec {

    @Override
    public byte[] compress(byte[] data, int offset, int length) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, length / 2));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(data, offset, length);
        }
        return out.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] compressed, int offset, int length, int uncompressedSize) throws IOException {
        byte[] uncompressed = new byte[uncompressedSize];
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed, offset, length))) {
            int read = gzip.readNBytes(uncompressed, 0, uncompressedSize);
            if (read != uncompressedSize || gzip.read() != -1) {
                throw new IOException("GZIP decompression size mismatch: expected " + uncompressedSize);
            }
        }
        return uncompressed;
    }

    @Override
    public String getName() {
        return "GZIP";
    }
}
