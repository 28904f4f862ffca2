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

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdException;

/**
 * Codec for ZSTD compressed data.
 */
public class ZstdCodec implements PageCodec {

    private final int level;

    public ZstdCodec(int level) {
        this.level = level;
    }

    @Override
    public byte[] compress(byte[] data, int offset, int length) throws IOException {
        byte[] src = offset == 0 && length == data.length ? data : Arrays.copyOfRange(data, offset, offset + length);
        try {
            return Zstd.compress(src, level);
        }
        catch (ZstdException e) {
            throw new IOException("ZSTD compression failed", e);
        }
    }

    @Override
    public byte[] decompress(byte[] compressed, int offset, int length, int uncompressedSize) throws IOException {
        byte[] uncompressed = new byte[uncompressedSize];
        long actualSize;
        try {
            actualSize = Zstd.decompressByteArray(uncompressed, 0, uncompressedSize, compressed, offset, length);
        }
        catch (ZstdException e) {
            throw new IOException("ZSTD decompression failed", e);
        }
        if (Zstd.isError(actualSize)) {
            throw new IOException("ZSTD decompression failed: " + Zstd.getErrorName(actualSize));
        }

        if (actualSize != uncompressedSize) {
            throw new IOException(
                    "ZSTD decompression size mismatch: expected " + uncompressedSize + ", got " + actualSize);
        }

        return uncompressed;
    }

    @Override
    public String getName() {
        return "ZSTD";
    }
}
