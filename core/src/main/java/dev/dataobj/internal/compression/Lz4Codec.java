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

import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4SafeDecompressor;

/**
 * Codec for raw LZ4 block compressed data.
 */
public class Lz4Codec implements PageCodec {

    private final LZ4Compressor compressor;
    private final LZ4SafeDecompressor decompressor;

    public Lz4Codec() {
        LZ4Factory factory = LZ4Factory.fastestInstance();
        this.compressor = factory.fastCompressor();
        this.decompressor = factory.safeDecompressor();
    }

    @Override
    public byte[] compress(byte[] data, int offset, int length) {
        byte[] out = new byte[compressor.maxCompressedLength(length)];
        int written = compressor.compress(data, offset, length, out, 0, out.length);
        return Arrays.copyOf(out, written);
    }

    @Override
    public byte[] decompress(byte[] compressed, int offset, int length, int uncompressedSize) throws IOException {
        byte[] uncompressed = new byte[uncompressedSize];
        int actualSize;
        try {
            actualSize = decompressor.decompress(compressed, offset, length, uncompressed, 0, uncompressedSize);
        }
        catch (LZ4Exception e) {
            throw new IOException("LZ4 decompression failed", e);
        }

        if (actualSize != uncompressedSize) {
            throw new IOException(
                    "LZ4 decompression size mismatch: expected " + uncompressedSize + ", got " + actualSize);
        }

        return uncompressed;
    }

    @Override
    public String getName() {
        return "LZ4";
    }
}
