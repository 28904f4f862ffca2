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

/**
 * Pass-through codec for uncompressed pages.
 */
public class UncompressedCodec implements PageCodec {

    @Override
    public byte[] compress(byte[] data, int offset, int length) {
        return Arrays.copyOfRange(data, offset, offset + length);
    }

    @Override
    public byte[] decompress(byte[] compressed, int offset, int length, int uncompressedSize) throws IOException {
        if (length != uncompressedSize) {
            throw new IOException(
                    "Uncompressed size mismatch: expected " + uncompressedSize + ", got " + length);
        }
        return Arrays.copyOfRange(compressed, offset, offset + length);
    }

    @Override
    public String getName() {
        return "NONE";
    }
}
