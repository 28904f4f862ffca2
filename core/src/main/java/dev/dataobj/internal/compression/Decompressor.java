/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.compression;

import java.io.IOException;

/**
 * Interface for decompressing the values section of a page.
 */
public interface Decompressor {

    /**
     * Decompress the given compressed data.
     *
     * @param compressed array holding the compressed data
     * @param offset start of the compressed data
     * @param length length of the compressed data
     * @param uncompressedSize the expected size of uncompressed data
     * @return the uncompressed data
     * @throws IOException if decompression fails or yields a different size
     */
    byte[] decompress(byte[] compressed, int offset, int length, int uncompressedSize) throws IOException;

    /**
     * Get the name of this decompressor.
     */
    String getName();
}
