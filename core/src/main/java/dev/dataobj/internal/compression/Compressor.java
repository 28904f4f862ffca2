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
 * Interface for compressing the values section of a page.
 */
public interface Compressor {

    /**
     * Compress the given data.
     *
     * @param data array holding the uncompressed data
     * @param offset start of the data
     * @param length length of the data
     * @return the compressed data
     * @throws IOException if compression fails
     */
    byte[] compress(byte[] data, int offset, int length) throws IOException;

    /**
     * Get the name of this compressor.
     */
    String getName();
}
