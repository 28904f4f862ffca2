/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.encoding;

import java.io.IOException;

import dev.dataobj.dataset.Value;

/**
 * Interface for decoders that read values from a page's values section, one value per
 * present row, in the order they were written.
 */
public interface ValueDecoder {

    /**
     * Read the next value.
     *
     * @throws java.io.EOFException if the encoded data ends early
     * @throws IOException if the encoded data is malformed
     */
    Value read() throws IOException;

    /**
     * Whether encoded bytes remain. A fully consumed section must return false.
     */
    boolean hasRemaining();
}
