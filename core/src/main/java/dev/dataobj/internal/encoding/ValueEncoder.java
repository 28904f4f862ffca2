/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.encoding;

import dev.dataobj.dataset.Value;

/**
 * Interface for encoders that append non-empty values to a page's values section.
 * <p>
 * Nil and empty rows are recorded in the page's definition levels and never reach an encoder.
 * </p>
 */
public interface ValueEncoder {

    /**
     * Append a value. The value's type must match the encoder's type.
     */
    void write(Value value);

    /**
     * Number of bytes written since the last {@link #reset()}.
     */
    int size();

    /**
     * Returns the encoded bytes. The encoder must be {@link #reset()} before it is reused.
     */
    byte[] toByteArray();

    /**
     * Discards all written values and any inter-value state.
     */
    void reset();
}
