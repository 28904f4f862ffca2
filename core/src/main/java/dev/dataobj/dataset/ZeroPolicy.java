/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.dataset;

import dev.dataobj.metadata.ValueType;

/**
 * Decides which zero values a column stores as empty rows.
 * <p>
 * Empty rows keep their position and read back as the type's zero value, but carry no bytes in
 * the values section, do not count towards a page's or column's values count and never
 * contribute to statistics.
 * </p>
 */
public enum ZeroPolicy {

    /**
     * Only zero-length byte arrays are empty; numeric zeros and {@code false} are ordinary values.
     */
    BYTE_ARRAY_ONLY,

    /**
     * Every zero value is empty.
     */
    ALL_TYPES;

    public boolean isEmpty(Value value) {
        if (value.isNull() || !value.isZero()) {
            return false;
        }
        return this == ALL_TYPES || value.type() == ValueType.BYTE_ARRAY;
    }
}
