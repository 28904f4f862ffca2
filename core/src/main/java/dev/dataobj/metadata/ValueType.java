/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.metadata;

/**
 * Value types a column can be declared with.
 * <p>
 * {@link #UNSPECIFIED} is reserved for nil values and cannot be used as a column type.
 * </p>
 */
public enum ValueType {
    UNSPECIFIED(0),
    INT64(1),
    UINT64(2),
    BYTE_ARRAY(3),
    FLOAT64(4),
    BOOLEAN(5);

    private final int id;

    ValueType(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    /**
     * Number of payload bytes a non-empty value of this type contributes to a page size estimate,
     * or -1 for variable-width types.
     */
    public int fixedWidth() {
        return switch (this) {
            case INT64, UINT64, FLOAT64 -> 8;
            case BOOLEAN -> 1;
            case BYTE_ARRAY, UNSPECIFIED -> -1;
        };
    }

    public static ValueType fromId(int id) {
        for (ValueType type : values()) {
            if (type.id == id) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown value type: " + id);
    }
}
