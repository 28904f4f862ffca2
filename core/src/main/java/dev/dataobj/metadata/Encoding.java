/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.metadata;

/**
 * Encodings for the values section of a page.
 */
public enum Encoding {
    PLAIN(0),
    DELTA(1);

    private final int id;

    Encoding(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    /**
     * Whether values of the given type can be written with this encoding.
     */
    public boolean supports(ValueType type) {
        return switch (this) {
            case PLAIN -> type != ValueType.UNSPECIFIED;
            case DELTA -> type == ValueType.INT64 || type == ValueType.UINT64;
        };
    }

    public static Encoding fromId(int id) {
        for (Encoding encoding : values()) {
            if (encoding.id == id) {
                return encoding;
            }
        }
        throw new IllegalArgumentException("Unknown encoding: " + id);
    }
}
