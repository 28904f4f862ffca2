/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.dataset;

import java.util.Arrays;
import java.util.Objects;

import dev.dataobj.metadata.PageInfo;

/**
 * A finished page: its stored bytes and metadata.
 * <p>
 * Layout of {@code data}: unsigned varint length of the definition levels, the definition levels
 * (RLE/bit-packing hybrid, bit width 2, one per row), then the compressed values section.
 * The array is copied on construction and on access.
 * </p>
 */
public record Page(byte[] data, PageInfo info) {

    public Page {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(info, "info");
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Page other && Arrays.equals(data, other.data) && info.equals(other.info);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(data) + info.hashCode();
    }

    @Override
    public String toString() {
        return "Page[" + data.length + " bytes, info=" + info + "]";
    }
}
