/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.encoding;

import dev.dataobj.dataset.Value;
import dev.dataobj.metadata.ValueType;

/**
 * Encoder for PLAIN encoding.
 * <p>
 * INT64 values are written as zigzag varints, UINT64 as unsigned varints, FLOAT64 as 8
 * little-endian bytes, BOOLEAN as one byte and BYTE_ARRAY as a varint length followed by the bytes.
 * </p>
 */
public class PlainEncoder implements ValueEncoder {

    private final ValueType type;
    private final CompactWriter writer = new CompactWriter(256);

    public PlainEncoder(ValueType type) {
        this.type = type;
    }

    @Override
    public void write(Value value) {
        switch (type) {
            case INT64 -> writer.writeZigzag(value.int64());
            case UINT64 -> writer.writeVarint(value.uint64());
            case FLOAT64 -> writer.writeDoubleLE(value.float64());
            case BOOLEAN -> writer.writeByte(value.bool() ? 1 : 0);
            case BYTE_ARRAY -> writer.writeLengthPrefixed(value.byteArray());
            case UNSPECIFIED -> throw new IllegalArgumentException("Cannot encode values of type " + type);
        }
    }

    @Override
    public int size() {
        return writer.size();
    }

    @Override
    public byte[] toByteArray() {
        return writer.toByteArray();
    }

    @Override
    public void reset() {
        writer.reset();
    }
}
