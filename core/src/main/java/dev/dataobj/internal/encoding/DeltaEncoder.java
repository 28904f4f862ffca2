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
 * Encoder for DELTA encoding of INT64 and UINT64 values.
 * <p>
 * Each value is written as the zigzag varint of its difference to the previous value; the first
 * value of a page is written relative to zero. Differences wrap around on overflow, which the
 * decoder undoes with the same two's complement arithmetic.
 * </p>
 */
public class DeltaEncoder implements ValueEncoder {

    private final ValueType type;
    private final CompactWriter writer = new CompactWriter(256);
    private long previous;

    public DeltaEncoder(ValueType type) {
        if (type != ValueType.INT64 && type != ValueType.UINT64) {
            throw new IllegalArgumentException("DELTA encoding does not support " + type);
        }
        this.type = type;
    }

    @Override
    public void write(Value value) {
        long current = type == ValueType.INT64 ? value.int64() : value.uint64();
        writer.writeZigzag(current - previous);
        previous = current;
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
        previous = 0;
    }
}
