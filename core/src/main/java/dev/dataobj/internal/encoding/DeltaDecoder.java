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
import dev.dataobj.metadata.ValueType;

/**
 * Decoder for DELTA encoding. See {@link DeltaEncoder} for the layout.
 */
public class DeltaDecoder implements ValueDecoder {

    private final ValueType type;
    private final CompactReader reader;
    private long previous;

    public DeltaDecoder(ValueType type, byte[] data) {
        if (type != ValueType.INT64 && type != ValueType.UINT64) {
            throw new IllegalArgumentException("DELTA encoding does not support " + type);
        }
        this.type = type;
        this.reader = new CompactReader(data);
    }

    @Override
    public Value read() throws IOException {
        previous += reader.readZigzag();
        return type == ValueType.INT64 ? Value.int64(previous) : Value.uint64(previous);
    }

    @Override
    public boolean hasRemaining() {
        return reader.hasRemaining();
    }
}
