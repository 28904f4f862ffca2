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
 * Decoder for PLAIN encoding. See {@link PlainEncoder} for the layout.
 */
public class PlainDecoder implements ValueDecoder {

    private final ValueType type;
    private final CompactReader reader;

    public PlainDecoder(ValueType type, byte[] data) {
        this.type = type;
        this.reader = new CompactReader(data);
    }

    @Override
    public Value read() throws IOException {
        return switch (type) {
            case INT64 -> Value.int64(reader.readZigzag());
            case UINT64 -> Value.uint64(reader.readVarint());
            case FLOAT64 -> Value.float64(reader.readDoubleLE());
            case BOOLEAN -> {
                byte b = reader.readByte();
                if (b != 0 && b != 1) {
                    throw new IOException("Invalid PLAIN boolean: " + b);
                }
                yield Value.bool(b == 1);
            }
            case BYTE_ARRAY -> Value.byteArray(reader.readLengthPrefixed());
            case UNSPECIFIED -> throw new IOException("Cannot decode values of type " + type);
        };
    }

    @Override
    public boolean hasRemaining() {
        return reader.hasRemaining();
    }
}
