/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.encoding;

import dev.dataobj.metadata.Encoding;
import dev.dataobj.metadata.ValueType;

/**
 * Creates value encoders and decoders for an {@link Encoding} and {@link ValueType}.
 */
public final class ValueCodecs {

    private ValueCodecs() {
    }

    public static ValueEncoder newEncoder(Encoding encoding, ValueType type) {
        checkSupported(encoding, type);
        return switch (encoding) {
            case PLAIN -> new PlainEncoder(type);
            case DELTA -> new DeltaEncoder(type);
        };
    }

    public static ValueDecoder newDecoder(Encoding encoding, ValueType type, byte[] data) {
        checkSupported(encoding, type);
        return switch (encoding) {
            case PLAIN -> new PlainDecoder(type, data);
            case DELTA -> new DeltaDecoder(type, data);
        };
    }

    private static void checkSupported(Encoding encoding, ValueType type) {
        if (!encoding.supports(type)) {
            throw new IllegalArgumentException("Encoding " + encoding + " does not support values of type " + type);
        }
    }
}
