/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.dataset;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;

import dev.dataobj.internal.encoding.CompactReader;
import dev.dataobj.internal.encoding.CompactWriter;
import dev.dataobj.metadata.UnsupportedVersionException;
import dev.dataobj.metadata.ValueType;

/**
 * A single, nullable value of a column.
 * <p>
 * A value is either nil (no data for a row, {@link #isNull()}) or carries a payload of one
 * {@link ValueType}. Independently of that, a non-nil value is "zero" ({@link #isZero()}) when its
 * payload is the empty byte array, {@code 0}, {@code 0.0} or {@code false}. The two properties are
 * distinct: a zero value was explicitly written, a nil value was not.
 * </p>
 * <p>
 * Values are immutable. Byte arrays are copied on the way in and out.
 * </p>
 */
public final class Value {

    private static final Value NIL = new Value(ValueType.UNSPECIFIED, 0L, null);
    private static final byte[] EMPTY = new byte[0];

    private final ValueType type;
    private final long bits;
    private final byte[] bytes;

    private Value(ValueType type, long bits, byte[] bytes) {
        this.type = type;
        this.bits = bits;
        this.bytes = bytes;
    }

    public static Value nil() {
        return NIL;
    }

    public static Value int64(long value) {
        return new Value(ValueType.INT64, value, null);
    }

    /**
     * Creates an unsigned 64-bit value; {@code value} is interpreted as unsigned.
     */
    public static Value uint64(long value) {
        return new Value(ValueType.UINT64, value, null);
    }

    public static Value float64(double value) {
        return new Value(ValueType.FLOAT64, Double.doubleToRawLongBits(value), null);
    }

    public static Value bool(boolean value) {
        return new Value(ValueType.BOOLEAN, value ? 1L : 0L, null);
    }

    public static Value byteArray(byte[] value) {
        return new Value(ValueType.BYTE_ARRAY, 0L, value.length == 0 ? EMPTY : value.clone());
    }

    public static Value string(String value) {
        return byteArray(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns the zero value of the given type.
     */
    public static Value zero(ValueType type) {
        return switch (type) {
            case INT64 -> int64(0);
            case UINT64 -> uint64(0);
            case FLOAT64 -> float64(0.0);
            case BOOLEAN -> bool(false);
            case BYTE_ARRAY -> new Value(ValueType.BYTE_ARRAY, 0L, EMPTY);
            case UNSPECIFIED -> NIL;
        };
    }

    // Takes ownership of the array; only for decoders that allocate it themselves.
    static Value wrapByteArray(byte[] value) {
        return new Value(ValueType.BYTE_ARRAY, 0L, value);
    }

    public ValueType type() {
        return type;
    }

    public boolean isNull() {
        return type == ValueType.UNSPECIFIED;
    }

    public boolean isZero() {
        return switch (type) {
            case BYTE_ARRAY -> bytes.length == 0;
            case INT64, UINT64, BOOLEAN -> bits == 0;
            case FLOAT64 -> Double.longBitsToDouble(bits) == 0.0;
            case UNSPECIFIED -> false;
        };
    }

    public long int64() {
        checkType(ValueType.INT64);
        return bits;
    }

    public long uint64() {
        checkType(ValueType.UINT64);
        return bits;
    }

    public double float64() {
        checkType(ValueType.FLOAT64);
        return Double.longBitsToDouble(bits);
    }

    public boolean bool() {
        checkType(ValueType.BOOLEAN);
        return bits != 0;
    }

    public byte[] byteArray() {
        checkType(ValueType.BYTE_ARRAY);
        return bytes.length == 0 ? EMPTY : bytes.clone();
    }

    /**
     * Length of the byte array payload without copying it.
     */
    public int byteArrayLength() {
        checkType(ValueType.BYTE_ARRAY);
        return bytes.length;
    }

    private void checkType(ValueType expected) {
        if (type != expected) {
            throw new IllegalStateException("Value of type " + type + " accessed as " + expected);
        }
    }

    /**
     * Compares two non-nil values of the same type by the type's natural order: signed order for
     * INT64, unsigned order for UINT64, {@link Double#compare} for FLOAT64, {@code false < true}
     * for BOOLEAN and unsigned lexicographic order for BYTE_ARRAY.
     */
    public static int compare(Value a, Value b) {
        if (a.type != b.type) {
            throw new IllegalArgumentException("Cannot compare " + a.type + " with " + b.type);
        }
        return switch (a.type) {
            case INT64 -> Long.compare(a.bits, b.bits);
            case UINT64 -> Long.compareUnsigned(a.bits, b.bits);
            case FLOAT64 -> Double.compare(Double.longBitsToDouble(a.bits), Double.longBitsToDouble(b.bits));
            case BOOLEAN -> Long.compare(a.bits, b.bits);
            case BYTE_ARRAY -> Arrays.compareUnsigned(a.bytes, b.bytes);
            case UNSPECIFIED -> throw new IllegalArgumentException("Cannot compare nil values");
        };
    }

    /**
     * Encodes this value as a type id followed by its payload.
     * <p>
     * Layout: unsigned varint type id, then INT64 as zigzag varint, UINT64 as unsigned varint,
     * FLOAT64 as 8 little-endian bytes, BOOLEAN as one byte, BYTE_ARRAY as the raw bytes
     * up to the end of the encoding. Nil encodes as the single type id {@code 0}.
     * </p>
     */
    public byte[] toByteArray() {
        CompactWriter writer = new CompactWriter(bytes == null ? 16 : bytes.length + 2);
        writer.writeVarint(type.getId());
        switch (type) {
            case INT64 -> writer.writeZigzag(bits);
            case UINT64 -> writer.writeVarint(bits);
            case FLOAT64 -> writer.writeLongLE(bits);
            case BOOLEAN -> writer.writeByte((int) bits);
            case BYTE_ARRAY -> writer.writeBytes(bytes);
            case UNSPECIFIED -> {
            }
        }
        return writer.toByteArray();
    }

    /**
     * Decodes a value written by {@link #toByteArray()}.
     *
     * @throws UnsupportedVersionException if the type id is unknown
     * @throws IOException if the payload is truncated or has trailing bytes
     */
    public static Value fromByteArray(byte[] data) throws IOException {
        CompactReader reader = new CompactReader(data);
        long id = reader.readVarint();
        if (id < 0 || id > ValueType.values().length) {
            throw new UnsupportedVersionException("value type", (int) id);
        }
        ValueType type;
        try {
            type = ValueType.fromId((int) id);
        }
        catch (IllegalArgumentException e) {
            throw new UnsupportedVersionException("value type", (int) id);
        }

        Value value = switch (type) {
            case INT64 -> int64(reader.readZigzag());
            case UINT64 -> uint64(reader.readVarint());
            case FLOAT64 -> new Value(ValueType.FLOAT64, reader.readLongLE(), null);
            case BOOLEAN -> {
                byte b = reader.readByte();
                if (b != 0 && b != 1) {
                    throw new IOException("Invalid boolean payload: " + b);
                }
                yield bool(b == 1);
            }
            case BYTE_ARRAY -> {
                byte[] payload = reader.readRemaining();
                yield payload.length == 0 ? zero(ValueType.BYTE_ARRAY) : wrapByteArray(payload);
            }
            case UNSPECIFIED -> NIL;
        };

        if (reader.hasRemaining()) {
            throw new IOException("Trailing " + reader.remaining() + " bytes after " + type + " value");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value other)) {
            return false;
        }
        return type == other.type && bits == other.bits && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * type.hashCode() + Long.hashCode(bits)) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return switch (type) {
            case UNSPECIFIED -> "nil";
            case INT64 -> "INT64(" + bits + ")";
            case UINT64 -> "UINT64(" + Long.toUnsignedString(bits) + ")";
            case FLOAT64 -> "FLOAT64(" + Double.longBitsToDouble(bits) + ")";
            case BOOLEAN -> "BOOLEAN(" + (bits != 0) + ")";
            case BYTE_ARRAY -> "BYTE_ARRAY(" + HexFormat.of().formatHex(bytes) + ")";
        };
    }
}
