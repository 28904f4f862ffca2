/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.encoding;

import java.util.Arrays;

/**
 * Growable buffer for writing varint, zigzag and little-endian fixed-width primitives.
 * The counterpart of {@link CompactReader}.
 */
public class CompactWriter {

    private byte[] buffer;
    private int size;

    public CompactWriter() {
        this(64);
    }

    public CompactWriter(int initialCapacity) {
        this.buffer = new byte[Math.max(initialCapacity, 16)];
    }

    public int size() {
        return size;
    }

    public void reset() {
        size = 0;
    }

    public CompactWriter writeByte(int b) {
        ensureCapacity(1);
        buffer[size++] = (byte) b;
        return this;
    }

    public CompactWriter writeVarint(long value) {
        ensureCapacity(10);
        while ((value & ~0x7FL) != 0) {
            buffer[size++] = (byte) ((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        buffer[size++] = (byte) value;
        return this;
    }

    public CompactWriter writeZigzag(long value) {
        return writeVarint((value << 1) ^ (value >> 63));
    }

    public CompactWriter writeLongLE(long value) {
        ensureCapacity(Long.BYTES);
        for (int i = 0; i < Long.BYTES; i++) {
            buffer[size++] = (byte) (value >>> (i * 8));
        }
        return this;
    }

    public CompactWriter writeDoubleLE(double value) {
        return writeLongLE(Double.doubleToLongBits(value));
    }

    public CompactWriter writeBytes(byte[] bytes) {
        return writeBytes(bytes, 0, bytes.length);
    }

    public CompactWriter writeBytes(byte[] bytes, int offset, int length) {
        ensureCapacity(length);
        System.arraycopy(bytes, offset, buffer, size, length);
        size += length;
        return this;
    }

    /**
     * Write a varint length followed by the bytes.
     */
    public CompactWriter writeLengthPrefixed(byte[] bytes) {
        writeVarint(bytes.length);
        return writeBytes(bytes);
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(buffer, size);
    }

    private void ensureCapacity(int extra) {
        int required = size + extra;
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
        }
    }

    /**
     * Number of bytes {@link #writeVarint(long)} uses for the given value.
     */
    public static int varintSize(long value) {
        int bytes = 1;
        while ((value & ~0x7FL) != 0) {
            value >>>= 7;
            bytes++;
        }
        return bytes;
    }
}
