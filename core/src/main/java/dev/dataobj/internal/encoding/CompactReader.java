/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.encoding;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Reader for varint, zigzag and little-endian fixed-width primitives over a byte array.
 * <p>
 * Every read checks the remaining length and fails with {@link EOFException} on truncated input.
 * </p>
 */
public class CompactReader {

    private final ByteBuffer buffer;

    public CompactReader(byte[] data) {
        this(data, 0, data.length);
    }

    public CompactReader(byte[] data, int offset, int length) {
        this.buffer = ByteBuffer.wrap(data, offset, length).slice().order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * Returns the number of bytes read so far.
     */
    public int getBytesRead() {
        return buffer.position();
    }

    public int remaining() {
        return buffer.remaining();
    }

    public boolean hasRemaining() {
        return buffer.hasRemaining();
    }

    /**
     * Read an unsigned varint.
     */
    public long readVarint() throws IOException {
        long result = 0;
        int shift = 0;
        while (buffer.hasRemaining()) {
            int b = buffer.get() & 0xFF;
            if (shift == 63 && (b & 0x7E) != 0) {
                throw new IOException("Varint overflows 64 bits");
            }
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
            shift += 7;
            if (shift > 63) {
                throw new IOException("Varint longer than 10 bytes");
            }
        }
        throw new EOFException("Unexpected EOF while reading varint");
    }

    /**
     * Read an unsigned varint that must fit a non-negative int, such as a length.
     */
    public int readLength() throws IOException {
        long length = readVarint();
        if (length < 0 || length > Integer.MAX_VALUE) {
            throw new IOException("Length out of range: " + Long.toUnsignedString(length));
        }
        return (int) length;
    }

    /**
     * Read a zigzag-encoded signed integer.
     */
    public long readZigzag() throws IOException {
        long n = readVarint();
        return (n >>> 1) ^ -(n & 1);
    }

    public byte readByte() throws EOFException {
        if (!buffer.hasRemaining()) {
            throw new EOFException("Unexpected EOF while reading byte");
        }
        return buffer.get();
    }

    public long readLongLE() throws EOFException {
        if (buffer.remaining() < Long.BYTES) {
            throw new EOFException("Unexpected EOF while reading 8-byte value");
        }
        return buffer.getLong();
    }

    public double readDoubleLE() throws EOFException {
        return Double.longBitsToDouble(readLongLE());
    }

    public byte[] readBytes(int length) throws EOFException {
        if (buffer.remaining() < length) {
            throw new EOFException("Unexpected EOF while reading " + length + " bytes, " + buffer.remaining() + " remaining");
        }
        byte[] dest = new byte[length];
        buffer.get(dest);
        return dest;
    }

    /**
     * Read a varint length followed by that many bytes.
     */
    public byte[] readLengthPrefixed() throws IOException {
        return readBytes(readLength());
    }

    /**
     * Read everything up to the end of the input.
     */
    public byte[] readRemaining() {
        byte[] dest = new byte[buffer.remaining()];
        buffer.get(dest);
        return dest;
    }
}
