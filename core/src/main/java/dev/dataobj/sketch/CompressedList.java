/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.sketch;

import java.io.IOException;
import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Sorted list of sparse keys, stored as variable-length deltas.
 * <p>
 * Keys must be appended in ascending unsigned order. Each key is stored as the difference to its
 * predecessor in 7-bit groups, least significant first, with the high bit marking continuation.
 * </p>
 */
final class CompressedList {

    private int count;
    private int last;
    private byte[] bytes;
    private int length;

    CompressedList() {
        this(0);
    }

    CompressedList(int capacity) {
        this.bytes = new byte[Math.max(capacity, 8)];
    }

    private CompressedList(CompressedList other) {
        this.count = other.count;
        this.last = other.last;
        this.bytes = Arrays.copyOf(other.bytes, Math.max(other.length, 8));
        this.length = other.length;
    }

    int size() {
        return count;
    }

    void append(int key) {
        if (count > 0 && Integer.compareUnsigned(key, last) <= 0) {
            throw new IllegalStateException("Sparse keys must be appended in ascending order");
        }
        int delta = key - last;
        ensureCapacity(5);
        while ((delta & 0xFFFFFF80) != 0) {
            bytes[length++] = (byte) ((delta & 0x7F) | 0x80);
            delta >>>= 7;
        }
        bytes[length++] = (byte) (delta & 0x7F);
        count++;
        last = key;
    }

    Iterator iterator() {
        return new Iterator();
    }

    CompressedList copy() {
        return new CompressedList(this);
    }

    /**
     * Serialized size of {@link #writeTo(byte[], int)}.
     */
    int serializedSize() {
        return 12 + length;
    }

    /**
     * Writes {@code count | last | byte length | bytes}, integers big-endian.
     *
     * @return the offset after the written data
     */
    int writeTo(byte[] out, int offset) {
        offset = putInt(out, offset, count);
        offset = putInt(out, offset, last);
        offset = putInt(out, offset, length);
        System.arraycopy(bytes, 0, out, offset, length);
        return offset + length;
    }

    /**
     * Reads a list written by {@link #writeTo(byte[], int)} and checks that it decodes to
     * exactly {@code count} ascending keys ending in {@code last}.
     */
    static CompressedList readFrom(byte[] data, int offset) throws IOException {
        int available = data.length - offset;
        if (available < 12) {
            throw new SketchTooShortException("sparse list header", 12, available);
        }
        int count = getInt(data, offset);
        int last = getInt(data, offset + 4);
        int length = getInt(data, offset + 8);
        if (length < 0 || length > available - 12) {
            throw new SketchTooShortException("sparse list", length, available - 12);
        }
        if (count < 0) {
            throw new IOException("Invalid sparse list count: " + count);
        }

        CompressedList list = new CompressedList(length);
        list.count = count;
        list.last = last;
        list.length = length;
        System.arraycopy(data, offset + 12, list.bytes, 0, length);
        list.validate();
        return list;
    }

    private void validate() throws IOException {
        Iterator it = iterator();
        int decoded = 0;
        int previous = 0;
        while (it.position < length) {
            int key;
            try {
                key = it.next();
            }
            catch (NoSuchElementException e) {
                throw new IOException("Truncated sparse list entry", e);
            }
            if (decoded > 0 && Integer.compareUnsigned(key, previous) <= 0) {
                throw new IOException("Sparse list keys are not ascending");
            }
            previous = key;
            decoded++;
        }
        if (decoded != count || (count > 0 && previous != last)) {
            throw new IOException("Sparse list holds " + decoded + " keys, header declares " + count);
        }
    }

    private void ensureCapacity(int extra) {
        if (length + extra > bytes.length) {
            bytes = Arrays.copyOf(bytes, Math.max(length + extra, bytes.length * 2));
        }
    }

    static int putInt(byte[] out, int offset, int value) {
        out[offset] = (byte) (value >>> 24);
        out[offset + 1] = (byte) (value >>> 16);
        out[offset + 2] = (byte) (value >>> 8);
        out[offset + 3] = (byte) value;
        return offset + 4;
    }

    static int getInt(byte[] data, int offset) {
        return (data[offset] & 0xFF) << 24
                | (data[offset + 1] & 0xFF) << 16
                | (data[offset + 2] & 0xFF) << 8
                | (data[offset + 3] & 0xFF);
    }

    /**
     * Cursor over the keys in ascending order.
     */
    final class Iterator {

        private int position;
        private int previous;
        private int read;

        boolean hasNext() {
            return read < count && position < length;
        }

        int next() {
            int delta = 0;
            int shift = 0;
            while (true) {
                if (position >= length || shift > 28) {
                    throw new NoSuchElementException();
                }
                int b = bytes[position++];
                delta |= (b & 0x7F) << shift;
                if ((b & 0x80) == 0) {
                    break;
                }
                shift += 7;
            }
            previous += delta;
            read++;
            return previous;
        }
    }
}
