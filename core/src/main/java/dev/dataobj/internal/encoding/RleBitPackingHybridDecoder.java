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
import java.util.Arrays;

/**
 * Decoder for RLE/Bit-Packing Hybrid encoding.
 * Used for definition levels; see {@link RleBitPackingHybridEncoder} for the layout.
 * <p>
 * Bit-packed runs are unpacked one group of eight values at a time.
 * </p>
 */
public class RleBitPackingHybridDecoder {

    private final byte[] data;
    private final int limit;
    private final int bitWidth;
    private final long valueMask;
    private int position;

    private boolean rle;
    private int rleValue;
    private int rleRemaining;
    private int groupsRemaining;

    private final int[] group = new int[8];
    private int groupPosition = 8;

    public RleBitPackingHybridDecoder(byte[] data, int bitWidth) {
        this(data, 0, data.length, bitWidth);
    }

    public RleBitPackingHybridDecoder(byte[] data, int offset, int length, int bitWidth) {
        if (bitWidth < 0 || bitWidth > 32) {
            throw new IllegalArgumentException("Invalid bit width: " + bitWidth);
        }
        this.data = data;
        this.position = offset;
        this.limit = offset + length;
        this.bitWidth = bitWidth;
        this.valueMask = (1L << bitWidth) - 1;
    }

    /**
     * Read exactly {@code count} values.
     *
     * @throws EOFException if the encoded data holds fewer values
     */
    public void readInts(int[] buffer, int offset, int count) throws IOException {
        int end = offset + count;
        int out = offset;
        while (out < end) {
            if (rle && rleRemaining > 0) {
                int n = Math.min(rleRemaining, end - out);
                Arrays.fill(buffer, out, out + n, rleValue);
                rleRemaining -= n;
                out += n;
            }
            else if (!rle && groupPosition < 8) {
                int n = Math.min(8 - groupPosition, end - out);
                System.arraycopy(group, groupPosition, buffer, out, n);
                groupPosition += n;
                out += n;
            }
            else if (!rle && groupsRemaining > 0) {
                unpackGroup();
            }
            else {
                startRun();
            }
        }
    }

    private void startRun() throws IOException {
        if (position >= limit) {
            throw new EOFException("Unexpected EOF in RLE/bit-packed data");
        }
        long header = readHeader();
        long length = header >>> 1;
        if (length == 0 || length > Integer.MAX_VALUE / 8) {
            throw new IOException("Invalid RLE/bit-packed run header: " + header);
        }

        rle = (header & 1) == 0;
        if (rle) {
            rleRemaining = (int) length;
            rleValue = readRleValue();
        }
        else {
            groupsRemaining = (int) length;
            groupPosition = 8;
        }
    }

    private void unpackGroup() throws EOFException {
        if (position + bitWidth > limit) {
            throw new EOFException("Unexpected EOF in bit-packed run: need " + bitWidth
                    + " bytes, " + (limit - position) + " remaining");
        }
        long bits = 0;
        int available = 0;
        for (int i = 0; i < 8; i++) {
            while (available < bitWidth) {
                bits |= (long) (data[position++] & 0xFF) << available;
                available += 8;
            }
            group[i] = (int) (bits & valueMask);
            bits >>>= bitWidth;
            available -= bitWidth;
        }
        groupsRemaining--;
        groupPosition = 0;
    }

    private int readRleValue() throws EOFException {
        int width = (bitWidth + 7) / 8;
        if (position + width > limit) {
            throw new EOFException("Unexpected EOF in RLE run value");
        }
        int value = 0;
        for (int i = 0; i < width; i++) {
            value |= (data[position++] & 0xFF) << (i * 8);
        }
        return value;
    }

    private long readHeader() throws EOFException {
        long result = 0;
        int shift = 0;
        while (position < limit) {
            int b = data[position++] & 0xFF;
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
            shift += 7;
        }
        throw new EOFException("Unexpected EOF in run header");
    }
}
