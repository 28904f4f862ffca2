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
 * Encoder for RLE/Bit-Packing Hybrid encoding, used for definition levels.
 * <p>
 * Runs of at least eight equal values are written as RLE runs
 * ({@code varint(count << 1) | value in ceil(bitWidth / 8) bytes}); everything else is written as
 * bit-packed groups of eight values ({@code varint(groups << 1 | 1) | groups * bitWidth bytes}),
 * least significant bit first. The last bit-packed group is padded with zeros; readers rely on the
 * externally known value count to ignore the padding.
 * </p>
 */
public class RleBitPackingHybridEncoder {

    private static final int MIN_RLE_RUN = 8;

    private final int bitWidth;
    private final int maxValue;
    private int[] values = new int[64];
    private int count;

    public RleBitPackingHybridEncoder(int bitWidth) {
        if (bitWidth < 1 || bitWidth > 32) {
            throw new IllegalArgumentException("Bit width must be between 1 and 32: " + bitWidth);
        }
        this.bitWidth = bitWidth;
        this.maxValue = bitWidth == 32 ? -1 : (1 << bitWidth) - 1;
    }

    public void write(int value) {
        if (maxValue != -1 && (value < 0 || value > maxValue)) {
            throw new IllegalArgumentException("Value " + value + " does not fit in " + bitWidth + " bits");
        }
        if (count == values.length) {
            values = Arrays.copyOf(values, values.length * 2);
        }
        values[count++] = value;
    }

    /**
     * Number of values written since the last {@link #reset()}.
     */
    public int count() {
        return count;
    }

    public void reset() {
        count = 0;
    }

    public byte[] toByteArray() {
        CompactWriter out = new CompactWriter(count / 4 + 16);
        int i = 0;
        while (i < count) {
            int run = runLength(i);
            if (run >= MIN_RLE_RUN) {
                writeRleRun(out, values[i], run);
                i += run;
                continue;
            }

            int start = i;
            int groups = 0;
            do {
                i += 8;
                groups++;
            } while (i < count && runLength(i) < MIN_RLE_RUN);
            writeBitPacked(out, start, groups);
            i = Math.min(i, count);
        }
        return out.toByteArray();
    }

    private int runLength(int from) {
        int value = values[from];
        int end = from + 1;
        while (end < count && values[end] == value) {
            end++;
        }
        return end - from;
    }

    private void writeRleRun(CompactWriter out, int value, int run) {
        out.writeVarint((long) run << 1);
        int bytesNeeded = (bitWidth + 7) / 8;
        for (int b = 0; b < bytesNeeded; b++) {
            out.writeByte(value >>> (b * 8));
        }
    }

    private void writeBitPacked(CompactWriter out, int start, int groups) {
        out.writeVarint(((long) groups << 1) | 1);
        long bitBuffer = 0;
        int bitsInBuffer = 0;
        int end = start + groups * 8;
        for (int i = start; i < end; i++) {
            long value = i < count ? values[i] & 0xFFFFFFFFL : 0L;
            bitBuffer |= value << bitsInBuffer;
            bitsInBuffer += bitWidth;
            while (bitsInBuffer >= 8) {
                out.writeByte((int) bitBuffer);
                bitBuffer >>>= 8;
                bitsInBuffer -= 8;
            }
        }
        // groups * 8 * bitWidth is always a whole number of bytes
        assert bitsInBuffer == 0;
    }
}
