/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.metadata;

import java.io.IOException;

import dev.dataobj.internal.encoding.CompactReader;
import dev.dataobj.internal.encoding.CompactWriter;
import dev.dataobj.metadata.Statistics;

/**
 * Codec for {@link Statistics}: a flags byte followed by the fields it marks as present.
 */
public class StatisticsCodec {

    private static final int PRESENT = 0x01;
    private static final int HAS_RANGE = 0x02;
    private static final int HAS_CARDINALITY = 0x04;

    public static void write(CompactWriter writer, Statistics statistics) {
        if (statistics == null) {
            writer.writeByte(0);
            return;
        }
        int flags = PRESENT;
        if (statistics.hasRange()) {
            flags |= HAS_RANGE;
        }
        if (statistics.hasCardinality()) {
            flags |= HAS_CARDINALITY;
        }
        writer.writeByte(flags);
        if (statistics.hasRange()) {
            writer.writeLengthPrefixed(statistics.minValue());
            writer.writeLengthPrefixed(statistics.maxValue());
        }
        if (statistics.hasCardinality()) {
            writer.writeVarint(statistics.cardinalityCount());
        }
    }

    public static Statistics read(CompactReader reader) throws IOException {
        int flags = reader.readByte() & 0xFF;
        if (flags == 0) {
            return null;
        }
        if ((flags & PRESENT) == 0 || (flags & ~(PRESENT | HAS_RANGE | HAS_CARDINALITY)) != 0) {
            throw new IOException("Invalid statistics flags: 0x" + Integer.toHexString(flags));
        }
        byte[] min = null;
        byte[] max = null;
        if ((flags & HAS_RANGE) != 0) {
            min = reader.readLengthPrefixed();
            max = reader.readLengthPrefixed();
        }
        Long cardinality = (flags & HAS_CARDINALITY) != 0 ? reader.readVarint() : null;
        return new Statistics(min, max, cardinality);
    }
}
