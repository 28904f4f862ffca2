/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.metadata;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import dev.dataobj.internal.encoding.CompactReader;
import dev.dataobj.internal.encoding.CompactWriter;
import dev.dataobj.metadata.ColumnInfo;
import dev.dataobj.metadata.CompressionCodec;
import dev.dataobj.metadata.Encoding;
import dev.dataobj.metadata.ValueType;

/**
 * Codec for {@link ColumnInfo}. Enum fields are written by id.
 */
public class ColumnInfoCodec {

    public static void write(CompactWriter writer, ColumnInfo info) {
        writer.writeLengthPrefixed(info.name().getBytes(StandardCharsets.UTF_8));
        writer.writeVarint(info.type().getId());
        writer.writeVarint(info.encoding().getId());
        writer.writeVarint(info.compression().getId());
        writer.writeVarint(info.rowsCount());
        writer.writeVarint(info.valuesCount());
        writer.writeVarint(info.uncompressedSize());
        writer.writeVarint(info.compressedSize());
        StatisticsCodec.write(writer, info.statistics());
    }

    public static ColumnInfo read(CompactReader reader) throws IOException {
        String name = new String(reader.readLengthPrefixed(), StandardCharsets.UTF_8);
        ValueType type;
        Encoding encoding;
        CompressionCodec compression;
        try {
            type = ValueType.fromId(reader.readLength());
            encoding = Encoding.fromId(reader.readLength());
            compression = CompressionCodec.fromId(reader.readLength());
        }
        catch (IllegalArgumentException e) {
            throw new IOException("Invalid metadata for column '" + name + "': " + e.getMessage(), e);
        }
        long rowsCount = reader.readVarint();
        long valuesCount = reader.readVarint();
        long uncompressedSize = reader.readVarint();
        long compressedSize = reader.readVarint();
        return new ColumnInfo(name, type, encoding, compression, rowsCount, valuesCount,
                uncompressedSize, compressedSize, StatisticsCodec.read(reader));
    }
}
