/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.reader;

import java.io.EOFException;
import java.io.IOException;

import dev.dataobj.dataset.Page;
import dev.dataobj.dataset.Value;
import dev.dataobj.internal.compression.Decompressor;
import dev.dataobj.internal.encoding.CompactReader;
import dev.dataobj.internal.encoding.DefinitionLevels;
import dev.dataobj.internal.encoding.RleBitPackingHybridDecoder;
import dev.dataobj.internal.encoding.ValueCodecs;
import dev.dataobj.internal.encoding.ValueDecoder;
import dev.dataobj.metadata.Encoding;
import dev.dataobj.metadata.PageInfo;
import dev.dataobj.metadata.ValueType;

/**
 * Decodes a page into one {@link Value} per row.
 * <p>
 * Every structural check failure is reported as an {@link IOException}; callers attach the
 * page index.
 * </p>
 */
public final class PageDecoder {

    private static final byte[] EMPTY = new byte[0];

    private final ValueType type;
    private final Encoding encoding;
    private final Decompressor decompressor;

    public PageDecoder(ValueType type, Encoding encoding, Decompressor decompressor) {
        this.type = type;
        this.encoding = encoding;
        this.decompressor = decompressor;
    }

    public Value[] decode(Page page) throws IOException {
        PageInfo info = page.info();
        byte[] data = page.data();
        int rows = info.rowsCount();

        CompactReader reader = new CompactReader(data);
        int levelsLength = reader.readLength();
        int levelsOffset = reader.getBytesRead();
        if (levelsLength > reader.remaining()) {
            throw new EOFException("Definition levels need " + levelsLength + " bytes, page holds " + reader.remaining());
        }
        int[] levels = new int[rows];
        new RleBitPackingHybridDecoder(data, levelsOffset, levelsLength, DefinitionLevels.BIT_WIDTH)
                .readInts(levels, 0, rows);

        int valuesOffset = levelsOffset + levelsLength;
        byte[] raw = decompressValues(data, valuesOffset, info.uncompressedSize() - valuesOffset);
        ValueDecoder values = ValueCodecs.newDecoder(encoding, type, raw);

        Value[] rowValues = new Value[rows];
        int present = 0;
        for (int i = 0; i < rows; i++) {
            rowValues[i] = switch (levels[i]) {
                case DefinitionLevels.NIL -> Value.nil();
                case DefinitionLevels.EMPTY -> Value.zero(type);
                case DefinitionLevels.PRESENT -> {
                    present++;
                    yield values.read();
                }
                default -> throw new IOException("Invalid definition level " + levels[i] + " at row " + i);
            };
        }
        if (present != info.valuesCount()) {
            throw new IOException("Page declares " + info.valuesCount() + " values, definition levels mark " + present);
        }
        if (values.hasRemaining()) {
            throw new IOException("Trailing bytes after " + present + " values");
        }
        return rowValues;
    }

    private byte[] decompressValues(byte[] data, int offset, int uncompressedSize) throws IOException {
        int length = data.length - offset;
        if (uncompressedSize < 0) {
            throw new IOException("Invalid uncompressed values size " + uncompressedSize);
        }
        if (uncompressedSize == 0) {
            if (length != 0) {
                throw new IOException("Unexpected " + length + " bytes in empty values section");
            }
            return EMPTY;
        }
        return decompressor.decompress(data, offset, length, uncompressedSize);
    }
}
