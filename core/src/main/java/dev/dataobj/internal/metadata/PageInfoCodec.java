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
import dev.dataobj.metadata.PageInfo;

/**
 * Codec for {@link PageInfo}.
 */
public class PageInfoCodec {

    public static void write(CompactWriter writer, PageInfo info) {
        writer.writeVarint(info.rowsCount());
        writer.writeVarint(info.valuesCount());
        writer.writeVarint(info.uncompressedSize());
        writer.writeVarint(info.compressedSize());
        StatisticsCodec.write(writer, info.statistics());
    }

    public static PageInfo read(CompactReader reader) throws IOException {
        int rowsCount = reader.readLength();
        int valuesCount = reader.readLength();
        int uncompressedSize = reader.readLength();
        int compressedSize = reader.readLength();
        if (valuesCount > rowsCount) {
            throw new IOException("Page declares " + valuesCount + " values for " + rowsCount + " rows");
        }
        return new PageInfo(rowsCount, valuesCount, uncompressedSize, compressedSize, StatisticsCodec.read(reader));
    }
}
