/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.dataset;

import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import dev.dataobj.internal.encoding.CompactReader;
import dev.dataobj.internal.encoding.CompactWriter;
import dev.dataobj.internal.metadata.ColumnInfoCodec;
import dev.dataobj.internal.metadata.PageInfoCodec;
import dev.dataobj.metadata.ColumnInfo;
import dev.dataobj.metadata.PageInfo;
import dev.dataobj.metadata.UnsupportedVersionException;

/**
 * Converts a {@link Column} to a self-contained byte array and back.
 * <p>
 * Layout: the magic {@code DOBJ}, a format version byte, the unsigned varint length of the
 * metadata, the metadata (column info, page count, page infos) and the page data in order.
 * </p>
 */
public final class ColumnSerializer {

    static final int FORMAT_VERSION = 1;

    private static final byte[] MAGIC = "DOBJ".getBytes(StandardCharsets.US_ASCII);

    private ColumnSerializer() {
    }

    public static byte[] write(Column column) {
        CompactWriter metadata = new CompactWriter();
        ColumnInfoCodec.write(metadata, column.info());
        metadata.writeVarint(column.pages().size());
        long dataSize = 0;
        for (Page page : column.pages()) {
            PageInfoCodec.write(metadata, page.info());
            dataSize += page.info().compressedSize();
        }

        CompactWriter out = new CompactWriter((int) Math.min(Integer.MAX_VALUE, metadata.size() + dataSize + 16));
        out.writeBytes(MAGIC);
        out.writeByte(FORMAT_VERSION);
        out.writeLengthPrefixed(metadata.toByteArray());
        for (Page page : column.pages()) {
            out.writeBytes(page.data());
        }
        return out.toByteArray();
    }

    /**
     * @throws UnsupportedVersionException if the data was written in an unknown format version
     * @throws IOException if the data is truncated or malformed
     */
    public static Column read(byte[] data) throws IOException {
        CompactReader reader = new CompactReader(data);
        if (!Arrays.equals(reader.readBytes(MAGIC.length), MAGIC)) {
            throw new IOException("Not a column: magic bytes do not match");
        }
        int version = reader.readByte() & 0xFF;
        if (version != FORMAT_VERSION) {
            throw new UnsupportedVersionException("column format", version);
        }

        CompactReader metadata = new CompactReader(reader.readLengthPrefixed());
        ColumnInfo info = ColumnInfoCodec.read(metadata);
        if (!info.encoding().supports(info.type())) {
            throw new IOException("Encoding " + info.encoding() + " cannot hold values of type " + info.type());
        }
        int pagesCount = metadata.readLength();
        List<PageInfo> pageInfos = new ArrayList<>();
        for (int i = 0; i < pagesCount; i++) {
            pageInfos.add(PageInfoCodec.read(metadata));
        }
        if (metadata.hasRemaining()) {
            throw new IOException("Trailing bytes in column metadata");
        }

        List<Page> pages = new ArrayList<>(pagesCount);
        for (PageInfo pageInfo : pageInfos) {
            if (pageInfo.compressedSize() > reader.remaining()) {
                throw new EOFException("Page " + pages.size() + " needs " + pageInfo.compressedSize()
                        + " bytes, only " + reader.remaining() + " remain");
            }
            pages.add(new Page(reader.readBytes(pageInfo.compressedSize()), pageInfo));
        }
        if (reader.hasRemaining()) {
            throw new IOException("Trailing bytes after " + pagesCount + " pages");
        }
        return new Column(info, pages);
    }
}
