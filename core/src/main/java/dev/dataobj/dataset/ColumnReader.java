/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.dataset;

import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Objects;

import dev.dataobj.internal.compression.CodecFactory;
import dev.dataobj.internal.reader.PageDecoder;
import dev.dataobj.metadata.ColumnInfo;

/**
 * Reads the values of a {@link Column} back in row order, one row per value.
 * <p>
 * Pages are decoded lazily as the reader reaches them. Nil rows read back as {@link Value#nil()}
 * and empty rows as the zero value of the column's type. A reader is not thread-safe, but any
 * number of readers may read the same column.
 * </p>
 */
public final class ColumnReader {

    private static final Logger LOG = System.getLogger(ColumnReader.class.getName());

    private final Column column;
    private final PageDecoder decoder;

    private int nextPage;
    private Value[] current;
    private int position;
    private long rowsRead;

    /**
     * @throws UnsupportedOperationException if the library backing the column's compression is missing
     */
    public ColumnReader(Column column) {
        this.column = Objects.requireNonNull(column, "column");
        ColumnInfo info = column.info();
        this.decoder = new PageDecoder(info.type(), info.encoding(),
                CodecFactory.getInstance().getDecompressor(info.compression()));
    }

    /**
     * Fills {@code buffer} with as many values as the current page has left.
     *
     * @return the number of values read, 0 if {@code buffer} is empty, or -1 once all rows were read
     * @throws CorruptPageException if a page cannot be decoded
     */
    public int read(Value[] buffer) throws IOException {
        if (buffer.length == 0) {
            return 0;
        }
        while (current == null || position == current.length) {
            if (nextPage >= column.pages().size()) {
                return -1;
            }
            current = decodePage(nextPage++);
            position = 0;
        }
        int n = Math.min(buffer.length, current.length - position);
        System.arraycopy(current, position, buffer, 0, n);
        position += n;
        rowsRead += n;
        return n;
    }

    /**
     * Number of rows returned by {@link #read(Value[])} so far.
     */
    public long rowsRead() {
        return rowsRead;
    }

    private Value[] decodePage(int pageIndex) throws CorruptPageException {
        Page page = column.pages().get(pageIndex);
        LOG.log(Level.DEBUG, "Decoding page {0} of column ''{1}'': {2} rows, {3} bytes",
                pageIndex, column.info().name(), page.info().rowsCount(), page.info().compressedSize());
        try {
            return decoder.decode(page);
        }
        catch (IOException e) {
            throw new CorruptPageException(pageIndex, e);
        }
    }
}
