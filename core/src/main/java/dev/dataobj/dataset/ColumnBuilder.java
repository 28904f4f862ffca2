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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import dev.dataobj.internal.compression.CodecFactory;
import dev.dataobj.internal.compression.Compressor;
import dev.dataobj.internal.writer.PageBuilder;
import dev.dataobj.internal.writer.StatisticsCollector;
import dev.dataobj.metadata.ColumnInfo;
import dev.dataobj.metadata.PageInfo;

/**
 * Builds a {@link Column} from values appended in ascending row order.
 * <p>
 * Rows skipped between two appends are stored as nil. A page is cut before an entry when the
 * page already holds at least one row and either the page size hint is 0 or the payload of the
 * buffered values plus the incoming value would exceed the hint. A single value larger than the hint therefore
 * still gets its own page.
 * </p>
 * <p>
 * Instances are not thread-safe.
 * </p>
 *
 * <pre>{@code
 * ColumnBuilder builder = new ColumnBuilder("level", BuilderOptions.builder(ValueType.BYTE_ARRAY)
 *         .compression(CompressionCodec.ZSTD)
 *         .build());
 * builder.append(0, Value.string("info"));
 * builder.append(3, Value.string("warn"));
 * Column column = builder.flush();
 * }</pre>
 */
public final class ColumnBuilder {

    private static final Logger LOG = System.getLogger(ColumnBuilder.class.getName());

    private final String name;
    private final BuilderOptions options;
    private final Compressor compressor;
    private final PageBuilder pageBuilder;
    private final StatisticsCollector columnStatistics;
    private final List<Page> pages = new ArrayList<>();

    private long rowsCount;
    private boolean flushed;

    /**
     * @throws UnsupportedOperationException if the library backing the configured compression is missing
     */
    public ColumnBuilder(String name, BuilderOptions options) {
        this.name = Objects.requireNonNull(name, "name");
        this.options = Objects.requireNonNull(options, "options");
        this.compressor = CodecFactory.getInstance().getCompressor(options.compression());
        this.pageBuilder = new PageBuilder(options.type(), options.encoding(), options.statistics());
        this.columnStatistics = new StatisticsCollector(options.statistics());
    }

    public String name() {
        return name;
    }

    /**
     * Number of rows appended so far, including backfilled nil rows.
     */
    public long rowsCount() {
        return rowsCount;
    }

    /**
     * Number of pages cut so far, not counting the page being filled.
     */
    public int pagesCount() {
        return pages.size();
    }

    /**
     * Appends a value at the given row. Rows between the last appended row and {@code rowIndex}
     * are filled with nil.
     *
     * @param rowIndex row of the value; must be greater than any row appended before
     * @param value the value, either nil or of the column's type
     * @throws OutOfOrderException if {@code rowIndex} is not greater than the last appended row
     * @throws TypeMismatchException if the value is of another type than the column
     * @throws AlreadyFlushedException if the builder was flushed
     * @throws IOException if compressing a finished page fails
     */
    public void append(long rowIndex, Value value) throws IOException {
        Objects.requireNonNull(value, "value");
        checkNotFlushed();
        if (rowIndex < rowsCount) {
            throw new OutOfOrderException(rowIndex, rowsCount - 1);
        }
        if (!value.isNull() && value.type() != options.type()) {
            throw new TypeMismatchException(options.type(), value.type());
        }
        while (rowsCount < rowIndex) {
            appendEntry(Value.nil());
        }
        appendEntry(value);
    }

    private void appendEntry(Value value) throws IOException {
        boolean present = !value.isNull() && !options.zeroPolicy().isEmpty(value);
        int incomingSize = present ? PageBuilder.payloadSize(value) : 0;
        if (pageBuilder.rowsCount() >= options.pageRowLimit()
                || (pageBuilder.rowsCount() > 0 && (options.pageSizeHint() == 0
                        || pageBuilder.estimatedSize() + incomingSize > options.pageSizeHint()))) {
            cutPage();
        }

        if (value.isNull()) {
            pageBuilder.appendNil();
        }
        else if (present) {
            pageBuilder.appendValue(value);
        }
        else {
            pageBuilder.appendEmpty();
        }
        rowsCount++;
    }

    private void cutPage() throws IOException {
        PageBuilder.BuiltPage built = pageBuilder.build(compressor);
        pages.add(built.page());
        columnStatistics.merge(built.statistics());
    }

    /**
     * Finishes the column. The builder cannot be used afterwards.
     *
     * @throws AlreadyFlushedException if the builder was flushed before
     * @throws IOException if compressing the last page fails
     */
    public Column flush() throws IOException {
        checkNotFlushed();
        flushed = true;
        if (pageBuilder.rowsCount() > 0) {
            cutPage();
        }

        long valuesCount = 0;
        long uncompressedSize = 0;
        long compressedSize = 0;
        for (Page page : pages) {
            PageInfo info = page.info();
            valuesCount += info.valuesCount();
            uncompressedSize += info.uncompressedSize();
            compressedSize += info.compressedSize();
        }
        ColumnInfo info = new ColumnInfo(name, options.type(), options.encoding(), options.compression(),
                rowsCount, valuesCount, uncompressedSize, compressedSize, columnStatistics.toStatistics());

        LOG.log(Level.DEBUG, "Flushed column ''{0}'': {1} rows, {2} values in {3} pages, {4} bytes",
                name, rowsCount, valuesCount, pages.size(), compressedSize);
        return new Column(info, pages);
    }

    private void checkNotFlushed() {
        if (flushed) {
            throw new AlreadyFlushedException(name);
        }
    }
}
