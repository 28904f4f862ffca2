/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.dataset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import dev.dataobj.metadata.CompressionCodec;
import dev.dataobj.metadata.PageInfo;
import dev.dataobj.metadata.ValueType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnReaderTest {

    @Test
    void testReadDoesNotCrossPageBoundaries() throws Exception {
        Column column = buildInts(CompressionCodec.NONE, 5, 24);
        assertThat(column.pages()).hasSize(2);

        ColumnReader reader = new ColumnReader(column);
        Value[] buffer = new Value[10];

        assertThat(reader.read(buffer)).isEqualTo(3);
        assertThat(Arrays.copyOf(buffer, 3)).containsExactly(Value.int64(0), Value.int64(1), Value.int64(2));
        assertThat(reader.read(buffer)).isEqualTo(2);
        assertThat(Arrays.copyOf(buffer, 2)).containsExactly(Value.int64(3), Value.int64(4));
        assertThat(reader.read(buffer)).isEqualTo(-1);
        assertThat(reader.read(buffer)).isEqualTo(-1);
        assertThat(reader.rowsRead()).isEqualTo(5);
    }

    @Test
    void testSmallBufferDrainsPageInSteps() throws Exception {
        Column column = buildInts(CompressionCodec.ZSTD, 7, 1024);
        ColumnReader reader = new ColumnReader(column);
        Value[] buffer = new Value[2];

        List<Integer> counts = new ArrayList<>();
        int n;
        while ((n = reader.read(buffer)) != -1) {
            counts.add(n);
        }
        assertThat(counts).containsExactly(2, 2, 2, 1);
    }

    @Test
    void testEmptyBuffer() throws Exception {
        ColumnReader reader = new ColumnReader(buildInts(CompressionCodec.NONE, 3, 1024));

        assertThat(reader.read(new Value[0])).isZero();
        assertThat(reader.rowsRead()).isZero();
    }

    @Test
    void testIndependentReaders() throws Exception {
        Column column = buildInts(CompressionCodec.GZIP, 10, 16);

        assertThat(ColumnBuilderTest.readAll(column)).hasSize(10);
        assertThat(ColumnBuilderTest.readAll(column)).isEqualTo(ColumnBuilderTest.readAll(column));
    }

    @Test
    void testTruncatedPageIsCorrupt() throws Exception {
        Column column = buildInts(CompressionCodec.NONE, 3, 0);
        Page page = column.pages().get(1);
        List<Page> pages = new ArrayList<>(column.pages());
        pages.set(1, new Page(Arrays.copyOf(page.data(), 1), page.info()));
        Column corrupt = new Column(column.info(), pages);

        ColumnReader reader = new ColumnReader(corrupt);
        Value[] buffer = new Value[4];
        assertThat(reader.read(buffer)).isEqualTo(1);
        assertThatThrownBy(() -> reader.read(buffer))
                .isInstanceOf(CorruptPageException.class)
                .satisfies(e -> assertThat(((CorruptPageException) e).getPageIndex()).isEqualTo(1));
    }

    @Test
    void testValuesCountMismatchIsCorrupt() throws Exception {
        Column column = buildInts(CompressionCodec.NONE, 4, 1024);
        Page page = column.pages().get(0);
        PageInfo info = page.info();
        PageInfo wrong = new PageInfo(info.rowsCount(), info.valuesCount() - 1, info.uncompressedSize(),
                info.compressedSize(), info.statistics());
        Column corrupt = new Column(column.info(), List.of(new Page(page.data(), wrong)));

        assertThatThrownBy(() -> new ColumnReader(corrupt).read(new Value[4]))
                .isInstanceOf(CorruptPageException.class)
                .hasMessageContaining("Corrupt page 0");
    }

    @Test
    void testGarbledZstdPageIsCorrupt() throws Exception {
        Column column = buildInts(CompressionCodec.ZSTD, 50, 1024);
        Page page = column.pages().get(0);
        byte[] data = page.data().clone();
        // Levels are a single RLE run here, so the values section starts after 3 bytes
        Arrays.fill(data, 3, data.length, (byte) 0x5A);
        Column corrupt = new Column(column.info(), List.of(new Page(data, page.info())));

        assertThatThrownBy(() -> new ColumnReader(corrupt).read(new Value[64]))
                .isInstanceOf(CorruptPageException.class);
    }

    private static Column buildInts(CompressionCodec codec, int count, int pageSizeHint) throws Exception {
        ColumnBuilder builder = new ColumnBuilder("ints", BuilderOptions.builder(ValueType.INT64)
                .pageSizeHint(pageSizeHint)
                .compression(codec)
                .build());
        for (int i = 0; i < count; i++) {
            builder.append(i, Value.int64(i));
        }
        return builder.flush();
    }
}
