/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.writer;

import org.junit.jupiter.api.Test;

import dev.dataobj.dataset.Page;
import dev.dataobj.dataset.StatisticsOptions;
import dev.dataobj.dataset.Value;
import dev.dataobj.internal.compression.UncompressedCodec;
import dev.dataobj.metadata.Encoding;
import dev.dataobj.metadata.PageInfo;
import dev.dataobj.metadata.ValueType;

import static org.assertj.core.api.Assertions.assertThat;

class PageBuilderTest {

    @Test
    void testPageLayout() throws Exception {
        PageBuilder builder = new PageBuilder(ValueType.BYTE_ARRAY, Encoding.PLAIN, StatisticsOptions.NONE);
        builder.appendValue(Value.string("ab"));
        builder.appendNil();
        builder.appendEmpty();
        assertThat(builder.rowsCount()).isEqualTo(3);
        assertThat(builder.valuesCount()).isEqualTo(1);
        assertThat(builder.estimatedSize()).isEqualTo(2);

        Page page = builder.build(new UncompressedCodec()).page();

        // levels length, one bit-packed group of levels (2, 0, 1), then the PLAIN values
        assertThat(page.data()).containsExactly(3, 3, 0x12, 0, 2, 'a', 'b');
        PageInfo info = page.info();
        assertThat(info.rowsCount()).isEqualTo(3);
        assertThat(info.valuesCount()).isEqualTo(1);
        assertThat(info.uncompressedSize()).isEqualTo(7);
        assertThat(info.compressedSize()).isEqualTo(7);
        assertThat(info.statistics()).isNull();
    }

    @Test
    void testBuildResetsState() throws Exception {
        PageBuilder builder = new PageBuilder(ValueType.INT64, Encoding.DELTA, StatisticsOptions.ALL);
        builder.appendValue(Value.int64(100));
        builder.appendValue(Value.int64(101));
        PageBuilder.BuiltPage first = builder.build(new UncompressedCodec());

        assertThat(builder.rowsCount()).isZero();
        assertThat(builder.estimatedSize()).isZero();

        builder.appendValue(Value.int64(5));
        PageBuilder.BuiltPage second = builder.build(new UncompressedCodec());

        assertThat(first.statistics().toStatistics().cardinalityCount()).isEqualTo(2L);
        assertThat(second.statistics().toStatistics().cardinalityCount()).isEqualTo(1L);
        assertThat(Value.fromByteArray(second.page().info().statistics().minValue())).isEqualTo(Value.int64(5));
        // delta base restarts at zero: zigzag(5) = 10
        assertThat(second.page().data()).endsWith(10);
    }

    @Test
    void testPageWithoutValuesHasEmptyValuesSection() throws Exception {
        PageBuilder builder = new PageBuilder(ValueType.FLOAT64, Encoding.PLAIN, StatisticsOptions.NONE);
        builder.appendNil();
        builder.appendNil();
        Page page = builder.build(new UncompressedCodec()).page();

        assertThat(page.data()).containsExactly(3, 3, 0, 0);
        assertThat(page.info().valuesCount()).isZero();
    }
}
