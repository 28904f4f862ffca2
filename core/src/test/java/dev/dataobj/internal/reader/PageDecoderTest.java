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

import org.junit.jupiter.api.Test;

import dev.dataobj.dataset.Page;
import dev.dataobj.dataset.StatisticsOptions;
import dev.dataobj.dataset.Value;
import dev.dataobj.internal.compression.Lz4Codec;
import dev.dataobj.internal.compression.UncompressedCodec;
import dev.dataobj.internal.writer.PageBuilder;
import dev.dataobj.metadata.Encoding;
import dev.dataobj.metadata.PageInfo;
import dev.dataobj.metadata.ValueType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageDecoderTest {

    @Test
    void testDecodeRows() throws Exception {
        PageBuilder builder = new PageBuilder(ValueType.UINT64, Encoding.PLAIN, StatisticsOptions.NONE);
        builder.appendValue(Value.uint64(1));
        builder.appendNil();
        builder.appendEmpty();
        builder.appendValue(Value.uint64(-1L));
        Page page = builder.build(new Lz4Codec()).page();

        Value[] rows = new PageDecoder(ValueType.UINT64, Encoding.PLAIN, new Lz4Codec()).decode(page);

        assertThat(rows).containsExactly(Value.uint64(1), Value.nil(), Value.uint64(0), Value.uint64(-1L));
    }

    @Test
    void testInvalidDefinitionLevel() {
        // levels: RLE run of one row with level 3
        Page page = new Page(new byte[]{ 2, 2, 3 }, new PageInfo(1, 0, 3, 3, null));
        PageDecoder decoder = new PageDecoder(ValueType.INT64, Encoding.PLAIN, new UncompressedCodec());

        assertThatThrownBy(() -> decoder.decode(page))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("definition level 3");
    }

    @Test
    void testBytesInEmptyValuesSection() {
        Page page = new Page(new byte[]{ 2, 2, 0, 9 }, new PageInfo(1, 0, 3, 4, null));
        PageDecoder decoder = new PageDecoder(ValueType.INT64, Encoding.PLAIN, new UncompressedCodec());

        assertThatThrownBy(() -> decoder.decode(page))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("empty values section");
    }

    @Test
    void testTrailingValueBytes() {
        // one present row, but two encoded values
        Page page = new Page(new byte[]{ 2, 2, 2, 4, 6 }, new PageInfo(1, 1, 5, 5, null));
        PageDecoder decoder = new PageDecoder(ValueType.INT64, Encoding.PLAIN, new UncompressedCodec());

        assertThatThrownBy(() -> decoder.decode(page))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Trailing");
    }

    @Test
    void testMissingLevels() {
        Page page = new Page(new byte[]{ 9, 2 }, new PageInfo(1, 0, 2, 2, null));
        PageDecoder decoder = new PageDecoder(ValueType.INT64, Encoding.PLAIN, new UncompressedCodec());

        assertThatThrownBy(() -> decoder.decode(page)).isInstanceOf(EOFException.class);
    }
}
