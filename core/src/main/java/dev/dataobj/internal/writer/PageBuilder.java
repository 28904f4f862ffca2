/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.writer;

import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;

import dev.dataobj.dataset.Page;
import dev.dataobj.dataset.StatisticsOptions;
import dev.dataobj.dataset.Value;
import dev.dataobj.internal.compression.Compressor;
import dev.dataobj.internal.encoding.CompactWriter;
import dev.dataobj.internal.encoding.DefinitionLevels;
import dev.dataobj.internal.encoding.RleBitPackingHybridEncoder;
import dev.dataobj.internal.encoding.ValueCodecs;
import dev.dataobj.internal.encoding.ValueEncoder;
import dev.dataobj.metadata.Encoding;
import dev.dataobj.metadata.PageInfo;
import dev.dataobj.metadata.ValueType;

/**
 * Buffers the rows of the page currently being built and turns them into a {@link Page}.
 * <p>
 * The builder is reused: {@link #build(Compressor)} resets it for the next page.
 * </p>
 */
public final class PageBuilder {

    private static final Logger LOG = System.getLogger(PageBuilder.class.getName());

    private final ValueType type;
    private final StatisticsOptions statisticsOptions;
    private final RleBitPackingHybridEncoder levels = new RleBitPackingHybridEncoder(DefinitionLevels.BIT_WIDTH);
    private final ValueEncoder values;
    private StatisticsCollector statistics;
    private int rowsCount;
    private int valuesCount;
    private long bufferedPayload;

    public PageBuilder(ValueType type, Encoding encoding, StatisticsOptions statisticsOptions) {
        this.type = type;
        this.statisticsOptions = statisticsOptions;
        this.values = ValueCodecs.newEncoder(encoding, type);
        this.statistics = new StatisticsCollector(statisticsOptions);
    }

    public int rowsCount() {
        return rowsCount;
    }

    public int valuesCount() {
        return valuesCount;
    }

    /**
     * Payload size in bytes of the values buffered so far, ignoring encoding overhead.
     */
    public long estimatedSize() {
        return bufferedPayload;
    }

    /**
     * Payload size of a single present value: the length of a byte array, or the width of a
     * fixed-size type.
     */
    public static int payloadSize(Value value) {
        return switch (value.type()) {
            case BYTE_ARRAY -> value.byteArrayLength();
            default -> value.type().fixedWidth();
        };
    }

    public void appendNil() {
        levels.write(DefinitionLevels.NIL);
        rowsCount++;
    }

    public void appendEmpty() {
        levels.write(DefinitionLevels.EMPTY);
        rowsCount++;
    }

    public void appendValue(Value value) {
        levels.write(DefinitionLevels.PRESENT);
        values.write(value);
        statistics.observe(value);
        bufferedPayload += payloadSize(value);
        rowsCount++;
        valuesCount++;
    }

    /**
     * Finishes the current page and resets the builder.
     *
     * @return the page together with the statistics collected for it
     */
    public BuiltPage build(Compressor compressor) throws IOException {
        byte[] levelBytes = levels.toByteArray();
        byte[] raw = values.toByteArray();
        byte[] compressed = raw.length == 0 ? raw : compressor.compress(raw, 0, raw.length);

        CompactWriter out = new CompactWriter(CompactWriter.varintSize(levelBytes.length) + levelBytes.length + compressed.length);
        out.writeVarint(levelBytes.length);
        out.writeBytes(levelBytes);
        int headerSize = out.size();
        out.writeBytes(compressed);
        byte[] data = out.toByteArray();

        PageInfo info = new PageInfo(rowsCount, valuesCount, headerSize + raw.length, data.length, statistics.toStatistics());
        LOG.log(Level.DEBUG, "Built {0} page: {1} rows, {2} values, {3} -> {4} bytes",
                type, rowsCount, valuesCount, info.uncompressedSize(), info.compressedSize());

        BuiltPage built = new BuiltPage(new Page(data, info), statistics);
        reset();
        return built;
    }

    private void reset() {
        levels.reset();
        values.reset();
        statistics = new StatisticsCollector(statisticsOptions);
        rowsCount = 0;
        valuesCount = 0;
        bufferedPayload = 0;
    }

    /**
     * A finished page and the collector holding its statistics, for merging into column statistics.
     */
    public record BuiltPage(Page page, StatisticsCollector statistics) {
    }
}
