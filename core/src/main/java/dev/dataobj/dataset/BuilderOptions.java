/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.dataset;

import java.util.Objects;

import dev.dataobj.metadata.CompressionCodec;
import dev.dataobj.metadata.Encoding;
import dev.dataobj.metadata.ValueType;

/**
 * Options for a {@link ColumnBuilder}.
 *
 * @param pageSizeHint target size in bytes of the values held by a page before it is cut;
 *        0 cuts a page after every row
 * @param pageRowLimit maximum number of rows in a page, nil and empty rows included
 * @param type type of the values in the column
 * @param compression codec for the values section of each page
 * @param encoding encoding for the values section of each page
 * @param statistics statistics to collect
 * @param zeroPolicy which zero values are stored as empty rows
 */
public record BuilderOptions(
        int pageSizeHint,
        int pageRowLimit,
        ValueType type,
        CompressionCodec compression,
        Encoding encoding,
        StatisticsOptions statistics,
        ZeroPolicy zeroPolicy) {

    public BuilderOptions {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(compression, "compression");
        Objects.requireNonNull(encoding, "encoding");
        Objects.requireNonNull(statistics, "statistics");
        Objects.requireNonNull(zeroPolicy, "zeroPolicy");
        if (pageSizeHint < 0) {
            throw new IllegalArgumentException("Page size hint must not be negative: " + pageSizeHint);
        }
        if (pageRowLimit < 1) {
            throw new IllegalArgumentException("Page row limit must be positive: " + pageRowLimit);
        }
        if (type == ValueType.UNSPECIFIED) {
            throw new IllegalArgumentException("Column type must be specified");
        }
        if (!encoding.supports(type)) {
            throw new IllegalArgumentException("Encoding " + encoding + " does not support values of type " + type);
        }
    }

    public static Builder builder(ValueType type) {
        return new Builder(type);
    }

    /**
     * Builder for {@link BuilderOptions}. Defaults to a 2 MiB page size hint, no row limit
     * beyond {@code Integer.MAX_VALUE}, no compression,
     * PLAIN encoding, no statistics and {@link ZeroPolicy#BYTE_ARRAY_ONLY}.
     */
    public static final class Builder {

        private final ValueType type;
        private int pageSizeHint = 2 * 1024 * 1024;
        private int pageRowLimit = Integer.MAX_VALUE;
        private CompressionCodec compression = CompressionCodec.NONE;
        private Encoding encoding = Encoding.PLAIN;
        private StatisticsOptions statistics = StatisticsOptions.NONE;
        private ZeroPolicy zeroPolicy = ZeroPolicy.BYTE_ARRAY_ONLY;

        private Builder(ValueType type) {
            this.type = type;
        }

        public Builder pageSizeHint(int pageSizeHint) {
            this.pageSizeHint = pageSizeHint;
            return this;
        }

        public Builder pageRowLimit(int pageRowLimit) {
            this.pageRowLimit = pageRowLimit;
            return this;
        }

        public Builder compression(CompressionCodec compression) {
            this.compression = compression;
            return this;
        }

        public Builder encoding(Encoding encoding) {
            this.encoding = encoding;
            return this;
        }

        public Builder statistics(StatisticsOptions statistics) {
            this.statistics = statistics;
            return this;
        }

        public Builder zeroPolicy(ZeroPolicy zeroPolicy) {
            this.zeroPolicy = zeroPolicy;
            return this;
        }

        public BuilderOptions build() {
            return new BuilderOptions(pageSizeHint, pageRowLimit, type, compression, encoding, statistics, zeroPolicy);
        }
    }
}
