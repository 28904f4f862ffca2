/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.metadata;

/**
 * Metadata for a column.
 */
public record ColumnInfo(
        String name,
        ValueType type,
        Encoding encoding,
        CompressionCodec compression,
        long rowsCount,
        long valuesCount,
        long uncompressedSize,
        long compressedSize,
        Statistics statistics) {
}
