/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.dataset;

import java.util.List;
import java.util.Objects;

import dev.dataobj.metadata.ColumnInfo;

/**
 * A finished column: metadata and its pages in row order.
 * <p>
 * Columns are immutable and may be read by any number of {@link ColumnReader}s concurrently.
 * </p>
 */
public record Column(ColumnInfo info, List<Page> pages) {

    public Column {
        Objects.requireNonNull(info, "info");
        pages = List.copyOf(pages);
    }
}
