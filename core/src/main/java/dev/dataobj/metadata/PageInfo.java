/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.metadata;

/**
 * Metadata for a single page.
 *
 * @param rowsCount number of rows in the page, including nil and empty rows
 * @param valuesCount number of non-empty values in the page
 * @param uncompressedSize size of the page before compression of its values section
 * @param compressedSize size of the page as stored
 * @param statistics page statistics, or null if none were collected
 */
public record PageInfo(
        int rowsCount,
        int valuesCount,
        int uncompressedSize,
        int compressedSize,
        Statistics statistics) {
}
