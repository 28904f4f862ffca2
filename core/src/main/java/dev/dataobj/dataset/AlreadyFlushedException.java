/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.dataset;

/**
 * Thrown when a {@link ColumnBuilder} is used after {@link ColumnBuilder#flush()}.
 */
public class AlreadyFlushedException extends IllegalStateException {

    public AlreadyFlushedException(String columnName) {
        super("Column builder '" + columnName + "' has already been flushed");
    }
}
