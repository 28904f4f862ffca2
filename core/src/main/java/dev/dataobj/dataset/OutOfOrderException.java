/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.dataset;

/**
 * Thrown when a value is appended at a row index that is not greater than the previous one.
 */
public class OutOfOrderException extends IllegalArgumentException {

    private final long rowIndex;
    private final long lastRowIndex;

    public OutOfOrderException(long rowIndex, long lastRowIndex) {
        super("Row " + rowIndex + " appended after row " + lastRowIndex + "; row indices must be strictly increasing");
        this.rowIndex = rowIndex;
        this.lastRowIndex = lastRowIndex;
    }

    public long getRowIndex() {
        return rowIndex;
    }

    public long getLastRowIndex() {
        return lastRowIndex;
    }
}
