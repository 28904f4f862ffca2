/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.dataset;

import dev.dataobj.metadata.ValueType;

/**
 * Thrown when a value's type does not match the type a column was declared with.
 */
public class TypeMismatchException extends IllegalArgumentException {

    private final ValueType expected;
    private final ValueType actual;

    public TypeMismatchException(ValueType expected, ValueType actual) {
        super("Column expects " + expected + " values, got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public ValueType getExpected() {
        return expected;
    }

    public ValueType getActual() {
        return actual;
    }
}
