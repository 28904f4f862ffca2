/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.sketch;

/**
 * Thrown when merging two sketches of different precision.
 */
public class PrecisionMismatchException extends IllegalArgumentException {

    public PrecisionMismatchException(int precision, int otherPrecision) {
        super("Cannot merge sketch of precision " + otherPrecision + " into sketch of precision " + precision);
    }
}
