/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.metadata;

import java.util.Arrays;
import java.util.Objects;

/**
 * Statistics over the values of a page or a column.
 * <p>
 * {@code minValue} and {@code maxValue} hold binary-encoded values and must be decoded with
 * {@code Value.fromByteArray}; both are null when range statistics were not collected or no
 * non-empty value was seen. {@code cardinalityCount} is null when cardinality statistics were
 * not collected. The arrays are copied on construction and on access.
 * </p>
 */
public record Statistics(
        byte[] minValue,
        byte[] maxValue,
        Long cardinalityCount) {

    public Statistics {
        minValue = minValue != null ? minValue.clone() : null;
        maxValue = maxValue != null ? maxValue.clone() : null;
    }

    @Override
    public byte[] minValue() {
        return minValue != null ? minValue.clone() : null;
    }

    @Override
    public byte[] maxValue() {
        return maxValue != null ? maxValue.clone() : null;
    }

    public boolean hasRange() {
        return minValue != null && maxValue != null;
    }

    public boolean hasCardinality() {
        return cardinalityCount != null;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Statistics other
                && Arrays.equals(minValue, other.minValue)
                && Arrays.equals(maxValue, other.maxValue)
                && Objects.equals(cardinalityCount, other.cardinalityCount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(minValue), Arrays.hashCode(maxValue), cardinalityCount);
    }

    @Override
    public String toString() {
        return "Statistics[minValue=" + Arrays.toString(minValue) + ", maxValue=" + Arrays.toString(maxValue)
                + ", cardinalityCount=" + cardinalityCount + "]";
    }
}
