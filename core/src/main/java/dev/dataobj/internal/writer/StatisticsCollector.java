/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.writer;

import dev.dataobj.dataset.StatisticsOptions;
import dev.dataobj.dataset.Value;
import dev.dataobj.metadata.Statistics;
import dev.dataobj.sketch.HyperLogLog;

/**
 * Accumulates range and cardinality statistics over the present values of a page, or over the
 * pages of a column by merging page collectors.
 * <p>
 * Only present values may be observed; nil and empty rows never reach a collector.
 * </p>
 */
public final class StatisticsCollector {

    private final StatisticsOptions options;
    private final HyperLogLog sketch;
    private Value min;
    private Value max;

    public StatisticsCollector(StatisticsOptions options) {
        this.options = options;
        this.sketch = options.storeCardinalityStats() ? HyperLogLog.create() : null;
    }

    public void observe(Value value) {
        if (!options.isEnabled()) {
            return;
        }
        if (options.storeRangeStats()) {
            updateRange(value, value);
        }
        if (sketch != null) {
            sketch.insert(value.toByteArray());
        }
    }

    /**
     * Folds another collector, typically the one of a finished page, into this one.
     */
    public void merge(StatisticsCollector other) {
        if (options.storeRangeStats() && other.min != null) {
            updateRange(other.min, other.max);
        }
        if (sketch != null && other.sketch != null) {
            sketch.merge(other.sketch);
        }
    }

    private void updateRange(Value low, Value high) {
        if (min == null || Value.compare(low, min) < 0) {
            min = low;
        }
        if (max == null || Value.compare(high, max) > 0) {
            max = high;
        }
    }

    /**
     * Returns the collected statistics, or null if no statistics are enabled.
     */
    public Statistics toStatistics() {
        if (!options.isEnabled()) {
            return null;
        }
        byte[] minValue = null;
        byte[] maxValue = null;
        if (options.storeRangeStats() && min != null) {
            minValue = min.toByteArray();
            maxValue = max.toByteArray();
        }
        Long cardinality = sketch != null ? sketch.estimate() : null;
        return new Statistics(minValue, maxValue, cardinality);
    }
}
