/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.dataset;

/**
 * Which statistics a {@link ColumnBuilder} collects per page and per column.
 *
 * @param storeRangeStats whether to record minimum and maximum values
 * @param storeCardinalityStats whether to estimate the number of distinct values
 */
public record StatisticsOptions(
        boolean storeRangeStats,
        boolean storeCardinalityStats) {

    public static final StatisticsOptions NONE = new StatisticsOptions(false, false);

    public static final StatisticsOptions ALL = new StatisticsOptions(true, true);

    public boolean isEnabled() {
        return storeRangeStats || storeCardinalityStats;
    }
}
