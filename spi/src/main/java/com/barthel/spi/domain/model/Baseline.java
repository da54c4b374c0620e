package com.barthel.spi.domain.model;

/**
 * Historical mean and population standard deviation of one seasonal group.
 *
 * @param groupKey      group the statistics describe
 * @param meanGrid      cell-wise mean of the member sums
 * @param stddevGrid    cell-wise population standard deviation of the member sums
 * @param memberCount   number of aggregates in the group
 * @param lowConfidence true if the group is smaller than the configured minimum
 */
public record Baseline(SeasonalGroupKey groupKey, Grid meanGrid, Grid stddevGrid, int memberCount,
                       boolean lowConfidence) {
    public Baseline {
        if (groupKey == null || meanGrid == null || stddevGrid == null) {
            throw new IllegalArgumentException("Baseline fields are required");
        }
        if (!meanGrid.geometry().sameShape(stddevGrid.geometry())) {
            throw new IllegalArgumentException("Mean and stddev grids differ in shape");
        }
    }
}
