package com.barthel.spi.domain.model;

import java.time.LocalDate;

/**
 * One daily precipitation grid of the source record.
 *
 * @param date UTC calendar day the grid was observed
 * @param grid precipitation values
 */
public record Observation(LocalDate date, Grid grid) {
    public Observation {
        if (date == null || grid == null) {
            throw new IllegalArgumentException("Observation date and grid are required");
        }
    }

    public Observation clip(SpatialExtent extent) {
        Grid clipped = grid.clip(extent);
        return clipped == grid ? this : new Observation(date, clipped);
    }
}
