package com.barthel.spi.domain.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Precipitation total of one sufficiently covered window.
 *
 * @param window    nominal window the total was taken over
 * @param sumGrid   cell-wise sum of the member grids
 * @param usedCount number of member observations
 * @param trueStart date of the first member observation
 * @param trueEnd   date of the last member observation
 */
public record Aggregate(Window window, Grid sumGrid, int usedCount, LocalDate trueStart, LocalDate trueEnd) {
    public Aggregate {
        if (window == null || sumGrid == null || trueStart == null || trueEnd == null) {
            throw new IllegalArgumentException("Aggregate fields are required");
        }
        if (usedCount <= 0) {
            throw new IllegalArgumentException("Aggregate needs at least one observation");
        }
        if (trueEnd.isBefore(trueStart)) {
            throw new IllegalArgumentException("Aggregate true end precedes true start");
        }
    }

    /**
     * Days between the first and last contributing observation.
     */
    public long observedSpanDays() {
        return ChronoUnit.DAYS.between(trueStart, trueEnd);
    }
}
