package com.barthel.spi.domain.model;

import java.time.LocalDate;

/**
 * Length, coverage rule and seasonal grouping behaviour shared by all windows of one run.
 */
public interface WindowPolicy {

    /**
     * Whether the observations found inside a window are enough to keep it.
     *
     * @param usedCount number of member observations, at least one
     * @param trueStart date of the first member observation
     * @param trueEnd   date of the last member observation
     * @return true if the window yields an aggregate
     */
    boolean isCovered(int usedCount, LocalDate trueStart, LocalDate trueEnd);

    /**
     * Whether windows are shorter than a year and need grouping by time of year.
     */
    boolean isSubAnnual();

    /**
     * Half-width in days of the day-of-year range around a window end that counts as
     * the same time of year.
     */
    int seasonalMatchRadiusDays();
}
