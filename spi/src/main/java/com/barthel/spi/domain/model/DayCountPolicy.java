package com.barthel.spi.domain.model;

import com.barthel.spi.domain.exception.SpiConfigurationException;

import java.time.LocalDate;

/**
 * Fixed-length day windows shifted from their anchor dates. The record is daily, so a window
 * is kept only when every day is present.
 *
 * @param dayCount  window length in days
 * @param shiftDays signed offset applied to each anchor
 */
public record DayCountPolicy(int dayCount, int shiftDays) implements WindowPolicy {

    public static final int DEFAULT_DAY_COUNT = 16;

    public DayCountPolicy {
        if (dayCount <= 0) {
            throw new SpiConfigurationException("Day count must be positive, got " + dayCount);
        }
    }

    @Override
    public boolean isCovered(int usedCount, LocalDate trueStart, LocalDate trueEnd) {
        return usedCount >= dayCount;
    }

    @Override
    public boolean isSubAnnual() {
        return true;
    }

    @Override
    public int seasonalMatchRadiusDays() {
        return (dayCount - 1) / 2;
    }
}
