package com.barthel.spi.domain.model;

import com.barthel.spi.domain.util.CalendarUtils;

import java.time.LocalDate;

/**
 * Calendar-month windows. A window is kept when the span between its first and last
 * observation, rounded to whole months, reaches the order.
 *
 * @param order months per window
 */
public record MonthCountPolicy(SpiOrder order) implements WindowPolicy {

    /** Half the shortest month; window ends of neighbouring months are always further apart. */
    public static final int MATCH_RADIUS_DAYS = 14;

    public MonthCountPolicy {
        if (order == null) {
            throw new IllegalArgumentException("SPI order is required");
        }
    }

    public int unitCount() {
        return order.unitCount();
    }

    @Override
    public boolean isCovered(int usedCount, LocalDate trueStart, LocalDate trueEnd) {
        return CalendarUtils.roundedMonthsBetween(trueStart, trueEnd) >= order.unitCount();
    }

    @Override
    public boolean isSubAnnual() {
        return !order.isAnnualOrLonger();
    }

    @Override
    public int seasonalMatchRadiusDays() {
        return MATCH_RADIUS_DAYS;
    }
}
