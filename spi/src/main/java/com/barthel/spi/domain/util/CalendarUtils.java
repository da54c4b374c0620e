package com.barthel.spi.domain.util;

import java.time.LocalDate;
import java.time.Month;
import java.time.MonthDay;
import java.time.temporal.ChronoUnit;

public final class CalendarUtils {

    /** Days of the folded calendar used for seasonal positions. */
    public static final int SEASON_DAYS = 365;

    private static final int REFERENCE_YEAR = 2001;

    private CalendarUtils() {}

    /**
     * Calendar-aware fractional month count between two dates: whole months first, then the
     * remaining days as a fraction of the month that follows.
     */
    public static double fractionalMonthsBetween(LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            return -fractionalMonthsBetween(to, from);
        }
        long whole = ChronoUnit.MONTHS.between(from, to);
        LocalDate pivot = from.plusMonths(whole);
        long remainder = ChronoUnit.DAYS.between(pivot, to);
        if (remainder == 0) {
            return whole;
        }
        long nextMonthDays = ChronoUnit.DAYS.between(pivot, from.plusMonths(whole + 1));
        return whole + (double) remainder / nextMonthDays;
    }

    /**
     * Rounds the fractional month count half-up to whole months.
     */
    public static long roundedMonthsBetween(LocalDate from, LocalDate to) {
        return Math.round(fractionalMonthsBetween(from, to));
    }

    /**
     * Day of year (1..365) on a non-leap calendar; 29 February shares the position of 28 February.
     */
    public static int seasonalDay(LocalDate date) {
        MonthDay monthDay = MonthDay.from(date);
        if (monthDay.getMonth() == Month.FEBRUARY && monthDay.getDayOfMonth() == 29) {
            monthDay = MonthDay.of(Month.FEBRUARY, 28);
        }
        return monthDay.atYear(REFERENCE_YEAR).getDayOfYear();
    }

    /**
     * Shortest distance in days between two seasonal positions, wrapping at the year end.
     */
    public static int seasonalDistance(int dayA, int dayB) {
        int d = Math.abs(dayA - dayB) % SEASON_DAYS;
        return Math.min(d, SEASON_DAYS - d);
    }
}
