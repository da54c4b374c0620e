package com.barthel.spi.domain.model;

import com.barthel.spi.domain.exception.SpiConfigurationException;

import java.time.LocalDate;

/**
 * Inclusive range of calendar days.
 */
public record DateRange(LocalDate from, LocalDate to) {
    public DateRange {
        if (from == null || to == null) {
            throw new SpiConfigurationException("Date range bounds are required");
        }
        if (from.isAfter(to)) {
            throw new SpiConfigurationException("Date range start " + from + " is after its end " + to);
        }
    }

    public DateRange widen(int daysBefore, int daysAfter) {
        return new DateRange(from.minusDays(daysBefore), to.plusDays(daysAfter));
    }
}
