package com.barthel.spi.domain.model;

import com.barthel.spi.domain.exception.SpiConfigurationException;

/**
 * Aggregation length of a calendar-month SPI, in months.
 * <p>
 * Orders 1 to 12 are grouped by time of year; 24 and 48 are the validated annual multiples.
 *
 * @param unitCount number of months per window
 */
public record SpiOrder(int unitCount) {

    public static final int MONTHS_PER_YEAR = 12;

    public SpiOrder {
        boolean subAnnualOrYear = unitCount >= 1 && unitCount <= MONTHS_PER_YEAR;
        if (!subAnnualOrYear && unitCount != 24 && unitCount != 48) {
            throw new SpiConfigurationException(
                    "Unsupported SPI order " + unitCount + ": expected 1-12, 24 or 48 months");
        }
    }

    public static SpiOrder of(int unitCount) {
        return new SpiOrder(unitCount);
    }

    public boolean isAnnualOrLonger() {
        return unitCount >= MONTHS_PER_YEAR;
    }
}
