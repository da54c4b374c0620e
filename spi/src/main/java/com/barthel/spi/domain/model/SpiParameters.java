package com.barthel.spi.domain.model;

import com.barthel.spi.domain.exception.SpiConfigurationException;

import java.util.Optional;

/**
 * Run parameters for both temporal models.
 *
 * @param order     months per calendar-month window
 * @param dayCount  sensor-aligned window length in days
 * @param shiftDays signed offset applied to sensor anchors
 * @param extent    clipping extent, or null to keep full grids
 */
public record SpiParameters(SpiOrder order, int dayCount, int shiftDays, SpatialExtent extent) {
    public SpiParameters {
        if (order == null) {
            throw new SpiConfigurationException("SPI order is required");
        }
        if (dayCount <= 0) {
            throw new SpiConfigurationException("Day count must be positive, got " + dayCount);
        }
    }

    public MonthCountPolicy monthPolicy() {
        return new MonthCountPolicy(order);
    }

    public DayCountPolicy dayPolicy() {
        return new DayCountPolicy(dayCount, shiftDays);
    }

    public Optional<SpatialExtent> clipExtent() {
        return Optional.ofNullable(extent);
    }
}
