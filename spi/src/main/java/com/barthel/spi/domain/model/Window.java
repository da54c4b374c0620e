package com.barthel.spi.domain.model;

import com.barthel.spi.domain.exception.SpiConfigurationException;

import java.time.LocalDate;

/**
 * Half-open interval {@code [start, end)} over which precipitation is summed.
 */
public record Window(LocalDate start, LocalDate end, WindowPolicy policy) {
    public Window {
        if (start == null || end == null || policy == null) {
            throw new IllegalArgumentException("Window bounds and policy are required");
        }
        if (!start.isBefore(end)) {
            throw new SpiConfigurationException("Window start " + start + " must be before its end " + end);
        }
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && date.isBefore(end);
    }
}
