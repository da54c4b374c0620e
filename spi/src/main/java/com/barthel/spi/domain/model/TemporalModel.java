package com.barthel.spi.domain.model;

/**
 * How windows are laid over the observation record.
 */
public enum TemporalModel {
    /** Calendar-month windows counted back from the latest observation. */
    CALENDAR_MONTH,
    /** Fixed-length day windows anchored to vegetation sensor capture dates. */
    SENSOR_ALIGNED
}
