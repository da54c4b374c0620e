package com.barthel.spi.domain.model;

/**
 * Reaction to a seasonal group smaller than the configured minimum.
 */
public enum BaselineStrictness {
    WARN,
    FAIL
}
