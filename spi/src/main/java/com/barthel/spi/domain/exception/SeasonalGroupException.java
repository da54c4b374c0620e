package com.barthel.spi.domain.exception;

import com.barthel.spi.domain.model.SeasonalGroupKey;

/**
 * Raised when a seasonal group cannot support a baseline.
 */
public class SeasonalGroupException extends IllegalStateException {

    private final SeasonalGroupKey groupKey;

    public SeasonalGroupException(SeasonalGroupKey groupKey, String message) {
        super(message + " [group " + groupKey.label() + "]");
        this.groupKey = groupKey;
    }

    public SeasonalGroupKey getGroupKey() {
        return groupKey;
    }
}
