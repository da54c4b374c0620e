package com.barthel.spi.domain.model;

import java.time.LocalDate;

/**
 * Standardized index of one window plus the provenance of the total it was computed from.
 * Undefined cells hold {@link Grid#UNDEFINED}.
 */
public record SpiResult(
        Window window,
        LocalDate trueStart,
        LocalDate trueEnd,
        int usedCount,
        SeasonalGroupKey groupKey,
        int groupSize,
        boolean lowConfidence,
        Grid indexGrid) {

    public SpiResult {
        if (window == null || indexGrid == null || groupKey == null) {
            throw new IllegalArgumentException("Window, group and index grid are required");
        }
    }

    public int undefinedCellCount() {
        return indexGrid.cellCount() - indexGrid.definedCellCount();
    }
}
