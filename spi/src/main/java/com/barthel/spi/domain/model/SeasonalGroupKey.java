package com.barthel.spi.domain.model;

/**
 * Identity of a seasonal group, used in logs and errors.
 *
 * @param label human-readable description of the calendar position
 */
public record SeasonalGroupKey(String label) {

    public static final SeasonalGroupKey ALL = new SeasonalGroupKey("all");

    public SeasonalGroupKey {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Group label must not be blank");
        }
    }

    public static SeasonalGroupKey ofSeasonalDay(int seasonalDay, int radiusDays) {
        return new SeasonalGroupKey(String.format("doy %03d±%d", seasonalDay, radiusDays));
    }
}
