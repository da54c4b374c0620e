package com.barthel.spi.domain.service;

import com.barthel.spi.domain.model.Aggregate;
import com.barthel.spi.domain.model.SeasonalGroupKey;
import com.barthel.spi.domain.util.CalendarUtils;

import java.util.List;

/**
 * Groups aggregates whose nominal window ends fall at the same time of year, so that a March
 * total is compared with every historical March total. Observation dates are never consulted.
 */
public class SeasonalByDayOfYear implements SeasonalGrouping {

    private final int radiusDays;

    public SeasonalByDayOfYear(int radiusDays) {
        if (radiusDays < 0) {
            throw new IllegalArgumentException("Match radius must not be negative");
        }
        this.radiusDays = radiusDays;
    }

    @Override
    public SeasonalGroupKey keyFor(Aggregate aggregate) {
        return SeasonalGroupKey.ofSeasonalDay(seasonalEnd(aggregate), radiusDays);
    }

    @Override
    public List<Aggregate> membersOf(Aggregate aggregate, List<Aggregate> all) {
        int position = seasonalEnd(aggregate);
        return all.stream()
                .filter(other -> CalendarUtils.seasonalDistance(position, seasonalEnd(other)) <= radiusDays)
                .toList();
    }

    private static int seasonalEnd(Aggregate aggregate) {
        return CalendarUtils.seasonalDay(aggregate.window().end());
    }
}
