package com.barthel.spi.domain.service;

import com.barthel.spi.domain.model.Aggregate;
import com.barthel.spi.domain.model.SeasonalGroupKey;

import java.util.List;

/**
 * One group for the whole record, used once windows span a year or more.
 */
public class SingleGroup implements SeasonalGrouping {

    @Override
    public SeasonalGroupKey keyFor(Aggregate aggregate) {
        return SeasonalGroupKey.ALL;
    }

    @Override
    public List<Aggregate> membersOf(Aggregate aggregate, List<Aggregate> all) {
        return List.copyOf(all);
    }
}
