package com.barthel.spi.domain.service;

import com.barthel.spi.domain.model.Aggregate;
import com.barthel.spi.domain.model.SeasonalGroupKey;
import com.barthel.spi.domain.model.WindowPolicy;

import java.util.List;

/**
 * Decides which aggregates form the historical baseline of a given aggregate.
 */
public interface SeasonalGrouping {

    /**
     * Key of the group the aggregate is normalised against. Aggregates with equal keys share
     * the same members.
     */
    SeasonalGroupKey keyFor(Aggregate aggregate);

    /**
     * Members of the group of {@code aggregate}, in input order.
     */
    List<Aggregate> membersOf(Aggregate aggregate, List<Aggregate> all);

    static SeasonalGrouping forPolicy(WindowPolicy policy) {
        return policy.isSubAnnual()
                ? new SeasonalByDayOfYear(policy.seasonalMatchRadiusDays())
                : new SingleGroup();
    }
}
