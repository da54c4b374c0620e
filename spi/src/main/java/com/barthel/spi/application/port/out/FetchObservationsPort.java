package com.barthel.spi.application.port.out;

import com.barthel.spi.domain.model.DateRange;
import com.barthel.spi.domain.model.Observation;

import java.util.List;

/**
 * Port for reading the daily precipitation record.
 */
public interface FetchObservationsPort {
    /**
     * Retrieve every daily grid observed within the range.
     *
     * @param range inclusive day range
     * @return the observations, in any order
     */
    List<Observation> fetchObservations(DateRange range);
}
