package com.barthel.spi.application.port.out;

import com.barthel.spi.domain.model.DateRange;

import java.time.LocalDate;
import java.util.List;

/**
 * Port for obtaining the capture dates of the vegetation sensor.
 */
public interface FetchAnchorDatesPort {
    /**
     * Fetch the capture dates within the range.
     *
     * @param range inclusive day range
     * @return the capture dates
     */
    List<LocalDate> fetchAnchorDates(DateRange range);
}
