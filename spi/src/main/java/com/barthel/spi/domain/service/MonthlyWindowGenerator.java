package com.barthel.spi.domain.service;

import com.barthel.spi.domain.exception.SpiConfigurationException;
import com.barthel.spi.domain.model.MonthCountPolicy;
import com.barthel.spi.domain.model.SpiOrder;
import com.barthel.spi.domain.model.Window;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds calendar-month windows counted back from the latest observation.
 */
public class MonthlyWindowGenerator {

    /**
     * Windows of {@code order} months spaced {@code order} months apart, ascending by end.
     * The newest window ends the day after {@code latest} so that the latest observation is
     * included.
     *
     * @param earliest date of the first observation
     * @param latest   date of the last observation
     * @param order    months per window
     * @return windows covering the record, oldest first
     */
    public List<Window> generate(LocalDate earliest, LocalDate latest, SpiOrder order) {
        if (earliest == null || latest == null || order == null) {
            throw new SpiConfigurationException("Record bounds and SPI order are required");
        }
        if (earliest.isAfter(latest)) {
            throw new SpiConfigurationException("Earliest date " + earliest + " is after latest date " + latest);
        }

        int unitCount = order.unitCount();
        long windowCount = ChronoUnit.MONTHS.between(earliest, latest) / unitCount + 1;
        LocalDate anchor = latest.plusDays(1);
        MonthCountPolicy policy = new MonthCountPolicy(order);

        List<Window> windows = new ArrayList<>((int) windowCount);
        for (long k = windowCount - 1; k >= 0; k--) {
            LocalDate end = anchor.minusMonths(k * unitCount);
            windows.add(new Window(end.minusMonths(unitCount), end, policy));
        }
        return windows;
    }
}
