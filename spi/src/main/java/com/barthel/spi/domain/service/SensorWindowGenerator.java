package com.barthel.spi.domain.service;

import com.barthel.spi.domain.model.DayCountPolicy;
import com.barthel.spi.domain.model.Window;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Builds fixed-length windows from external capture dates. The shift moves start and end
 * together; the window length never changes.
 */
public class SensorWindowGenerator {

    /**
     * @param anchors capture dates, in any order; duplicates are collapsed
     * @param policy  window length and shift
     * @return one window {@code [anchor + shift, anchor + shift + dayCount)} per anchor, ascending
     */
    public List<Window> generate(Collection<LocalDate> anchors, DayCountPolicy policy) {
        return new TreeSet<>(anchors).stream()
                .map(anchor -> anchor.plusDays(policy.shiftDays()))
                .map(start -> new Window(start, start.plusDays(policy.dayCount()), policy))
                .toList();
    }
}
