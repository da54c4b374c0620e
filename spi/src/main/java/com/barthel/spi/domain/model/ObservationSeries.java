package com.barthel.spi.domain.model;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * Observations ordered by date, at most one per day. The record may have gaps.
 */
public final class ObservationSeries {

    private final NavigableMap<LocalDate, Observation> byDate;

    private ObservationSeries(NavigableMap<LocalDate, Observation> byDate) {
        this.byDate = Collections.unmodifiableNavigableMap(byDate);
    }

    public static ObservationSeries of(Collection<Observation> observations) {
        TreeMap<LocalDate, Observation> byDate = new TreeMap<>();
        for (Observation observation : observations) {
            if (byDate.putIfAbsent(observation.date(), observation) != null) {
                throw new IllegalArgumentException("Duplicate observation for " + observation.date());
            }
        }
        return new ObservationSeries(byDate);
    }

    public boolean isEmpty() {
        return byDate.isEmpty();
    }

    public int size() {
        return byDate.size();
    }

    public LocalDate earliest() {
        return byDate.firstKey();
    }

    public LocalDate latest() {
        return byDate.lastKey();
    }

    /**
     * Observations with {@code start <= date < end}, ascending.
     */
    public List<Observation> between(LocalDate start, LocalDate end) {
        return List.copyOf(byDate.subMap(start, true, end, false).values());
    }

    public List<Observation> asList() {
        return List.copyOf(byDate.values());
    }

    public ObservationSeries map(UnaryOperator<Observation> mapper) {
        TreeMap<LocalDate, Observation> mapped = new TreeMap<>();
        byDate.forEach((date, observation) -> mapped.put(date, mapper.apply(observation)));
        return new ObservationSeries(mapped);
    }
}
