package com.barthel.spi.domain.model;

import java.util.List;

/**
 * Ordered SPI results of one temporal model.
 *
 * @param model              temporal model the windows were built with
 * @param parameters         parameters of the run
 * @param results            results ascending by window end
 * @param windowCount        windows generated before coverage filtering
 * @param droppedWindowCount windows dropped for insufficient coverage
 */
public record SpiSeries(TemporalModel model, SpiParameters parameters, List<SpiResult> results,
                        int windowCount, int droppedWindowCount) {
    public SpiSeries {
        results = List.copyOf(results);
    }

    public static SpiSeries empty(TemporalModel model, SpiParameters parameters) {
        return new SpiSeries(model, parameters, List.of(), 0, 0);
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
