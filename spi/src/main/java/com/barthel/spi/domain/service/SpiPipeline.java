package com.barthel.spi.domain.service;

import com.barthel.spi.domain.model.Aggregate;
import com.barthel.spi.domain.model.Baseline;
import com.barthel.spi.domain.model.ObservationSeries;
import com.barthel.spi.domain.model.SpatialExtent;
import com.barthel.spi.domain.model.SpiResult;
import com.barthel.spi.domain.model.Window;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs windows through aggregation, baseline statistics and normalisation.
 * <p>
 * Aggregation and normalisation run one task per window on the executor; baseline statistics
 * wait until every aggregate exists. Results keep window order, so repeated runs are identical.
 */
@Slf4j
@RequiredArgsConstructor
public class SpiPipeline {

    private final ExecutorService executor;
    private final WindowAggregator aggregator;
    private final BaselineStatisticsEngine baselineEngine;
    private final SpiNormalizer normalizer;

    /**
     * Outcome of one run.
     *
     * @param results            results ascending by window end
     * @param windowCount        windows submitted
     * @param droppedWindowCount windows without enough observations
     */
    public record Outcome(List<SpiResult> results, int windowCount, int droppedWindowCount) {}

    public Outcome run(List<Window> windows, ObservationSeries observations) {
        if (windows.isEmpty()) {
            return new Outcome(List.of(), 0, 0);
        }

        List<Callable<Optional<Aggregate>>> aggregation = new ArrayList<>(windows.size());
        for (Window window : windows) {
            aggregation.add(() -> aggregator.aggregate(window, observations));
        }
        List<Aggregate> aggregates = invokeAll(aggregation).stream()
                .flatMap(Optional::stream)
                .toList();
        int dropped = windows.size() - aggregates.size();
        log.debug("Aggregated {} of {} windows", aggregates.size(), windows.size());

        if (aggregates.isEmpty()) {
            return new Outcome(List.of(), windows.size(), dropped);
        }

        SeasonalGrouping grouping = SeasonalGrouping.forPolicy(windows.get(0).policy());
        List<Baseline> baselines = baselineEngine.compute(aggregates, grouping);

        List<Callable<SpiResult>> normalization = new ArrayList<>(aggregates.size());
        for (int i = 0; i < aggregates.size(); i++) {
            Aggregate aggregate = aggregates.get(i);
            Baseline baseline = baselines.get(i);
            normalization.add(() -> normalizer.normalize(aggregate, baseline));
        }
        return new Outcome(invokeAll(normalization), windows.size(), dropped);
    }

    /**
     * Clips every observation to {@code extent} before running.
     */
    public Outcome run(List<Window> windows, ObservationSeries observations, SpatialExtent extent) {
        return run(windows, observations.map(observation -> observation.clip(extent)));
    }

    private <T> List<T> invokeAll(List<Callable<T>> tasks) {
        try {
            List<T> results = new ArrayList<>(tasks.size());
            for (Future<T> future : executor.invokeAll(tasks)) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("SPI run interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("SPI task failed", e.getCause());
        }
    }
}
