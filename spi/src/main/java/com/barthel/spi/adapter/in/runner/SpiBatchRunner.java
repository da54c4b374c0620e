package com.barthel.spi.adapter.in.runner;

import com.barthel.spi.application.port.in.ComputeSpiUseCase;
import com.barthel.spi.config.SpiProperties;
import com.barthel.spi.domain.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Computes both temporal models for the configured range at start-up.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "spi.runner.enabled", havingValue = "true")
public class SpiBatchRunner implements ApplicationRunner {

    private final ComputeSpiUseCase computeSpiUseCase;
    private final SpiProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        SpiProperties.Runner runner = properties.getRunner();
        DateRange range = new DateRange(runner.getFrom(), runner.getTo());
        SpiParameters parameters = properties.toParameters();

        for (TemporalModel model : TemporalModel.values()) {
            SpiSeries series = computeSpiUseCase.computeSpi(model, range, parameters);
            long lowConfidence = series.results().stream().filter(SpiResult::lowConfidence).count();
            log.info("{}: {} results from {} windows ({} dropped, {} low-confidence)",
                    model, series.results().size(), series.windowCount(),
                    series.droppedWindowCount(), lowConfidence);
        }
    }
}
