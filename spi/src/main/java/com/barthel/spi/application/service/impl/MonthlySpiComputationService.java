package com.barthel.spi.application.service.impl;

import com.barthel.spi.application.port.in.ComputeSpiUseCase;
import com.barthel.spi.application.port.out.*;
import com.barthel.spi.domain.model.*;
import com.barthel.spi.domain.service.MonthlyWindowGenerator;
import com.barthel.spi.domain.service.SpiPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * SPI over calendar-month windows counted back from the latest observation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonthlySpiComputationService implements ComputeSpiUseCase {

    private final FetchObservationsPort fetchObservationsPort;
    private final StoreSpiResultsPort storeSpiResultsPort;
    private final MonthlyWindowGenerator windowGenerator;
    private final SpiPipeline pipeline;

    @Override
    public SpiSeries computeSpi(TemporalModel model, DateRange range, SpiParameters parameters) {
        ObservationSeries observations = ObservationSeries.of(fetchObservationsPort.fetchObservations(range));
        if (observations.isEmpty()) {
            log.info("No observations between {} and {}, nothing to compute", range.from(), range.to());
            return SpiSeries.empty(model, parameters);
        }

        List<Window> windows = windowGenerator.generate(observations.earliest(), observations.latest(), parameters.order());
        log.info("Computing SPI-{} over {} windows from {} observations ({} to {})",
                parameters.order().unitCount(), windows.size(), observations.size(),
                observations.earliest(), observations.latest());

        SpiPipeline.Outcome outcome = parameters.clipExtent()
                .map(extent -> pipeline.run(windows, observations, extent))
                .orElseGet(() -> pipeline.run(windows, observations));

        SpiSeries series = new SpiSeries(model, parameters, outcome.results(),
                outcome.windowCount(), outcome.droppedWindowCount());
        storeSpiResultsPort.store(series);
        return series;
    }

    @Override
    public boolean supports(TemporalModel model) {
        return model == TemporalModel.CALENDAR_MONTH;
    }
}
