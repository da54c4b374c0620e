package com.barthel.spi.application.service.impl;

import com.barthel.spi.application.port.in.ComputeSpiUseCase;
import com.barthel.spi.application.port.out.*;
import com.barthel.spi.domain.model.*;
import com.barthel.spi.domain.service.SensorWindowGenerator;
import com.barthel.spi.domain.service.SpiPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * SPI over fixed-length windows aligned to vegetation sensor capture dates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SensorAlignedSpiComputationService implements ComputeSpiUseCase {

    private final FetchObservationsPort fetchObservationsPort;
    private final FetchAnchorDatesPort fetchAnchorDatesPort;
    private final StoreSpiResultsPort storeSpiResultsPort;
    private final SensorWindowGenerator windowGenerator;
    private final SpiPipeline pipeline;

    @Override
    public SpiSeries computeSpi(TemporalModel model, DateRange range, SpiParameters parameters) {
        DayCountPolicy policy = parameters.dayPolicy();
        List<LocalDate> anchors = fetchAnchorDatesPort.fetchAnchorDates(range);
        if (anchors.isEmpty()) {
            log.info("No capture dates between {} and {}, nothing to compute", range.from(), range.to());
            return SpiSeries.empty(model, parameters);
        }

        // shifted windows may reach outside the anchor range
        DateRange observed = range.widen(Math.max(0, -policy.shiftDays()),
                Math.max(0, policy.shiftDays()) + policy.dayCount());
        ObservationSeries observations = ObservationSeries.of(fetchObservationsPort.fetchObservations(observed));
        if (observations.isEmpty()) {
            log.info("No observations between {} and {}, nothing to compute", observed.from(), observed.to());
            return SpiSeries.empty(model, parameters);
        }

        List<Window> windows = windowGenerator.generate(anchors, policy);
        log.info("Computing {}-day SPI shifted by {} days over {} capture dates",
                policy.dayCount(), policy.shiftDays(), windows.size());

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
        return model == TemporalModel.SENSOR_ALIGNED;
    }
}
