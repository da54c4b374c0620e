package com.barthel.spi.application.service;

import com.barthel.spi.application.port.in.ComputeSpiUseCase;
import com.barthel.spi.domain.model.*;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Facade routing requests to the service handling the temporal model.
 */
@Service
@RequiredArgsConstructor
@Primary
public class SpiComputationServiceRouter implements ComputeSpiUseCase {

    private final List<ComputeSpiUseCase> implementations;

    @Override
    public SpiSeries computeSpi(TemporalModel model, DateRange range, SpiParameters parameters) {
        return implementations.stream()
                .filter(i -> i.supports(model))
                .findFirst()
                .orElseThrow(() -> new UnsupportedOperationException("No handler for temporal model: " + model))
                .computeSpi(model, range, parameters);
    }

    @Override
    public boolean supports(TemporalModel model) {
        // Never called directly
        return false;
    }
}
