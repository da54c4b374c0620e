package com.barthel.spi.application.port.in;

import com.barthel.spi.domain.model.*;

/**
 * Use case for computing the SPI series of one temporal model over a date range.
 */
public interface ComputeSpiUseCase {
    /**
     * Computes SPI results for every sufficiently covered window in the range.
     *
     * @param model the temporal model to lay windows with
     * @param range the days of precipitation record to use
     * @param parameters window and clipping parameters
     * @return the resulting {@link SpiSeries}
     */
    SpiSeries computeSpi(TemporalModel model, DateRange range, SpiParameters parameters);

    /**
     * Whether this implementation supports the given temporal model.
     *
     * @param model the model to check
     * @return true if supported
     */
    boolean supports(TemporalModel model);
}
