package com.barthel.spi.application.port.out;

import com.barthel.spi.domain.model.SpiSeries;

/**
 * Port for storing computed SPI series.
 */
public interface StoreSpiResultsPort {
    /**
     * Persist the given series.
     *
     * @param series the series to store
     */
    void store(SpiSeries series);
}
