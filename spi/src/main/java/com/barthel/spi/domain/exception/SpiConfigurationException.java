package com.barthel.spi.domain.exception;

/**
 * Raised while setting up a run when a parameter cannot produce a valid window sequence.
 */
public class SpiConfigurationException extends IllegalArgumentException {
    public SpiConfigurationException(String message) {
        super(message);
    }
}
