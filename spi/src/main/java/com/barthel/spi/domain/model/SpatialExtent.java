package com.barthel.spi.domain.model;

import com.barthel.spi.domain.exception.SpiConfigurationException;

/**
 * Clipping rectangle in the coordinate system of the observation grids.
 */
public record SpatialExtent(double minX, double minY, double maxX, double maxY) {
    public SpatialExtent {
        if (!(minX < maxX) || !(minY < maxY)) {
            throw new SpiConfigurationException("Spatial extent must have min < max on both axes");
        }
    }
}
