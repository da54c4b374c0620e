package com.barthel.spi.config;

import com.barthel.spi.domain.model.BaselineStrictness;
import com.barthel.spi.domain.model.SpatialExtent;
import com.barthel.spi.domain.model.SpiOrder;
import com.barthel.spi.domain.model.SpiParameters;
import com.barthel.spi.domain.service.BaselineStatisticsEngine;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalDate;

/**
 * Settings bound from {@code spi.*}.
 */
@Data
@ConfigurationProperties(prefix = "spi")
public class SpiProperties {

    /** SPI order in months: 1-12, 24 or 48. */
    private int unitCount = 3;

    /** Sensor-aligned window length in days. */
    private int dayCount = 16;

    /** Signed day offset applied to every sensor capture date. */
    private int shiftDays = 0;

    /** Worker threads for aggregation and normalisation. */
    private int parallelism = Runtime.getRuntime().availableProcessors();

    private Extent extent = new Extent();
    private Baseline baseline = new Baseline();
    private Raster raster = new Raster();
    private Runner runner = new Runner();

    @Data
    public static class Extent {
        private Double minX;
        private Double minY;
        private Double maxX;
        private Double maxY;

        boolean hasBounds() {
            return minX != null && minY != null && maxX != null && maxY != null;
        }
    }

    @Data
    public static class Baseline {
        private int minGroupSize = BaselineStatisticsEngine.DEFAULT_MIN_GROUP_SIZE;
        private BaselineStrictness strictness = BaselineStrictness.WARN;
    }

    @Data
    public static class Raster {
        private String baseUrl = "http://localhost:8000/api/raster";
        private String sensor = "MODIS/061/MOD13Q1";
    }

    @Data
    public static class Runner {
        private boolean enabled = false;
        private LocalDate from;
        private LocalDate to;
    }

    /**
     * Validated run parameters; fails fast on an unsupported order, day count or extent.
     */
    public SpiParameters toParameters() {
        SpatialExtent spatialExtent = extent.hasBounds()
                ? new SpatialExtent(extent.getMinX(), extent.getMinY(), extent.getMaxX(), extent.getMaxY())
                : null;
        return new SpiParameters(SpiOrder.of(unitCount), dayCount, shiftDays, spatialExtent);
    }
}
