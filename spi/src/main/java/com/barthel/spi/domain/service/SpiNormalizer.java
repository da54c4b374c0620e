package com.barthel.spi.domain.service;

import com.barthel.spi.domain.model.Aggregate;
import com.barthel.spi.domain.model.Baseline;
import com.barthel.spi.domain.model.Grid;
import com.barthel.spi.domain.model.SpiResult;

/**
 * Turns a window total into a z-score against its seasonal baseline.
 * <p>
 * No distribution is fitted before standardising, so the index is closest to a true SPI for
 * short windows whose totals are roughly normal.
 */
public class SpiNormalizer {

    public SpiResult normalize(Aggregate aggregate, Baseline baseline) {
        Grid sum = aggregate.sumGrid();
        if (!sum.geometry().sameShape(baseline.meanGrid().geometry())) {
            throw new IllegalArgumentException("Aggregate ending " + aggregate.window().end()
                    + " does not match the shape of baseline " + baseline.groupKey().label());
        }

        double[] index = new double[sum.cellCount()];
        for (int i = 0; i < index.length; i++) {
            index[i] = zScore(sum.cell(i), baseline.meanGrid().cell(i), baseline.stddevGrid().cell(i));
        }

        return new SpiResult(
                aggregate.window(),
                aggregate.trueStart(),
                aggregate.trueEnd(),
                aggregate.usedCount(),
                baseline.groupKey(),
                baseline.memberCount(),
                baseline.lowConfidence(),
                new Grid(sum.geometry(), index));
    }

    static double zScore(double value, double mean, double stddev) {
        if (!Grid.isDefined(value) || !Grid.isDefined(mean) || !Grid.isDefined(stddev) || stddev == 0.0) {
            return Grid.UNDEFINED;
        }
        return (value - mean) / stddev;
    }
}
