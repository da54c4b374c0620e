package com.barthel.spi.domain.service;

import com.barthel.spi.domain.exception.SeasonalGroupException;
import com.barthel.spi.domain.model.Aggregate;
import com.barthel.spi.domain.model.Baseline;
import com.barthel.spi.domain.model.BaselineStrictness;
import com.barthel.spi.domain.model.Grid;
import com.barthel.spi.domain.model.GridGeometry;
import com.barthel.spi.domain.model.SeasonalGroupKey;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes per-group mean and population standard deviation of window totals.
 */
@Slf4j
public class BaselineStatisticsEngine {

    public static final int DEFAULT_MIN_GROUP_SIZE = 3;

    private final int minGroupSize;
    private final BaselineStrictness strictness;

    public BaselineStatisticsEngine() {
        this(DEFAULT_MIN_GROUP_SIZE, BaselineStrictness.WARN);
    }

    public BaselineStatisticsEngine(int minGroupSize, BaselineStrictness strictness) {
        if (minGroupSize < 1) {
            throw new IllegalArgumentException("Minimum group size must be at least 1");
        }
        this.minGroupSize = minGroupSize;
        this.strictness = strictness;
    }

    /**
     * Baseline of each aggregate's own seasonal group.
     *
     * @param aggregates every aggregate of one temporal model
     * @param grouping   grouping strategy of that model
     * @return baselines in the order of {@code aggregates}; aggregates of the same group share
     *         one instance
     * @throws SeasonalGroupException if a group is empty, or undersized under
     *                                {@link BaselineStrictness#FAIL}
     */
    public List<Baseline> compute(List<Aggregate> aggregates, SeasonalGrouping grouping) {
        Map<SeasonalGroupKey, Baseline> byKey = new HashMap<>();
        List<Baseline> baselines = new ArrayList<>(aggregates.size());
        for (Aggregate aggregate : aggregates) {
            SeasonalGroupKey key = grouping.keyFor(aggregate);
            Baseline baseline = byKey.get(key);
            if (baseline == null) {
                baseline = computeGroup(key, grouping.membersOf(aggregate, aggregates));
                byKey.put(key, baseline);
            }
            baselines.add(baseline);
        }
        log.debug("Computed {} baselines for {} aggregates", byKey.size(), aggregates.size());
        return baselines;
    }

    Baseline computeGroup(SeasonalGroupKey key, List<Aggregate> members) {
        if (members.isEmpty()) {
            throw new SeasonalGroupException(key, "Seasonal group has no members");
        }

        boolean lowConfidence = members.size() < minGroupSize;
        if (lowConfidence) {
            if (strictness == BaselineStrictness.FAIL) {
                throw new SeasonalGroupException(key, "Seasonal group has " + members.size()
                        + " members, at least " + minGroupSize + " required");
            }
            log.warn("Low-confidence baseline for group {}: {} members, {} recommended",
                    key.label(), members.size(), minGroupSize);
        }

        GridGeometry geometry = members.get(0).sumGrid().geometry();
        int cells = geometry.cellCount();
        double[] mean = new double[cells];
        double[] stddev = new double[cells];
        for (Aggregate member : members) {
            if (!member.sumGrid().geometry().sameShape(geometry)) {
                throw new IllegalArgumentException("Aggregate ending " + member.window().end()
                        + " differs in grid shape from its seasonal group " + key.label());
            }
        }

        for (int i = 0; i < cells; i++) {
            double sum = 0.0;
            int n = 0;
            double first = Grid.UNDEFINED;
            boolean constant = true;
            for (Aggregate member : members) {
                double v = member.sumGrid().cell(i);
                if (Grid.isDefined(v)) {
                    if (n == 0) {
                        first = v;
                    } else if (v != first) {
                        constant = false;
                    }
                    sum += v;
                    n++;
                }
            }
            if (n == 0) {
                mean[i] = Grid.UNDEFINED;
                stddev[i] = Grid.UNDEFINED;
                continue;
            }
            if (constant) {
                // exact zero so the index is undefined, not rounding noise
                mean[i] = first;
                stddev[i] = 0.0;
                continue;
            }
            double m = sum / n;
            double squares = 0.0;
            for (Aggregate member : members) {
                double v = member.sumGrid().cell(i);
                if (Grid.isDefined(v)) {
                    double d = v - m;
                    squares += d * d;
                }
            }
            mean[i] = m;
            // population variance
            stddev[i] = Math.sqrt(squares / n);
        }

        return new Baseline(key, new Grid(geometry, mean), new Grid(geometry, stddev), members.size(), lowConfidence);
    }
}
