package com.barthel.spi.domain.service;

import com.barthel.spi.domain.model.Aggregate;
import com.barthel.spi.domain.model.Grid;
import com.barthel.spi.domain.model.GridGeometry;
import com.barthel.spi.domain.model.Observation;
import com.barthel.spi.domain.model.ObservationSeries;
import com.barthel.spi.domain.model.Window;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Reduces a window to the precipitation total of its member observations.
 */
@Slf4j
public class WindowAggregator {

    /**
     * Sums the observations with {@code start <= date < end}. Masked cells are skipped; a cell
     * masked in every member stays undefined.
     *
     * @return the aggregate, or empty if the window fails its policy's coverage rule
     */
    public Optional<Aggregate> aggregate(Window window, ObservationSeries observations) {
        List<Observation> members = observations.between(window.start(), window.end());
        if (members.isEmpty()) {
            log.debug("Dropping window [{}, {}): no observations", window.start(), window.end());
            return Optional.empty();
        }

        Observation first = members.get(0);
        Observation last = members.get(members.size() - 1);
        if (!window.policy().isCovered(members.size(), first.date(), last.date())) {
            log.debug("Dropping window [{}, {}): {} observations between {} and {}",
                    window.start(), window.end(), members.size(), first.date(), last.date());
            return Optional.empty();
        }

        Grid sum = sum(members);
        return Optional.of(new Aggregate(window, sum, members.size(), first.date(), last.date()));
    }

    private Grid sum(List<Observation> members) {
        GridGeometry geometry = members.get(0).grid().geometry();
        double[] total = new double[geometry.cellCount()];
        Arrays.fill(total, Grid.UNDEFINED);

        for (Observation member : members) {
            Grid grid = member.grid();
            if (!grid.geometry().sameShape(geometry)) {
                throw new IllegalArgumentException("Observation " + member.date() + " has grid " + grid
                        + ", expected " + geometry.width() + "x" + geometry.height());
            }
            for (int i = 0; i < total.length; i++) {
                double v = grid.cell(i);
                if (Grid.isDefined(v)) {
                    total[i] = Grid.isDefined(total[i]) ? total[i] + v : v;
                }
            }
        }
        return new Grid(geometry, total);
    }
}
