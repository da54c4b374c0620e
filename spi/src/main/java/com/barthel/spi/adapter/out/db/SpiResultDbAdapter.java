package com.barthel.spi.adapter.out.db;

import com.barthel.spi.adapter.out.db.entity.SpiResultEntity;
import com.barthel.spi.adapter.out.db.repository.SpiResultRepository;
import com.barthel.spi.application.port.out.StoreSpiResultsPort;
import com.barthel.spi.domain.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Stores one summary row per SPI result: provenance plus the mean index over defined cells.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpiResultDbAdapter implements StoreSpiResultsPort {

    private final SpiResultRepository repository;

    @Override
    @Transactional
    public void store(SpiSeries series) {
        List<SpiResultEntity> entities = series.results().stream()
                .map(result -> toEntity(series, result))
                .toList();
        repository.saveAll(entities);
        log.info("Stored {} {} SPI results", entities.size(), series.model());
    }

    private SpiResultEntity toEntity(SpiSeries series, SpiResult result) {
        SpiParameters parameters = series.parameters();
        Grid index = result.indexGrid();
        return SpiResultEntity.builder()
                .temporalModel(series.model().name())
                .unitCount(parameters.order().unitCount())
                .dayCount(parameters.dayCount())
                .shiftDays(parameters.shiftDays())
                .windowStart(result.window().start())
                .windowEnd(result.window().end())
                .trueStart(result.trueStart())
                .trueEnd(result.trueEnd())
                .usedCount(result.usedCount())
                .seasonalGroup(result.groupKey().label())
                .groupSize(result.groupSize())
                .lowConfidence(result.lowConfidence())
                .definedCells(index.definedCellCount())
                .undefinedCells(result.undefinedCellCount())
                .meanIndex(meanOfDefined(index))
                .build();
    }

    static Double meanOfDefined(Grid grid) {
        double sum = 0.0;
        int n = 0;
        for (int i = 0; i < grid.cellCount(); i++) {
            double v = grid.cell(i);
            if (Grid.isDefined(v)) {
                sum += v;
                n++;
            }
        }
        return n == 0 ? null : sum / n;
    }
}
