package com.barthel.spi.application.service.impl;

import com.barthel.spi.application.port.out.FetchAnchorDatesPort;
import com.barthel.spi.application.port.out.FetchObservationsPort;
import com.barthel.spi.application.port.out.StoreSpiResultsPort;
import com.barthel.spi.domain.model.*;
import com.barthel.spi.domain.service.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.barthel.spi.SpiFixtures.uniformDaily;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SensorAlignedSpiComputationServiceTest {

    @Mock
    private FetchObservationsPort fetchObservationsPort;

    @Mock
    private FetchAnchorDatesPort fetchAnchorDatesPort;

    @Mock
    private StoreSpiResultsPort storeSpiResultsPort;

    private ExecutorService executor;
    private SensorAlignedSpiComputationService service;

    private final DateRange range = new DateRange(LocalDate.of(2020, 1, 1), LocalDate.of(2022, 12, 31));

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        SpiPipeline pipeline = new SpiPipeline(executor, new WindowAggregator(),
                new BaselineStatisticsEngine(), new SpiNormalizer());
        service = new SensorAlignedSpiComputationService(fetchObservationsPort, fetchAnchorDatesPort,
                storeSpiResultsPort, new SensorWindowGenerator(), pipeline);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void fetchesRecordWidenedByShiftAndLength() {
        List<LocalDate> anchors = new ArrayList<>();
        for (int year = 2020; year <= 2022; year++) {
            anchors.add(LocalDate.ofYearDay(year, 97));
        }
        DateRange widened = new DateRange(LocalDate.of(2019, 12, 27), LocalDate.of(2023, 1, 16));
        when(fetchAnchorDatesPort.fetchAnchorDates(range)).thenReturn(anchors);
        when(fetchObservationsPort.fetchObservations(widened))
                .thenReturn(uniformDaily(widened.from(), widened.to(), GridGeometry.ofSize(1, 1), 1.0));

        SpiSeries series = service.computeSpi(TemporalModel.SENSOR_ALIGNED, range,
                new SpiParameters(SpiOrder.of(1), 16, -5, null));

        assertThat(series.results()).hasSize(3);
        assertThat(series.results()).allSatisfy(r -> {
            assertThat(r.window().start()).isEqualTo(LocalDate.ofYearDay(r.window().start().getYear(), 92));
            assertThat(r.usedCount()).isEqualTo(16);
            assertThat(r.groupSize()).isEqualTo(3);
            // uniform rain has no variance
            assertThat(r.undefinedCellCount()).isEqualTo(1);
        });
        verify(fetchObservationsPort).fetchObservations(widened);
        verify(storeSpiResultsPort).store(series);
    }

    @Test
    void incompleteWindowsAreDroppedAndCounted() {
        List<LocalDate> anchors = List.of(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 1, 17), LocalDate.of(2020, 2, 2));
        List<Observation> record = new ArrayList<>(
                uniformDaily(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 2, 17), GridGeometry.ofSize(1, 1), 1.0));
        record.removeIf(o -> o.date().equals(LocalDate.of(2020, 1, 20)));
        when(fetchAnchorDatesPort.fetchAnchorDates(range)).thenReturn(anchors);
        when(fetchObservationsPort.fetchObservations(any())).thenReturn(record);

        SpiSeries series = service.computeSpi(TemporalModel.SENSOR_ALIGNED, range,
                new SpiParameters(SpiOrder.of(1), 16, 0, null));

        assertThat(series.windowCount()).isEqualTo(3);
        assertThat(series.droppedWindowCount()).isEqualTo(1);
        assertThat(series.results()).extracting(r -> r.window().start())
                .containsExactly(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 2, 2));
    }

    @Test
    void noCaptureDatesSkipsObservationFetch() {
        when(fetchAnchorDatesPort.fetchAnchorDates(range)).thenReturn(List.of());

        SpiSeries series = service.computeSpi(TemporalModel.SENSOR_ALIGNED, range,
                new SpiParameters(SpiOrder.of(1), 16, 0, null));

        assertThat(series.isEmpty()).isTrue();
        verifyNoInteractions(fetchObservationsPort, storeSpiResultsPort);
    }
}
