package com.barthel.spi.domain.service;

import com.barthel.spi.domain.model.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.barthel.spi.SpiFixtures.randomDaily;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SpiPipelineTest {

    private static final GridGeometry GEOMETRY = new GridGeometry(0.0, 2.0, 1.0, 2, 2);
    private static final LocalDate FIRST = LocalDate.of(2000, 1, 1);
    private static final LocalDate LAST = LocalDate.of(2009, 12, 31);

    private ExecutorService executor;
    private SpiPipeline pipeline;
    private final MonthlyWindowGenerator monthlyGenerator = new MonthlyWindowGenerator();
    private final SensorWindowGenerator sensorGenerator = new SensorWindowGenerator();

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        pipeline = new SpiPipeline(executor, new WindowAggregator(), new BaselineStatisticsEngine(), new SpiNormalizer());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void repeatedRunsAreIdentical() {
        ObservationSeries record = ObservationSeries.of(randomDaily(FIRST, LAST, GEOMETRY, 42L));
        List<Window> windows = monthlyGenerator.generate(record.earliest(), record.latest(), SpiOrder.of(3));

        SpiPipeline.Outcome first = pipeline.run(windows, record);
        SpiPipeline.Outcome second = pipeline.run(windows, record);

        assertThat(first.results()).isNotEmpty();
        assertThat(second.results()).isEqualTo(first.results());
    }

    @Test
    void scalingPrecipitationLeavesIndexUnchanged() {
        List<Observation> raw = randomDaily(FIRST, LAST, GEOMETRY, 7L);
        List<Observation> scaled = raw.stream()
                .map(o -> new Observation(o.date(), o.grid().scale(2.5)))
                .toList();
        ObservationSeries rawRecord = ObservationSeries.of(raw);
        ObservationSeries scaledRecord = ObservationSeries.of(scaled);
        List<Window> windows = monthlyGenerator.generate(FIRST, LAST, SpiOrder.of(1));

        WindowAggregator aggregator = new WindowAggregator();
        Aggregate rawSum = aggregator.aggregate(windows.get(5), rawRecord).orElseThrow();
        Aggregate scaledSum = aggregator.aggregate(windows.get(5), scaledRecord).orElseThrow();
        for (int i = 0; i < GEOMETRY.cellCount(); i++) {
            assertThat(scaledSum.sumGrid().cell(i)).isCloseTo(2.5 * rawSum.sumGrid().cell(i), within(1e-9));
        }

        List<SpiResult> rawResults = pipeline.run(windows, rawRecord).results();
        List<SpiResult> scaledResults = pipeline.run(windows, scaledRecord).results();

        assertThat(scaledResults).hasSameSizeAs(rawResults);
        for (int r = 0; r < rawResults.size(); r++) {
            Grid expected = rawResults.get(r).indexGrid();
            Grid actual = scaledResults.get(r).indexGrid();
            for (int i = 0; i < expected.cellCount(); i++) {
                if (Double.isNaN(expected.cell(i))) {
                    assertThat(actual.cell(i)).isNaN();
                } else {
                    assertThat(actual.cell(i)).isCloseTo(expected.cell(i), within(1e-9));
                }
            }
        }
    }

    @Test
    void droppedWindowsNeverReachResultsOrGroups() {
        List<Observation> raw = new ArrayList<>(randomDaily(FIRST, LAST, GEOMETRY, 3L));
        raw.removeIf(o -> o.date().getYear() == 2005 && o.date().getMonthValue() == 3);
        ObservationSeries record = ObservationSeries.of(raw);
        List<Window> windows = monthlyGenerator.generate(record.earliest(), record.latest(), SpiOrder.of(1));
        Window missingMarch = new Window(LocalDate.of(2005, 3, 1), LocalDate.of(2005, 4, 1),
                new MonthCountPolicy(SpiOrder.of(1)));

        SpiPipeline.Outcome outcome = pipeline.run(windows, record);

        assertThat(outcome.windowCount()).isEqualTo(120);
        assertThat(outcome.droppedWindowCount()).isEqualTo(1);
        assertThat(outcome.results()).hasSize(119);
        assertThat(outcome.results()).extracting(SpiResult::window).doesNotContain(missingMarch);
        assertThat(outcome.results()).allSatisfy(r -> assertThat(r.groupSize())
                .isEqualTo(r.window().start().getMonthValue() == 3 ? 9 : 10));
    }

    @Test
    void resultsAscendByWindowEnd() {
        ObservationSeries record = ObservationSeries.of(randomDaily(FIRST, LAST, GEOMETRY, 11L));
        List<Window> windows = monthlyGenerator.generate(record.earliest(), record.latest(), SpiOrder.of(6));

        List<SpiResult> results = pipeline.run(windows, record).results();

        for (int i = 1; i < results.size(); i++) {
            assertThat(results.get(i).window().end()).isAfter(results.get(i - 1).window().end());
        }
    }

    @Test
    void clipsObservationsBeforeAggregating() {
        ObservationSeries record = ObservationSeries.of(randomDaily(FIRST, LAST, GEOMETRY, 5L));
        List<Window> windows = monthlyGenerator.generate(record.earliest(), record.latest(), SpiOrder.of(12));

        List<SpiResult> results = pipeline.run(windows, record, new SpatialExtent(0.0, 1.0, 1.0, 2.0)).results();

        assertThat(results).isNotEmpty().allSatisfy(r -> {
            assertThat(r.indexGrid().width()).isEqualTo(1);
            assertThat(r.indexGrid().height()).isEqualTo(1);
            assertThat(r.groupKey()).isEqualTo(SeasonalGroupKey.ALL);
        });
    }

    @Test
    void sensorWindowsWithNegativeShiftRunEndToEnd() {
        ObservationSeries record = ObservationSeries.of(randomDaily(FIRST, LAST, GEOMETRY, 13L));
        List<LocalDate> anchors = new ArrayList<>();
        for (int year = 2001; year <= 2008; year++) {
            for (int doy = 1; doy <= 353; doy += 16) {
                anchors.add(LocalDate.ofYearDay(year, doy));
            }
        }
        List<Window> windows = sensorGenerator.generate(anchors, new DayCountPolicy(16, -5));

        SpiPipeline.Outcome outcome = pipeline.run(windows, record);

        assertThat(outcome.droppedWindowCount()).isZero();
        assertThat(outcome.results()).hasSize(anchors.size());
        assertThat(outcome.results().get(0).window().start()).isEqualTo(LocalDate.of(2000, 12, 27));
        assertThat(outcome.results()).allSatisfy(r -> {
            assertThat(r.usedCount()).isEqualTo(16);
            assertThat(r.groupSize()).isEqualTo(8);
        });
    }

    @Test
    void noWindowsYieldEmptyOutcome() {
        ObservationSeries record = ObservationSeries.of(randomDaily(FIRST, FIRST.plusDays(3), GEOMETRY, 1L));

        SpiPipeline.Outcome outcome = pipeline.run(List.of(), record);

        assertThat(outcome.results()).isEmpty();
        assertThat(outcome.windowCount()).isZero();
    }
}
