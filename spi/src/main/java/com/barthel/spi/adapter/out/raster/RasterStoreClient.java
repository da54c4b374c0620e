package com.barthel.spi.adapter.out.raster;

import com.barthel.spi.application.port.out.FetchAnchorDatesPort;
import com.barthel.spi.application.port.out.FetchObservationsPort;
import com.barthel.spi.config.SpiProperties;
import com.barthel.spi.domain.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.LocalDate;
import java.util.List;

/**
 * WebClient based adapter reading precipitation grids and sensor capture dates from the
 * raster store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RasterStoreClient implements FetchObservationsPort, FetchAnchorDatesPort {

    private final WebClient rasterWebClient;
    private final SpiProperties properties;

    @Override
    public List<Observation> fetchObservations(DateRange range) {
        log.info("Fetching precipitation grids from={}, to={}", range.from(), range.to());
        ObservationsResponse response = rasterWebClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/observations")
                        .queryParam("from", range.from())
                        .queryParam("to", range.to())
                        .build())
                .retrieve()
                .bodyToMono(ObservationsResponse.class)
                .block();
        if (response == null || response.observations() == null) {
            return List.of();
        }
        return response.observations().stream()
                .map(ObservationDto::toObservation)
                .toList();
    }

    @Override
    public List<LocalDate> fetchAnchorDates(DateRange range) {
        String sensor = properties.getRaster().getSensor();
        log.info("Fetching capture dates for sensor={}, from={}, to={}", sensor, range.from(), range.to());
        AnchorsResponse response = rasterWebClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/anchors")
                        .queryParam("sensor", sensor)
                        .queryParam("from", range.from())
                        .queryParam("to", range.to())
                        .build())
                .retrieve()
                .bodyToMono(AnchorsResponse.class)
                .block();
        return response == null || response.dates() == null ? List.of() : List.copyOf(response.dates());
    }

    private record ObservationsResponse(List<ObservationDto> observations) {}

    private record AnchorsResponse(List<LocalDate> dates) {}

    private record ObservationDto(LocalDate date, double originX, double originY, double cellSize,
                                  int width, int height, List<Double> values) {

        Observation toObservation() {
            if (values == null) {
                throw new IllegalStateException("Raster store returned no values for " + date);
            }
            double[] cells = new double[values.size()];
            for (int i = 0; i < cells.length; i++) {
                Double v = values.get(i);
                cells[i] = v == null ? Grid.UNDEFINED : v;
            }
            GridGeometry geometry = new GridGeometry(originX, originY, cellSize, width, height);
            return new Observation(date, new Grid(geometry, cells));
        }
    }
}
