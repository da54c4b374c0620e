package com.barthel.spi;

import com.barthel.spi.application.port.in.ComputeSpiUseCase;
import com.barthel.spi.application.port.out.FetchAnchorDatesPort;
import com.barthel.spi.application.port.out.FetchObservationsPort;
import com.barthel.spi.application.port.out.StoreSpiResultsPort;
import com.barthel.spi.application.service.SpiComputationServiceRouter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "spring.autoconfigure.exclude=org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration"
})
class SpiApplicationTests {

    @MockBean
    private FetchObservationsPort fetchObservationsPort;

    @MockBean
    private FetchAnchorDatesPort fetchAnchorDatesPort;

    @MockBean
    private StoreSpiResultsPort storeSpiResultsPort;

    @Autowired
    private ComputeSpiUseCase computeSpiUseCase;

    @Test
    void contextLoads() {
        assertThat(computeSpiUseCase).isInstanceOf(SpiComputationServiceRouter.class);
    }

}
