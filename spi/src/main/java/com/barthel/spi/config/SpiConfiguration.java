package com.barthel.spi.config;

import com.barthel.spi.domain.service.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(SpiProperties.class)
@Slf4j
public class SpiConfiguration {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService spiExecutor(SpiProperties properties) {
        int threads = Math.max(1, properties.getParallelism());
        log.info("Starting SPI executor with {} threads", threads);
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "spi-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    @Bean
    public MonthlyWindowGenerator monthlyWindowGenerator() {
        return new MonthlyWindowGenerator();
    }

    @Bean
    public SensorWindowGenerator sensorWindowGenerator() {
        return new SensorWindowGenerator();
    }

    @Bean
    public SpiPipeline spiPipeline(ExecutorService spiExecutor, SpiProperties properties) {
        SpiProperties.Baseline baseline = properties.getBaseline();
        return new SpiPipeline(
                spiExecutor,
                new WindowAggregator(),
                new BaselineStatisticsEngine(baseline.getMinGroupSize(), baseline.getStrictness()),
                new SpiNormalizer());
    }

    @Bean
    public WebClient rasterWebClient(SpiProperties properties) {
        return WebClient.builder()
                .baseUrl(properties.getRaster().getBaseUrl())
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(64 * 1024 * 1024))
                .build();
    }
}
